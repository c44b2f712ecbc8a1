package com.ukulele.core.chain;

import com.ukulele.common.utils.Sha256Hash;
import com.ukulele.core.capsule.BlockCapsule;
import com.ukulele.core.exception.BadNumberBlockException;
import com.ukulele.core.exception.ItemNotFoundException;
import com.ukulele.core.exception.UnLinkedBlockException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 메모리에 모든 fork를 보관하는 block 저장소. <br/>
 * block을 push하면 parent block의 children 목록에 추가되며, 동기화 과정에서 inventory 요청에 응답할 때
 * 첫 번째 child를 따라 chain을 순회하는 데 사용된다.
 */
@Slf4j
@Component
public class KhaosChain implements Chain {

  private final Map<Sha256Hash, ExtendedBlock> hashBlockMap = new HashMap<>();

  private final TreeMap<Long, List<ExtendedBlock>> numBlockMap = new TreeMap<>();

  private ExtendedBlock root;

  private ExtendedBlock head;

  /**
   * Seeds the chain with its root (usually the genesis block). Any block stored before is
   * discarded.
   */
  public synchronized void start(BlockCapsule blk) {
    hashBlockMap.clear();
    numBlockMap.clear();
    root = new ExtendedBlock(blk);
    head = root;
    insert(root);
  }

  /**
   * Push the block into the chain and link it to its parent.
   *
   * @throws UnLinkedBlockException if the parent block is unknown
   * @throws BadNumberBlockException if the height does not follow the parent height
   */
  public synchronized ExtendedBlock push(BlockCapsule blk)
      throws UnLinkedBlockException, BadNumberBlockException {
    ExtendedBlock existing = hashBlockMap.get(blk.getBlockId());
    if (existing != null) {
      return existing;
    }
    ExtendedBlock block = new ExtendedBlock(blk);
    if (root != null) {
      ExtendedBlock parent = hashBlockMap.get(blk.getParentHash());
      if (parent == null) {
        throw new UnLinkedBlockException("parent " + blk.getParentHash() + " of block "
            + blk.getBlockId() + " not found");
      }
      if (blk.getNum() != parent.getBlock().getNum() + 1) {
        throw new BadNumberBlockException(
            "parent number :" + parent.getBlock().getNum() + ",block number :" + blk.getNum());
      }
      parent.addChild(block.getHash());
    } else {
      root = block;
    }
    insert(block);

    if (head == null || blk.getNum() > head.getBlock().getNum()) {
      head = block;
    }
    logger.debug("Push block {}, head {}", block, head.getHash());
    return block;
  }

  @Override
  public synchronized ExtendedBlock findBlock(Sha256Hash hash) throws ItemNotFoundException {
    ExtendedBlock block = hashBlockMap.get(hash);
    if (block == null) {
      throw new ItemNotFoundException("block " + hash + " not found");
    }
    return block;
  }

  @Override
  public synchronized boolean containBlock(Sha256Hash hash) {
    return hashBlockMap.containsKey(hash);
  }

  public synchronized BlockCapsule getHead() {
    return head == null ? null : head.getBlock();
  }

  public synchronized List<BlockCapsule> getBlocksByNum(long num) {
    List<ExtendedBlock> blocks = numBlockMap.get(num);
    if (blocks == null) {
      return Collections.emptyList();
    }
    List<BlockCapsule> result = new ArrayList<>(blocks.size());
    blocks.forEach(b -> result.add(b.getBlock()));
    return result;
  }

  public synchronized int size() {
    return hashBlockMap.size();
  }

  private void insert(ExtendedBlock block) {
    hashBlockMap.put(block.getHash(), block);
    numBlockMap.computeIfAbsent(block.getBlock().getNum(), num -> new ArrayList<>()).add(block);
  }
}
