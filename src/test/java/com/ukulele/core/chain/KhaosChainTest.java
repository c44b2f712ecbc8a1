package com.ukulele.core.chain;

import com.ukulele.common.utils.Sha256Hash;
import com.ukulele.core.capsule.BlockCapsule;
import com.ukulele.core.capsule.utils.BlockUtil;
import com.ukulele.core.exception.BadNumberBlockException;
import com.ukulele.core.exception.ItemNotFoundException;
import com.ukulele.core.exception.UnLinkedBlockException;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

@Slf4j
public class KhaosChainTest {

  private KhaosChain khaosChain;

  private BlockCapsule genesis;

  @Before
  public void init() {
    khaosChain = new KhaosChain();
    genesis = BlockUtil.newGenesisBlockCapsule();
    khaosChain.start(genesis);
  }

  @Test
  public void testStartBlock() throws ItemNotFoundException {
    Assert.assertEquals(genesis, khaosChain.findBlock(genesis.getBlockId()).getBlock());
    Assert.assertEquals(genesis, khaosChain.getHead());
    Assert.assertEquals(1, khaosChain.size());
  }

  @Test
  public void testPushLinksChildren() throws Exception {
    BlockCapsule a = BlockUtil.newBlock(genesis, "a");
    BlockCapsule b = BlockUtil.newBlock(genesis, "b");
    khaosChain.push(a);
    khaosChain.push(b);
    khaosChain.push(a);

    ExtendedBlock root = khaosChain.findBlock(genesis.getBlockId());
    Assert.assertEquals(2, root.getChildren().size());
    Assert.assertEquals(a.getBlockId(), root.getChildren().get(0));
    Assert.assertEquals(2, khaosChain.getBlocksByNum(1).size());
    Assert.assertTrue(khaosChain.containBlock(b.getBlockId()));
    Assert.assertEquals(3, khaosChain.size());
  }

  @Test
  public void testHeadFollowsHighestBlock() throws Exception {
    List<BlockCapsule> blocks = BlockUtil.newChain(genesis, 3);
    for (BlockCapsule block : blocks) {
      khaosChain.push(block);
    }
    Assert.assertEquals(blocks.get(2), khaosChain.getHead());
    Assert.assertTrue(khaosChain.getBlocksByNum(7).isEmpty());
  }

  @Test(expected = UnLinkedBlockException.class)
  public void testUnlinkedBlock() throws Exception {
    BlockCapsule orphan = new BlockCapsule(1, Sha256Hash.of(new byte[]{1}), 1, 1, "x",
        Collections.emptyList());
    khaosChain.push(orphan);
  }

  @Test(expected = BadNumberBlockException.class)
  public void testBadNumberBlock() throws Exception {
    BlockCapsule wrongHeight = new BlockCapsule(5, genesis.getBlockId(), 1, 1, "x",
        Collections.emptyList());
    khaosChain.push(wrongHeight);
  }

  @Test(expected = ItemNotFoundException.class)
  public void testFindUnknownBlock() throws ItemNotFoundException {
    khaosChain.findBlock(Sha256Hash.of(new byte[]{2}));
  }
}
