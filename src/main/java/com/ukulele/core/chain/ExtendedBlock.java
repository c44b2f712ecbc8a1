package com.ukulele.core.chain;

import com.google.common.collect.ImmutableList;
import com.ukulele.common.utils.Sha256Hash;
import com.ukulele.core.capsule.BlockCapsule;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A block as recorded by the chain, together with the hashes of the children recorded so far in
 * the order they were linked.
 */
public class ExtendedBlock {

  private final BlockCapsule block;

  private final List<Sha256Hash> children = new CopyOnWriteArrayList<>();

  public ExtendedBlock(BlockCapsule block) {
    this.block = block;
  }

  public BlockCapsule getBlock() {
    return block;
  }

  public Sha256Hash getHash() {
    return block.getBlockId();
  }

  public List<Sha256Hash> getChildren() {
    return ImmutableList.copyOf(children);
  }

  void addChild(Sha256Hash child) {
    if (!children.contains(child)) {
      children.add(child);
    }
  }

  @Override
  public String toString() {
    return "ExtendedBlock [" + block.getBlockId() + ", height=" + block.getNum()
        + ", children=" + children.size() + "]";
  }
}
