package com.ukulele.core.capsule;

import com.google.protobuf.InvalidProtocolBufferException;
import com.ukulele.common.utils.Sha256Hash;
import com.ukulele.core.exception.BadItemException;
import com.ukulele.protos.Protocol.BlockRef;
import com.ukulele.protos.Protocol.Vote;

public class VoteCapsule implements ProtoCapsule<Vote> {

  private final Vote vote;

  public VoteCapsule(Vote vote) {
    this.vote = vote;
  }

  public VoteCapsule(byte[] data) throws BadItemException {
    try {
      this.vote = Vote.parseFrom(data);
    } catch (InvalidProtocolBufferException e) {
      throw new BadItemException("Vote proto data parse exception", e);
    }
    if (vote.hasBlock() && vote.getBlock().getHash().size() != Sha256Hash.LENGTH) {
      throw new BadItemException("Vote references a malformed block hash");
    }
  }

  public VoteCapsule(Sha256Hash blockHash, long height, long epoch, String voterId) {
    Vote.Builder builder = Vote.newBuilder().setEpoch(epoch).setVoterId(voterId);
    if (blockHash != null) {
      builder.setBlock(BlockRef.newBuilder()
          .setHash(blockHash.getByteString())
          .setHeight(height));
    }
    this.vote = builder.build();
  }

  /**
   * A vote may be cast for nil, in which case it does not reference a block.
   */
  public boolean hasBlock() {
    return vote.hasBlock();
  }

  public Sha256Hash getBlockHash() {
    return hasBlock() ? Sha256Hash.wrap(vote.getBlock().getHash()) : null;
  }

  public long getEpoch() {
    return vote.getEpoch();
  }

  public String getVoterId() {
    return vote.getVoterId();
  }

  @Override
  public byte[] getData() {
    return vote.toByteArray();
  }

  @Override
  public Vote getInstance() {
    return vote;
  }

  @Override
  public String toString() {
    return "VoteCapsule [voter=" + getVoterId()
        + ", epoch=" + getEpoch()
        + ", block=" + (hasBlock() ? getBlockHash() : "nil") + "]";
  }
}
