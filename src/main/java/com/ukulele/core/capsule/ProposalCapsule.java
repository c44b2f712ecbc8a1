package com.ukulele.core.capsule;

import com.google.protobuf.InvalidProtocolBufferException;
import com.ukulele.core.exception.BadItemException;
import com.ukulele.protos.Protocol.Proposal;

public class ProposalCapsule implements ProtoCapsule<Proposal> {

  private final Proposal proposal;

  public ProposalCapsule(byte[] data) throws BadItemException {
    try {
      this.proposal = Proposal.parseFrom(data);
    } catch (InvalidProtocolBufferException e) {
      throw new BadItemException("Proposal proto data parse exception", e);
    }
    if (!proposal.hasBlock()) {
      throw new BadItemException("Proposal without block");
    }
    BlockCapsule.validate(proposal.getBlock());
  }

  public ProposalCapsule(BlockCapsule block, CommitCertificateCapsule commitCertificate,
      String proposerId) {
    Proposal.Builder builder = Proposal.newBuilder()
        .setBlock(block.getInstance())
        .setProposerId(proposerId);
    if (commitCertificate != null) {
      builder.setCommitCertificate(commitCertificate.getInstance());
    }
    this.proposal = builder.build();
  }

  public BlockCapsule getBlock() {
    return new BlockCapsule(proposal.getBlock());
  }

  public boolean hasCommitCertificate() {
    return proposal.hasCommitCertificate();
  }

  public CommitCertificateCapsule getCommitCertificate() {
    return hasCommitCertificate()
        ? new CommitCertificateCapsule(proposal.getCommitCertificate()) : null;
  }

  public String getProposerId() {
    return proposal.getProposerId();
  }

  @Override
  public byte[] getData() {
    return proposal.toByteArray();
  }

  @Override
  public Proposal getInstance() {
    return proposal;
  }

  @Override
  public String toString() {
    return "ProposalCapsule [proposer=" + getProposerId()
        + ", block=" + getBlock().getBlockId()
        + ", cc=" + hasCommitCertificate() + "]";
  }
}
