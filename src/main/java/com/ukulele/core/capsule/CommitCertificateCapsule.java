package com.ukulele.core.capsule;

import com.ukulele.common.utils.Sha256Hash;
import com.ukulele.protos.Protocol.CommitCertificate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregated votes proving that a block has been committed.
 */
public class CommitCertificateCapsule implements ProtoCapsule<CommitCertificate> {

  private final CommitCertificate commitCertificate;

  public CommitCertificateCapsule(CommitCertificate commitCertificate) {
    this.commitCertificate = commitCertificate;
  }

  public CommitCertificateCapsule(Sha256Hash blockHash, List<VoteCapsule> votes) {
    this.commitCertificate = CommitCertificate.newBuilder()
        .setBlockHash(blockHash.getByteString())
        .addAllVotes(votes.stream().map(VoteCapsule::getInstance).collect(Collectors.toList()))
        .build();
  }

  public Sha256Hash getBlockHash() {
    return Sha256Hash.wrap(commitCertificate.getBlockHash());
  }

  public List<VoteCapsule> getVotes() {
    return commitCertificate.getVotesList().stream()
        .map(VoteCapsule::new)
        .collect(Collectors.toList());
  }

  @Override
  public byte[] getData() {
    return commitCertificate.toByteArray();
  }

  @Override
  public CommitCertificate getInstance() {
    return commitCertificate;
  }

  @Override
  public String toString() {
    return "CommitCertificateCapsule [block=" + getBlockHash()
        + ", votes=" + commitCertificate.getVotesCount() + "]";
  }
}
