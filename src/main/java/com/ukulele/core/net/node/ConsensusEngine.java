package com.ukulele.core.net.node;

public interface ConsensusEngine {

  /**
   * @return id of the local node
   */
  String getId();
}
