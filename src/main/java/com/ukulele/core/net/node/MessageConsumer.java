package com.ukulele.core.net.node;

import com.ukulele.core.capsule.ProtoCapsule;

/**
 * Receives the blocks and votes the sync layer has obtained, normally the consensus engine.
 */
public interface MessageConsumer {

  void addMessage(ProtoCapsule<?> message);
}
