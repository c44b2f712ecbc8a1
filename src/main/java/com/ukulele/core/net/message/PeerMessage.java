package com.ukulele.core.net.message;

import com.ukulele.protos.Protocol.ChannelId;
import lombok.Getter;

/**
 * A sync message together with the peer it came from (or goes to) and the channel it travels on.
 */
@Getter
public class PeerMessage {

  private final String peerId;

  private final ChannelId channelId;

  private final SyncMessage message;

  public PeerMessage(String peerId, ChannelId channelId, SyncMessage message) {
    this.peerId = peerId;
    this.channelId = channelId;
    this.message = message;
  }

  @Override
  public String toString() {
    return "peer: " + peerId + ", channel: " + channelId + ", " + message;
  }
}
