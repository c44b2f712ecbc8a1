package com.ukulele.core.net.node;

import com.ukulele.core.exception.P2pException;
import com.ukulele.core.net.message.PeerMessage;
import com.ukulele.core.net.message.SyncMessage;
import com.ukulele.protos.Protocol.ChannelId;
import java.util.List;

/**
 * A protocol reactor registered with the transport for a set of channels.
 */
public interface MessageHandler {

  List<ChannelId> getChannelIds();

  PeerMessage parseMessage(String peerId, ChannelId channelId, byte[] rawMessage)
      throws P2pException;

  byte[] encodeMessage(SyncMessage message);

  void handleMessage(PeerMessage message) throws InterruptedException;
}
