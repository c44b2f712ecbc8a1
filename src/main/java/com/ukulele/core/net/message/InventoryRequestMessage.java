package com.ukulele.core.net.message;

import com.google.protobuf.InvalidProtocolBufferException;
import com.ukulele.core.exception.BadItemException;
import com.ukulele.protos.Protocol.ChannelId;
import com.ukulele.protos.Protocol.InventoryRequest;

/**
 * Asks a peer for the hashes following {@code start}, up to and including {@code end}. An empty
 * end means as many as the peer is willing to return.
 */
public class InventoryRequestMessage extends SyncMessage {

  private InventoryRequest inventoryRequest;

  public InventoryRequestMessage(byte[] data) throws BadItemException {
    super(MessageTypes.INVENTORY_REQUEST.asByte(), data);
    try {
      this.inventoryRequest = InventoryRequest.parseFrom(data);
    } catch (InvalidProtocolBufferException e) {
      throw new BadItemException("Parse inventory request failed", e);
    }
  }

  public InventoryRequestMessage(ChannelId channelId, String start, String end) {
    this.inventoryRequest = InventoryRequest.newBuilder()
        .setChannelId(channelId)
        .setStart(start == null ? "" : start)
        .setEnd(end == null ? "" : end)
        .build();
    this.type = MessageTypes.INVENTORY_REQUEST.asByte();
    this.data = inventoryRequest.toByteArray();
  }

  @Override
  public ChannelId getChannelId() {
    return inventoryRequest.getChannelId();
  }

  public String getStart() {
    return inventoryRequest.getStart();
  }

  public String getEnd() {
    return inventoryRequest.getEnd();
  }

  @Override
  public String toString() {
    return super.toString() + "start: " + getStart() + ", end: " + getEnd();
  }
}
