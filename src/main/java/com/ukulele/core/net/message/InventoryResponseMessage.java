package com.ukulele.core.net.message;

import com.google.protobuf.InvalidProtocolBufferException;
import com.ukulele.core.exception.BadItemException;
import com.ukulele.protos.Protocol.ChannelId;
import com.ukulele.protos.Protocol.InventoryResponse;
import java.util.List;

public class InventoryResponseMessage extends SyncMessage {

  private InventoryResponse inventoryResponse;

  public InventoryResponseMessage(byte[] data) throws BadItemException {
    super(MessageTypes.INVENTORY_RESPONSE.asByte(), data);
    try {
      this.inventoryResponse = InventoryResponse.parseFrom(data);
    } catch (InvalidProtocolBufferException e) {
      throw new BadItemException("Parse inventory response failed", e);
    }
  }

  public InventoryResponseMessage(ChannelId channelId, List<String> entries) {
    this.inventoryResponse = InventoryResponse.newBuilder()
        .setChannelId(channelId)
        .addAllEntries(entries)
        .build();
    this.type = MessageTypes.INVENTORY_RESPONSE.asByte();
    this.data = inventoryResponse.toByteArray();
  }

  @Override
  public ChannelId getChannelId() {
    return inventoryResponse.getChannelId();
  }

  public List<String> getEntries() {
    return inventoryResponse.getEntriesList();
  }

  @Override
  public String toString() {
    return super.toString() + "entries: " + shortList(getEntries());
  }
}
