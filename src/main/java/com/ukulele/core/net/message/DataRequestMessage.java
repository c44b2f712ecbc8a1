package com.ukulele.core.net.message;

import com.google.protobuf.InvalidProtocolBufferException;
import com.ukulele.core.exception.BadItemException;
import com.ukulele.protos.Protocol.ChannelId;
import com.ukulele.protos.Protocol.DataRequest;
import java.util.List;

public class DataRequestMessage extends SyncMessage {

  private DataRequest dataRequest;

  public DataRequestMessage(byte[] data) throws BadItemException {
    super(MessageTypes.DATA_REQUEST.asByte(), data);
    try {
      this.dataRequest = DataRequest.parseFrom(data);
    } catch (InvalidProtocolBufferException e) {
      throw new BadItemException("Parse data request failed", e);
    }
  }

  public DataRequestMessage(ChannelId channelId, List<String> entries) {
    this.dataRequest = DataRequest.newBuilder()
        .setChannelId(channelId)
        .addAllEntries(entries)
        .build();
    this.type = MessageTypes.DATA_REQUEST.asByte();
    this.data = dataRequest.toByteArray();
  }

  @Override
  public ChannelId getChannelId() {
    return dataRequest.getChannelId();
  }

  public List<String> getEntries() {
    return dataRequest.getEntriesList();
  }

  @Override
  public String toString() {
    return super.toString() + "entries: " + shortList(getEntries());
  }
}
