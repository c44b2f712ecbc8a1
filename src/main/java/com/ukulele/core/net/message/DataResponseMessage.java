package com.ukulele.core.net.message;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.ukulele.core.exception.BadItemException;
import com.ukulele.protos.Protocol.ChannelId;
import com.ukulele.protos.Protocol.DataResponse;

/**
 * Carries one serialized item. The payload is decoded according to the channel.
 */
public class DataResponseMessage extends SyncMessage {

  private DataResponse dataResponse;

  public DataResponseMessage(byte[] data) throws BadItemException {
    super(MessageTypes.DATA_RESPONSE.asByte(), data);
    try {
      this.dataResponse = DataResponse.parseFrom(data);
    } catch (InvalidProtocolBufferException e) {
      throw new BadItemException("Parse data response failed", e);
    }
  }

  public DataResponseMessage(ChannelId channelId, byte[] payload) {
    this.dataResponse = DataResponse.newBuilder()
        .setChannelId(channelId)
        .setPayload(ByteString.copyFrom(payload))
        .build();
    this.type = MessageTypes.DATA_RESPONSE.asByte();
    this.data = dataResponse.toByteArray();
  }

  @Override
  public ChannelId getChannelId() {
    return dataResponse.getChannelId();
  }

  public byte[] getPayload() {
    return dataResponse.getPayload().toByteArray();
  }

  @Override
  public String toString() {
    return super.toString() + "payload size: " + dataResponse.getPayload().size();
  }
}
