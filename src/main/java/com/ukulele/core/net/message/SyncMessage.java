package com.ukulele.core.net.message;

import com.ukulele.protos.Protocol.ChannelId;
import java.util.List;
import org.apache.commons.collections4.CollectionUtils;

/**
 * Base of the four block synchronization messages. The wire form is the type byte followed by the
 * protobuf body.
 */
public abstract class SyncMessage {

  protected byte[] data;

  protected byte type;

  protected SyncMessage() {
  }

  protected SyncMessage(byte type, byte[] data) {
    this.type = type;
    this.data = data;
  }

  public MessageTypes getType() {
    return MessageTypes.fromByte(type);
  }

  public abstract ChannelId getChannelId();

  public byte[] getData() {
    return data;
  }

  public byte[] getSendData() {
    byte[] sendData = new byte[data.length + 1];
    sendData[0] = type;
    System.arraycopy(data, 0, sendData, 1, data.length);
    return sendData;
  }

  @Override
  public String toString() {
    return "type: " + getType() + ", channel: " + getChannelId() + "\n";
  }

  protected static String shortList(List<String> entries) {
    if (CollectionUtils.isEmpty(entries)) {
      return "[]";
    }
    if (entries.size() <= 2) {
      return entries.toString();
    }
    return "[" + entries.get(0) + " ... " + entries.get(entries.size() - 1) + "] size: "
        + entries.size();
  }
}
