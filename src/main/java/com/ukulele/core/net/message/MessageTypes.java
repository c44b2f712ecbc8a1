package com.ukulele.core.net.message;

import java.util.HashMap;
import java.util.Map;

public enum MessageTypes {

  INVENTORY_REQUEST(0x01),

  INVENTORY_RESPONSE(0x02),

  DATA_REQUEST(0x03),

  DATA_RESPONSE(0x04);

  private final int type;

  private static final Map<Integer, MessageTypes> intToTypeMap = new HashMap<>();

  static {
    for (MessageTypes value : values()) {
      intToTypeMap.put(value.type, value);
    }
  }

  MessageTypes(int type) {
    this.type = type;
  }

  /**
   * @return the matching type, null for an unknown byte
   */
  public static MessageTypes fromByte(byte i) {
    return intToTypeMap.get((int) i);
  }

  public byte asByte() {
    return (byte) (type);
  }

  @Override
  public String toString() {
    switch (type) {
      case 0x01:
        return "INV_REQ";
      case 0x02:
        return "INV_RESP";
      case 0x03:
        return "DATA_REQ";
      case 0x04:
        return "DATA_RESP";
      default:
        break;
    }
    return super.toString();
  }
}
