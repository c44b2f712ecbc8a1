package com.ukulele.common.utils;

import org.spongycastle.util.encoders.DecoderException;
import org.spongycastle.util.encoders.Hex;

public class ByteArray {

  public static final byte[] EMPTY_BYTE_ARRAY = new byte[0];

  private ByteArray() {
  }

  public static String toHexString(byte[] data) {
    return data == null ? "" : Hex.toHexString(data);
  }

  /**
   * get bytes data from hex string data.
   *
   * @throws IllegalArgumentException if the string is not valid hex
   */
  public static byte[] fromHexString(String data) {
    if (data == null) {
      return EMPTY_BYTE_ARRAY;
    }
    if (data.startsWith("0x")) {
      data = data.substring(2);
    }
    if (data.length() % 2 != 0) {
      throw new IllegalArgumentException("odd length hex string: " + data);
    }
    try {
      return Hex.decode(data);
    } catch (DecoderException e) {
      throw new IllegalArgumentException("invalid hex string: " + data, e);
    }
  }

  public static boolean isEmpty(byte[] input) {
    return input == null || input.length == 0;
  }
}
