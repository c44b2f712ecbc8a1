package com.ukulele.core.net.message;

import com.ukulele.core.exception.BadItemException;
import com.ukulele.core.exception.P2pException;
import com.ukulele.core.exception.P2pException.TypeEnum;
import java.util.Arrays;

/**
 * Builds a {@link SyncMessage} from its wire form.
 */
public class SyncMessageFactory {

  private static final String DATA_LEN = ", len=";

  private SyncMessageFactory() {
  }

  public static SyncMessage create(byte[] data) throws P2pException {
    if (data == null || data.length == 0) {
      throw new P2pException(TypeEnum.PARSE_MESSAGE_FAILED, "empty message");
    }
    byte type = data[0];
    byte[] rawData = Arrays.copyOfRange(data, 1, data.length);
    try {
      return create(type, rawData);
    } catch (BadItemException e) {
      throw new P2pException(TypeEnum.PARSE_MESSAGE_FAILED,
          "type=" + type + DATA_LEN + data.length + ", error: " + e.getMessage(), e);
    }
  }

  private static SyncMessage create(byte type, byte[] packed)
      throws P2pException, BadItemException {
    MessageTypes receivedTypes = MessageTypes.fromByte(type);
    if (receivedTypes == null) {
      throw new P2pException(TypeEnum.NO_SUCH_MESSAGE,
          "type=" + type + DATA_LEN + packed.length);
    }
    switch (receivedTypes) {
      case INVENTORY_REQUEST:
        return new InventoryRequestMessage(packed);
      case INVENTORY_RESPONSE:
        return new InventoryResponseMessage(packed);
      case DATA_REQUEST:
        return new DataRequestMessage(packed);
      case DATA_RESPONSE:
        return new DataResponseMessage(packed);
      default:
        throw new P2pException(TypeEnum.NO_SUCH_MESSAGE,
            receivedTypes.toString() + DATA_LEN + packed.length);
    }
  }
}
