package com.ukulele.common.overlay.discover.node.statistics;

import com.ukulele.core.net.message.MessageTypes;

/**
 * Counters of the block synchronization protocol. Dropped items are counted by reason so that
 * silent failures stay observable.
 */
public class SyncStatistics {

  // inbound
  public final MessageCount syncInMessage = new MessageCount();
  public final MessageCount syncInInventoryRequest = new MessageCount();
  public final MessageCount syncInInventoryResponse = new MessageCount();
  public final MessageCount syncInDataRequest = new MessageCount();
  public final MessageCount syncInDataResponse = new MessageCount();

  // outbound
  public final MessageCount syncOutInventoryResponse = new MessageCount();
  public final MessageCount syncOutInventoryElement = new MessageCount();
  public final MessageCount syncOutDataResponse = new MessageCount();
  public final MessageCount syncOutDataRequest = new MessageCount();
  public final MessageCount syncOutDataRequestElement = new MessageCount();

  // drops
  public final MessageCount dropMalformed = new MessageCount();
  public final MessageCount dropNotFound = new MessageCount();
  public final MessageCount dropUnsupportedChannel = new MessageCount();
  public final MessageCount dropUnexpectedMessage = new MessageCount();

  // request engine
  public final MessageCount requestRetry = new MessageCount();
  public final MessageCount requestExpired = new MessageCount();
  public final MessageCount blockResolved = new MessageCount();

  // consumer
  public final MessageCount consumerBlock = new MessageCount();
  public final MessageCount consumerVote = new MessageCount();

  public void addInMessage(MessageTypes type) {
    syncInMessage.add();
    switch (type) {
      case INVENTORY_REQUEST:
        syncInInventoryRequest.add();
        break;
      case INVENTORY_RESPONSE:
        syncInInventoryResponse.add();
        break;
      case DATA_REQUEST:
        syncInDataRequest.add();
        break;
      case DATA_RESPONSE:
        syncInDataResponse.add();
        break;
      default:
        break;
    }
  }

  public long getTotalDropCount() {
    return dropMalformed.getTotalCount() + dropNotFound.getTotalCount()
        + dropUnsupportedChannel.getTotalCount() + dropUnexpectedMessage.getTotalCount();
  }

  @Override
  public String toString() {
    return new StringBuilder("Sync stats:\n")
        .append("in: ").append(syncInMessage)
        .append(" (invReq ").append(syncInInventoryRequest)
        .append(", invResp ").append(syncInInventoryResponse)
        .append(", dataReq ").append(syncInDataRequest)
        .append(", dataResp ").append(syncInDataResponse).append(")\n")
        .append("out: invResp ").append(syncOutInventoryResponse)
        .append(" (").append(syncOutInventoryElement).append(" hashes)")
        .append(", dataResp ").append(syncOutDataResponse)
        .append(", dataReq ").append(syncOutDataRequest)
        .append(" (").append(syncOutDataRequestElement).append(" hashes)\n")
        .append("dropped: malformed ").append(dropMalformed)
        .append(", notFound ").append(dropNotFound)
        .append(", unsupportedChannel ").append(dropUnsupportedChannel)
        .append(", unexpected ").append(dropUnexpectedMessage).append('\n')
        .append("requests: retry ").append(requestRetry)
        .append(", expired ").append(requestExpired)
        .append(", resolved ").append(blockResolved).append('\n')
        .append("consumer: blocks ").append(consumerBlock)
        .append(", votes ").append(consumerVote)
        .toString();
  }
}
