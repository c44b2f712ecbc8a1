package com.ukulele.core.net.dispatcher;

import com.ukulele.core.net.message.DataRequestMessage;
import com.ukulele.core.net.message.DataResponseMessage;
import com.ukulele.core.net.message.InventoryResponseMessage;
import java.util.List;

/**
 * Outbound side of the sync protocol, provided by the node hosting the sync manager. Each call
 * sends one message to every listed peer. Sending is fire and forget: a failure towards one peer
 * is the dispatcher's concern.
 */
public interface Dispatcher {

  void sendInventory(List<String> peerIds, InventoryResponseMessage response);

  void getData(List<String> peerIds, DataRequestMessage request);

  void sendData(List<String> peerIds, DataResponseMessage response);
}
