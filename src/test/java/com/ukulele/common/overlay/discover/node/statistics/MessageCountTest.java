package com.ukulele.common.overlay.discover.node.statistics;

import com.ukulele.core.net.message.MessageTypes;
import lombok.extern.slf4j.Slf4j;
import org.junit.Assert;
import org.junit.Test;

@Slf4j
public class MessageCountTest {

  @Test
  public void testCount() {
    MessageCount count = new MessageCount();
    count.add();
    count.add(4);
    Assert.assertEquals(5, count.getTotalCount());
    Assert.assertEquals(5, count.getCount(60));
    Assert.assertEquals(0, count.getCount(61));

    count.reset();
    Assert.assertEquals(0, count.getTotalCount());
    Assert.assertEquals(0, count.getCount(10));
  }

  @Test
  public void testSyncStatistics() {
    SyncStatistics statistics = new SyncStatistics();
    statistics.addInMessage(MessageTypes.DATA_REQUEST);
    statistics.addInMessage(MessageTypes.DATA_REQUEST);
    statistics.addInMessage(MessageTypes.INVENTORY_RESPONSE);
    statistics.dropMalformed.add();
    statistics.dropNotFound.add(2);

    Assert.assertEquals(3, statistics.syncInMessage.getTotalCount());
    Assert.assertEquals(2, statistics.syncInDataRequest.getTotalCount());
    Assert.assertEquals(1, statistics.syncInInventoryResponse.getTotalCount());
    Assert.assertEquals(3, statistics.getTotalDropCount());
    Assert.assertTrue(statistics.toString().contains("notFound 2"));
  }
}
