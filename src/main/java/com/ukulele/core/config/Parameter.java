package com.ukulele.core.config;

public interface Parameter {

  interface NetConstants {

    // max number of hashes returned by one inventory response
    int MAX_INVENTORY_SIZE = 100;
    int MAX_BLOCKS_FETCH_FROM_ONE_PEER = 100;
    int RESOLVED_CACHE_SIZE = 10_000;
  }

  interface NodeConstant {

    int SYNC_MESSAGE_QUEUE_SIZE = 2000;
    long REQUEST_INTERVAL = 1000L;
    long REQUEST_TIME_OUT = 10_000L;
    long PENDING_EXPIRATION = 10 * 60 * 1000L;
    int STATISTICS_INTERVAL = 60;
  }
}
