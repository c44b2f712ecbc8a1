package com.ukulele.core;

public class Constant {

  // config for testnet, mainnet
  public static final String TEST_CONF = "config-test.conf";
  public static final String CONFIG_CONF = "config.conf";

  // MDC key holding the node id when log.printSelfId is set
  public static final String LOG_ID_KEY = "id";
}
