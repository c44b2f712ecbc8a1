package com.ukulele.core.config.args;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.typesafe.config.Config;
import com.ukulele.core.config.Configuration;
import com.ukulele.core.config.Parameter.NodeConstant;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@NoArgsConstructor
public class Args {

  private static final Args INSTANCE = new Args();

  @Parameter(names = {"-c", "--config"}, description = "Config File")
  private String shellConfFileName = "";

  @Getter
  @Parameter(names = {"-h", "--help"}, help = true, description = "HELP message")
  private boolean help = false;

  @Parameter(names = {"--message-queue-size"}, description = "Capacity of the sync message queue")
  private int shellMessageQueueSize = 0;

  @Parameter(names = {"--request-timeout"}, description = "Block request timeout (ms)")
  private long shellRequestTimeout = 0;

  @Parameter(names = {"--print-self-id"}, description = "Print the node id in every log line")
  private boolean shellPrintSelfId = false;

  @Getter
  @Setter
  private int syncMessageQueueSize;

  @Getter
  @Setter
  private long syncRequestInterval;

  @Getter
  @Setter
  private long syncRequestTimeout;

  @Getter
  @Setter
  private long syncPendingExpiration;

  @Getter
  @Setter
  private int syncStatisticsInterval;

  @Getter
  @Setter
  private boolean logPrintSelfId;

  static {
    INSTANCE.applyDefaults();
  }

  public static void clearParam() {
    INSTANCE.shellConfFileName = "";
    INSTANCE.help = false;
    INSTANCE.shellMessageQueueSize = 0;
    INSTANCE.shellRequestTimeout = 0;
    INSTANCE.shellPrintSelfId = false;
    INSTANCE.applyDefaults();
  }

  /**
   * set parameters.
   */
  public static void setParam(final String[] args, final String confFileName) {
    JCommander.newBuilder().addObject(INSTANCE).build().parse(args);
    Config config = Configuration.getByFileName(INSTANCE.shellConfFileName, confFileName);

    INSTANCE.syncMessageQueueSize = config.hasPath("node.sync.messageQueueSize")
        ? config.getInt("node.sync.messageQueueSize") : NodeConstant.SYNC_MESSAGE_QUEUE_SIZE;
    if (INSTANCE.shellMessageQueueSize > 0) {
      INSTANCE.syncMessageQueueSize = INSTANCE.shellMessageQueueSize;
    }

    INSTANCE.syncRequestInterval = config.hasPath("node.sync.requestInterval")
        ? config.getLong("node.sync.requestInterval") : NodeConstant.REQUEST_INTERVAL;

    INSTANCE.syncRequestTimeout = config.hasPath("node.sync.requestTimeout")
        ? config.getLong("node.sync.requestTimeout") : NodeConstant.REQUEST_TIME_OUT;
    if (INSTANCE.shellRequestTimeout > 0) {
      INSTANCE.syncRequestTimeout = INSTANCE.shellRequestTimeout;
    }

    INSTANCE.syncPendingExpiration = config.hasPath("node.sync.pendingExpiration")
        ? config.getLong("node.sync.pendingExpiration") : NodeConstant.PENDING_EXPIRATION;

    INSTANCE.syncStatisticsInterval = config.hasPath("node.sync.statisticsInterval")
        ? config.getInt("node.sync.statisticsInterval") : NodeConstant.STATISTICS_INTERVAL;

    INSTANCE.logPrintSelfId = INSTANCE.shellPrintSelfId
        || (config.hasPath("log.printSelfId") && config.getBoolean("log.printSelfId"));

    if (INSTANCE.syncMessageQueueSize <= 0) {
      throw new IllegalArgumentException(
          "node.sync.messageQueueSize must be positive: " + INSTANCE.syncMessageQueueSize);
    }
    if (INSTANCE.syncRequestInterval <= 0 || INSTANCE.syncRequestTimeout <= 0) {
      throw new IllegalArgumentException("node.sync.requestInterval and "
          + "node.sync.requestTimeout must be positive");
    }

    logger.info("Sync config: queueSize {}, requestInterval {}ms, requestTimeout {}ms, "
            + "pendingExpiration {}ms, statisticsInterval {}s, printSelfId {}",
        INSTANCE.syncMessageQueueSize, INSTANCE.syncRequestInterval,
        INSTANCE.syncRequestTimeout, INSTANCE.syncPendingExpiration,
        INSTANCE.syncStatisticsInterval, INSTANCE.logPrintSelfId);
  }

  public static Args getInstance() {
    return INSTANCE;
  }

  private void applyDefaults() {
    syncMessageQueueSize = NodeConstant.SYNC_MESSAGE_QUEUE_SIZE;
    syncRequestInterval = NodeConstant.REQUEST_INTERVAL;
    syncRequestTimeout = NodeConstant.REQUEST_TIME_OUT;
    syncPendingExpiration = NodeConstant.PENDING_EXPIRATION;
    syncStatisticsInterval = NodeConstant.STATISTICS_INTERVAL;
    logPrintSelfId = false;
  }
}
