package com.ukulele.common.overlay.discover.node.statistics;

import lombok.extern.slf4j.Slf4j;

/**
 * Counts events over a sliding window of one-second slots.
 */
@Slf4j
public class MessageCount {

  private static final int SIZE = 60;

  private final int[] szCount = new int[SIZE];

  private long indexTime = System.currentTimeMillis() / 1000;

  private int index = (int) (indexTime % SIZE);

  private long totalCount = 0;

  private synchronized void update() {
    long time = System.currentTimeMillis() / 1000;
    long gap = time - indexTime;
    int k = gap < SIZE ? (int) gap : SIZE;
    if (k > 0) {
      for (int i = 1; i <= k; i++) {
        szCount[(index + i) % SIZE] = 0;
      }
      index = (int) (time % SIZE);
      indexTime = time;
    }
  }

  public synchronized void add() {
    update();
    szCount[index]++;
    totalCount++;
  }

  public synchronized void add(int count) {
    update();
    szCount[index] += count;
    totalCount += count;
  }

  /**
   * Number of events during the last {@code interval} seconds, current second included.
   */
  public synchronized int getCount(int interval) {
    if (interval > SIZE) {
      logger.warn("Param interval({}) is gt SIZE({})", interval, SIZE);
      return 0;
    }
    update();
    int count = 0;
    for (int i = 0; i < interval; i++) {
      count += szCount[(SIZE + index - i) % SIZE];
    }
    return count;
  }

  public synchronized long getTotalCount() {
    return totalCount;
  }

  public synchronized void reset() {
    totalCount = 0;
    for (int i = 0; i < SIZE; i++) {
      szCount[i] = 0;
    }
  }

  @Override
  public String toString() {
    return String.valueOf(getTotalCount());
  }
}
