package com.ukulele.common.overlay.server;

import com.ukulele.common.net.NetAddress;
import lombok.extern.slf4j.Slf4j;

/**
 * Handle of one remote participant. A peer is created when a connection is established and is
 * owned by the {@link PeerTable} once added.
 */
@Slf4j
public class Peer {

  public enum PeerState {
    RUNNING,
    STOPPED
  }

  private final String id;

  private final NetAddress netAddress;

  private final boolean outbound;

  private final AutoCloseable connection;

  private volatile boolean seed;

  private volatile PeerState state = PeerState.RUNNING;

  public Peer(String id, NetAddress netAddress, boolean outbound, AutoCloseable connection) {
    this.id = id;
    this.netAddress = netAddress;
    this.outbound = outbound;
    this.connection = connection;
  }

  public Peer(String id, NetAddress netAddress, boolean outbound) {
    this(id, netAddress, outbound, null);
  }

  public String getId() {
    return id;
  }

  public NetAddress getNetAddress() {
    return netAddress;
  }

  public boolean isOutbound() {
    return outbound;
  }

  public boolean isSeed() {
    return seed;
  }

  public void setSeed(boolean seed) {
    this.seed = seed;
  }

  public PeerState getState() {
    return state;
  }

  public boolean isStopped() {
    return state == PeerState.STOPPED;
  }

  /**
   * Stop the peer and release its connection. Closing is best-effort, a failure is only logged.
   */
  public void stop() {
    synchronized (this) {
      if (state == PeerState.STOPPED) {
        return;
      }
      state = PeerState.STOPPED;
    }
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (Exception e) {
      logger.warn("Failed to close connection of peer {} at {}: {}", id, netAddress,
          e.getMessage());
    }
  }

  @Override
  public String toString() {
    return String.format("Peer[id=%s, addr=%s, outbound=%s, seed=%s, state=%s]",
        id, netAddress, outbound, seed, state);
  }
}
