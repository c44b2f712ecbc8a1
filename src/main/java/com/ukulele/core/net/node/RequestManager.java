package com.ukulele.core.net.node;

import static com.ukulele.core.config.Parameter.NetConstants.MAX_BLOCKS_FETCH_FROM_ONE_PEER;
import static com.ukulele.core.config.Parameter.NetConstants.RESOLVED_CACHE_SIZE;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.ukulele.common.overlay.discover.node.statistics.SyncStatistics;
import com.ukulele.common.utils.Sha256Hash;
import com.ukulele.core.Constant;
import com.ukulele.core.capsule.BlockCapsule;
import com.ukulele.core.chain.Chain;
import com.ukulele.core.net.dispatcher.Dispatcher;
import com.ukulele.core.net.message.DataRequestMessage;
import com.ukulele.protos.Protocol.ChannelId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Keeps track of the block hashes the node wants but does not have yet, together with the peers
 * that advertised them, and fetches them. <br/>
 * 요청은 주기적으로 peer별로 묶어서 전송하며, timeout된 요청은 다음 후보 peer로 다시 요청한다. 수신한 block은
 * completion queue에 한 번만 추가된다.
 */
@Slf4j
public class RequestManager {

  enum RequestState {
    PENDING, IN_FLIGHT
  }

  @Getter
  static class PendingHash {

    private final Sha256Hash hash;

    private final Set<String> peers = new LinkedHashSet<>();

    private final long createTime;

    private RequestState state = RequestState.PENDING;

    private int attempts;

    private long lastAttemptTime;

    private int cursor;

    PendingHash(Sha256Hash hash, long createTime) {
      this.hash = hash;
      this.createTime = createTime;
    }

    void addPeers(Collection<String> peerIds) {
      peers.addAll(peerIds);
    }

    String currentPeer() {
      List<String> candidates = new ArrayList<>(peers);
      return candidates.get(cursor % candidates.size());
    }

    void markInFlight(long now) {
      state = RequestState.IN_FLIGHT;
      attempts++;
      lastAttemptTime = now;
    }

    // back to PENDING, the next attempt goes to the next candidate
    void rearm() {
      state = RequestState.PENDING;
      cursor++;
    }
  }

  private final Chain chain;

  private final Dispatcher dispatcher;

  private final SyncStatistics statistics;

  private final long requestInterval;

  private final long requestTimeout;

  private final long pendingExpiration;

  // node id for the MDC, null when not printed
  private final String logId;

  private final Object lock = new Object();

  // insertion order is the order hashes were first wanted
  private final Map<Sha256Hash, PendingHash> pendingHashes = new LinkedHashMap<>();

  private final Cache<Sha256Hash, Boolean> resolvedHashes = CacheBuilder.newBuilder()
      .maximumSize(RESOLVED_CACHE_SIZE).build();

  @Getter
  private final BlockingQueue<BlockCapsule> completed = new LinkedBlockingQueue<>();

  private ScheduledExecutorService requestExecutor;

  public RequestManager(Chain chain, Dispatcher dispatcher, SyncStatistics statistics,
      long requestInterval, long requestTimeout, long pendingExpiration, String logId) {
    this.chain = chain;
    this.dispatcher = dispatcher;
    this.statistics = statistics;
    this.requestInterval = requestInterval;
    this.requestTimeout = requestTimeout;
    this.pendingExpiration = pendingExpiration;
    this.logId = logId;
  }

  public synchronized void start() {
    if (requestExecutor != null && !requestExecutor.isShutdown()) {
      return;
    }
    requestExecutor = Executors.newSingleThreadScheduledExecutor(
        r -> new Thread(r, "sync-request"));
    requestExecutor.scheduleWithFixedDelay(() -> {
      if (logId != null) {
        MDC.put(Constant.LOG_ID_KEY, logId);
      }
      try {
        tryRequest(System.currentTimeMillis());
      } catch (Throwable t) {
        logger.error("Exception in request worker", t);
      }
    }, requestInterval, requestInterval, TimeUnit.MILLISECONDS);
    logger.info("Request manager started, interval {}ms, timeout {}ms", requestInterval,
        requestTimeout);
  }

  public synchronized void stop() {
    if (requestExecutor != null && !requestExecutor.isShutdown()) {
      requestExecutor.shutdownNow();
      logger.info("Request manager stopped");
    }
  }

  public void await() throws InterruptedException {
    ScheduledExecutorService executor;
    synchronized (this) {
      executor = requestExecutor;
    }
    if (executor != null) {
      executor.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
    }
  }

  /**
   * Registers a wanted hash. Hashes already delivered or already in the chain are ignored, hints
   * for a hash already pending are merged. An empty peer list leaves the entry dormant until some
   * peer advertises it.
   */
  public void addHash(Sha256Hash hash, Collection<String> peerIds) {
    if (chain.containBlock(hash)) {
      forget(hash);
      return;
    }
    synchronized (lock) {
      if (resolvedHashes.getIfPresent(hash) != null) {
        return;
      }
      PendingHash pending = pendingHashes.get(hash);
      if (pending == null) {
        pending = new PendingHash(hash, System.currentTimeMillis());
        pendingHashes.put(hash, pending);
        logger.debug("Add pending hash {}, candidates {}", hash, peerIds);
      }
      pending.addPeers(peerIds);
    }
  }

  /**
   * Accepts a received block.
   *
   * @return true if the block was new and has been queued for delivery
   */
  public boolean addBlock(BlockCapsule block) {
    Sha256Hash hash = block.getBlockId();
    if (chain.containBlock(hash)) {
      logger.debug("Block {} already in chain", hash);
      forget(hash);
      return false;
    }
    Sha256Hash parentHash = block.getParentHash();
    boolean parentInChain = Sha256Hash.ZERO_HASH.equals(parentHash)
        || chain.containBlock(parentHash);

    synchronized (lock) {
      if (resolvedHashes.getIfPresent(hash) != null) {
        logger.debug("Block {} already resolved", hash);
        return false;
      }
      PendingHash satisfied = pendingHashes.remove(hash);
      resolvedHashes.put(hash, Boolean.TRUE);

      if (!parentInChain
          && resolvedHashes.getIfPresent(parentHash) == null
          && !pendingHashes.containsKey(parentHash)) {
        PendingHash parent = new PendingHash(parentHash, System.currentTimeMillis());
        if (satisfied != null) {
          parent.addPeers(satisfied.getPeers());
        }
        pendingHashes.put(parentHash, parent);
        logger.debug("Parent {} of block {} unknown, fetch it from {}", parentHash, hash,
            parent.getPeers());
      }
    }

    completed.offer(block);
    statistics.blockResolved.add();
    return true;
  }

  // the block reached the chain without this manager, stop fetching it
  private void forget(Sha256Hash hash) {
    synchronized (lock) {
      if (pendingHashes.remove(hash) != null) {
        logger.debug("Drop pending hash {}, already in chain", hash);
      }
    }
  }

  /**
   * Runs one pass of the request loop at time {@code now}: expires old entries, re-arms timed out
   * requests and sends the pending ones grouped per peer.
   */
  void tryRequest(long now) {
    Map<String, List<String>> sendList = new HashMap<>();
    synchronized (lock) {
      Iterator<PendingHash> iterator = pendingHashes.values().iterator();
      while (iterator.hasNext()) {
        PendingHash pending = iterator.next();
        if (now - pending.getCreateTime() > pendingExpiration) {
          logger.info("Give up fetching {} after {} attempts", pending.getHash(),
              pending.getAttempts());
          iterator.remove();
          statistics.requestExpired.add();
          continue;
        }
        if (pending.getState() == RequestState.IN_FLIGHT) {
          if (now - pending.getLastAttemptTime() <= requestTimeout) {
            continue;
          }
          logger.debug("Request for {} timeout, attempts {}", pending.getHash(),
              pending.getAttempts());
          pending.rearm();
          statistics.requestRetry.add();
        }
        if (pending.getPeers().isEmpty()) {
          continue;
        }
        String peerId = pending.currentPeer();
        List<String> hashes = sendList.computeIfAbsent(peerId, k -> new ArrayList<>());
        if (hashes.size() >= MAX_BLOCKS_FETCH_FROM_ONE_PEER) {
          continue;
        }
        hashes.add(pending.getHash().toString());
        pending.markInFlight(now);
      }
    }

    sendList.forEach((peerId, hashes) -> {
      try {
        dispatcher.getData(Collections.singletonList(peerId),
            new DataRequestMessage(ChannelId.BLOCK, hashes));
        statistics.syncOutDataRequest.add();
        statistics.syncOutDataRequestElement.add(hashes.size());
        logger.debug("Request {} blocks from peer {}", hashes.size(), peerId);
      } catch (Exception e) {
        logger.error("Send data request to peer {} failed", peerId, e);
      }
    });
  }

  public int getPendingCount() {
    synchronized (lock) {
      return pendingHashes.size();
    }
  }

  public boolean isPending(Sha256Hash hash) {
    synchronized (lock) {
      return pendingHashes.containsKey(hash);
    }
  }

  public boolean isInFlight(Sha256Hash hash) {
    synchronized (lock) {
      PendingHash pending = pendingHashes.get(hash);
      return pending != null && pending.getState() == RequestState.IN_FLIGHT;
    }
  }
}
