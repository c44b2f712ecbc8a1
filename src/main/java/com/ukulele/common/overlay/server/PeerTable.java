package com.ukulele.common.overlay.server;

import com.google.common.collect.Lists;
import com.ukulele.common.net.NetAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * PeerTable은 연결된 peer의 조회 테이블이다. <br/>
 * peer id, network address 두 가지 키로 peer를 조회할 수 있으며, 추가된 순서를 유지하는 list를 통해
 * 순회 순서와 eviction 순서를 결정한다. <br/>
 * 세 가지 view(peerMap, addrMap, peers)는 항상 하나의 lock 안에서 함께 변경된다.
 */
@Slf4j
@Component
public class PeerTable {

  // % of total peers known returned by getSelection.
  static final int GET_SELECTION_PERCENT = 23;

  // min peers that must be returned by getSelection. Useful for bootstrapping.
  static final int MIN_GET_SELECTION = 32;

  // max peers returned by getSelection
  static final int MAX_GET_SELECTION = 250;

  private final Object lock = new Object();

  private final Map<String, Peer> peerMap = new HashMap<>();

  private final Map<NetAddress, Peer> addrMap = new HashMap<>();

  // for iteration with deterministic order
  private final List<Peer> peers = new ArrayList<>();

  /**
   * 동일한 id의 peer가 이미 존재하면 기존 peer를 정지시키고 같은 위치에 신규 peer를 저장한다. <br/>
   * 기존 peer가 outbound 연결이었다면 신규 peer는 기존 peer의 seed 여부를 이어받는다.
   *
   * @return always true
   */
  public boolean addPeer(Peer peer) {
    Peer replaced;
    synchronized (lock) {
      replaced = peerMap.get(peer.getId());
      if (replaced != null) {
        if (replaced.isOutbound()) {
          // an inbound connection replacing an outbound one must not lose the seed flag
          peer.setSeed(replaced.isSeed());
        }
        int idx = peers.indexOf(replaced);
        if (idx >= 0) {
          peers.set(idx, peer);
        } else {
          peers.add(peer);
        }
        removeAddress(replaced);
      } else {
        peers.add(peer);
      }
      peerMap.put(peer.getId(), peer);
      addrMap.put(peer.getNetAddress(), peer);
    }

    if (replaced != null && replaced != peer) {
      logger.warn("Stopping duplicated peer: {}", replaced.getId());
      replaced.stop();
    }
    logger.debug("Add peer {}, total {}", peer, getTotalNumPeers());
    return true;
  }

  public void deletePeer(String peerId) {
    synchronized (lock) {
      Peer peer = peerMap.remove(peerId);
      if (peer == null) {
        return;
      }
      removeAddress(peer);
      peers.remove(peer);
    }
    logger.debug("Delete peer {}", peerId);
  }

  /**
   * Evicts the least recently added peer that is not a seed.
   *
   * @return the evicted peer, or null if every peer is a seed
   */
  public Peer purgeOldestPeer() {
    Peer purged = null;
    synchronized (lock) {
      Iterator<Peer> iterator = peers.iterator();
      while (iterator.hasNext()) {
        Peer peer = iterator.next();
        if (!peer.isSeed()) {
          iterator.remove();
          peerMap.remove(peer.getId());
          removeAddress(peer);
          purged = peer;
          break;
        }
      }
    }
    if (purged != null) {
      logger.info("Purge oldest peer {}", purged);
    }
    return purged;
  }

  public Peer getPeer(String peerId) {
    synchronized (lock) {
      return peerMap.get(peerId);
    }
  }

  public Peer getPeerWithAddr(NetAddress addr) {
    synchronized (lock) {
      return addrMap.get(addr);
    }
  }

  public boolean peerExists(String peerId) {
    synchronized (lock) {
      return peerMap.containsKey(peerId);
    }
  }

  public boolean peerAddrExists(NetAddress addr) {
    synchronized (lock) {
      return addrMap.containsKey(addr);
    }
  }

  public List<Peer> getAllPeers() {
    synchronized (lock) {
      return Lists.newArrayList(peers);
    }
  }

  /**
   * Randomly selects some peers. Suitable for peer-exchange protocols.
   */
  public List<PeerIdAddress> getSelection() {
    List<Peer> copy;
    synchronized (lock) {
      if (peers.isEmpty()) {
        return Collections.emptyList();
      }
      copy = new ArrayList<>(peers);
    }

    int numPeers = selectionSize(copy.size());

    // Fisher-Yates shuffle the list. We only need to do the first
    // numPeers since we are throwing the rest.
    ThreadLocalRandom random = ThreadLocalRandom.current();
    for (int i = 0; i < numPeers; i++) {
      int j = random.nextInt(copy.size() - i) + i;
      Collections.swap(copy, i, j);
    }

    List<PeerIdAddress> selection = new ArrayList<>(numPeers);
    for (Peer peer : copy.subList(0, numPeers)) {
      selection.add(new PeerIdAddress(peer.getId(), peer.getNetAddress()));
    }
    return selection;
  }

  public int getTotalNumPeers() {
    synchronized (lock) {
      return peers.size();
    }
  }

  // true when the id, address and ordered views hold the same peers
  boolean isConsistent() {
    synchronized (lock) {
      if (peerMap.size() != peers.size() || addrMap.size() != peers.size()) {
        return false;
      }
      for (Peer peer : peers) {
        if (peerMap.get(peer.getId()) != peer || addrMap.get(peer.getNetAddress()) != peer) {
          return false;
        }
      }
      return true;
    }
  }

  static int selectionSize(int total) {
    int numPeers = Math.max(Math.min(MIN_GET_SELECTION, total),
        total * GET_SELECTION_PERCENT / 100);
    return Math.min(MAX_GET_SELECTION, numPeers);
  }

  // must be called with lock held
  private void removeAddress(Peer peer) {
    if (addrMap.get(peer.getNetAddress()) == peer) {
      addrMap.remove(peer.getNetAddress());
    }
  }
}
