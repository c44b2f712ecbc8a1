package com.ukulele.core.net.node;

import static com.ukulele.core.config.Parameter.NetConstants.MAX_INVENTORY_SIZE;

import com.google.common.collect.ImmutableList;
import com.ukulele.common.overlay.discover.node.statistics.SyncStatistics;
import com.ukulele.common.utils.Sha256Hash;
import com.ukulele.core.Constant;
import com.ukulele.core.capsule.BlockCapsule;
import com.ukulele.core.capsule.ProposalCapsule;
import com.ukulele.core.capsule.VoteCapsule;
import com.ukulele.core.chain.Chain;
import com.ukulele.core.chain.ExtendedBlock;
import com.ukulele.core.config.args.Args;
import com.ukulele.core.exception.BadItemException;
import com.ukulele.core.exception.ItemNotFoundException;
import com.ukulele.core.exception.P2pException;
import com.ukulele.core.exception.P2pException.TypeEnum;
import com.ukulele.core.net.dispatcher.Dispatcher;
import com.ukulele.core.net.message.DataRequestMessage;
import com.ukulele.core.net.message.DataResponseMessage;
import com.ukulele.core.net.message.InventoryRequestMessage;
import com.ukulele.core.net.message.InventoryResponseMessage;
import com.ukulele.core.net.message.PeerMessage;
import com.ukulele.core.net.message.SyncMessage;
import com.ukulele.core.net.message.SyncMessageFactory;
import com.ukulele.protos.Protocol.ChannelId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Block synchronization reactor. <br/>
 * peer로부터 수신한 sync message를 하나의 thread에서 순서대로 처리한다. inventory/data 요청에는 local
 * chain을 조회해서 응답하고, 광고된 hash와 수신한 block은 {@link RequestManager}에 전달하며, 완성된 block은
 * {@link MessageConsumer}로 전달한다.
 */
@Slf4j
@Component
public class SyncManager implements MessageHandler {

  private static final List<ChannelId> CHANNEL_IDS = ImmutableList.of(
      ChannelId.HEADER,
      ChannelId.BLOCK,
      ChannelId.PROPOSAL,
      ChannelId.COMMIT_CERTIFICATE,
      ChannelId.VOTE);

  private final Chain chain;

  private final ConsensusEngine consensus;

  private final Dispatcher dispatcher;

  private final MessageConsumer consumer;

  @Getter
  private final RequestManager requestManager;

  @Getter
  private final SyncStatistics statistics = new SyncStatistics();

  private final BlockingQueue<PeerMessage> incomingMsgQueue;

  private final boolean printSelfId;

  private final int statisticsInterval;

  private volatile boolean running;

  private ExecutorService mainLoopExecutor;

  private ScheduledExecutorService logExecutor;

  @Autowired
  public SyncManager(Chain chain, ConsensusEngine consensus, Dispatcher dispatcher,
      MessageConsumer consumer) {
    Args args = Args.getInstance();
    this.chain = chain;
    this.consensus = consensus;
    this.dispatcher = dispatcher;
    this.consumer = consumer;
    this.incomingMsgQueue = new ArrayBlockingQueue<>(args.getSyncMessageQueueSize());
    this.printSelfId = args.isLogPrintSelfId();
    this.statisticsInterval = args.getSyncStatisticsInterval();
    this.requestManager = new RequestManager(chain, dispatcher, statistics,
        args.getSyncRequestInterval(), args.getSyncRequestTimeout(),
        args.getSyncPendingExpiration(), printSelfId ? consensus.getId() : null);
  }

  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    requestManager.start();

    mainLoopExecutor = Executors.newSingleThreadExecutor(r -> new Thread(r, "sync-main"));
    mainLoopExecutor.submit(this::mainLoop);

    if (statisticsInterval > 0) {
      logExecutor = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "sync-stats"));
      logExecutor.scheduleWithFixedDelay(() -> {
        try {
          logger.info(statistics.toString());
        } catch (Throwable t) {
          logger.error("Exception in log worker", t);
        }
      }, statisticsInterval, statisticsInterval, TimeUnit.SECONDS);
    }
    logger.info("Sync manager started");
  }

  @PreDestroy
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    requestManager.stop();
    mainLoopExecutor.shutdownNow();
    if (logExecutor != null) {
      logExecutor.shutdownNow();
    }
    logger.info("Sync manager stopped");
  }

  /**
   * Blocks until the processing loop and the request loop have exited.
   */
  public void await() throws InterruptedException {
    ExecutorService executor;
    synchronized (this) {
      executor = mainLoopExecutor;
    }
    requestManager.await();
    if (executor != null) {
      executor.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
    }
  }

  public boolean isRunning() {
    return running;
  }

  @Override
  public List<ChannelId> getChannelIds() {
    return CHANNEL_IDS;
  }

  @Override
  public PeerMessage parseMessage(String peerId, ChannelId channelId, byte[] rawMessage)
      throws P2pException {
    SyncMessage message = SyncMessageFactory.create(rawMessage);
    return new PeerMessage(peerId, channelId, message);
  }

  @Override
  public byte[] encodeMessage(SyncMessage message) {
    return message.getSendData();
  }

  /**
   * Queues a message for processing. Blocks while the queue is full.
   */
  @Override
  public void handleMessage(PeerMessage message) throws InterruptedException {
    incomingMsgQueue.put(message);
  }

  private void mainLoop() {
    if (printSelfId) {
      MDC.put(Constant.LOG_ID_KEY, consensus.getId());
    }
    try {
      while (running && !Thread.currentThread().isInterrupted()) {
        // blocks are completed only while a message is processed, deliver them right after it
        processMessageSafely(incomingMsgQueue.take());
        deliverCompleted();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (Throwable t) {
      logger.error("Sync main loop exit unexpectedly", t);
    } finally {
      MDC.remove(Constant.LOG_ID_KEY);
      logger.info("Sync main loop exit");
    }
  }

  private void processMessageSafely(PeerMessage message) {
    try {
      processMessage(message);
    } catch (P2pException e) {
      statistics.dropUnexpectedMessage.add();
      logger.error("Drop message from peer {}, type: {}, {}", message.getPeerId(), e.getType(),
          e.getMessage());
    } catch (Exception e) {
      logger.error("Process message from peer {} failed, {}", message.getPeerId(), message, e);
    }
  }

  /**
   * Hands every block the request manager has completed to the consumer.
   */
  void deliverCompleted() {
    BlockCapsule block;
    while ((block = requestManager.getCompleted().poll()) != null) {
      logger.debug("Deliver block {} to consumer", block.getBlockId());
      consumer.addMessage(block);
      statistics.consumerBlock.add();
    }
  }

  void processMessage(PeerMessage message) throws P2pException {
    SyncMessage msg = message.getMessage();
    if (msg == null || msg.getType() == null) {
      throw new P2pException(TypeEnum.NO_SUCH_MESSAGE,
          "empty message on channel " + message.getChannelId());
    }
    statistics.addInMessage(msg.getType());
    String peerId = message.getPeerId();
    switch (msg.getType()) {
      case INVENTORY_REQUEST:
        handleInventoryRequest(peerId, (InventoryRequestMessage) msg);
        break;
      case INVENTORY_RESPONSE:
        handleInventoryResponse(peerId, (InventoryResponseMessage) msg);
        break;
      case DATA_REQUEST:
        handleDataRequest(peerId, (DataRequestMessage) msg);
        break;
      case DATA_RESPONSE:
        handleDataResponse(peerId, (DataResponseMessage) msg);
        break;
      default:
        throw new P2pException(TypeEnum.NO_SUCH_MESSAGE, "msg type: " + msg.getType());
    }
  }

  private void handleInventoryRequest(String peerId, InventoryRequestMessage request) {
    if (request.getChannelId() != ChannelId.BLOCK) {
      logger.error("Unsupported channel {} in inventory request from {}",
          request.getChannelId(), peerId);
      statistics.dropUnsupportedChannel.add();
      return;
    }
    if (request.getStart().isEmpty()) {
      logger.error("No start hash in inventory request from {}", peerId);
      statistics.dropMalformed.add();
      return;
    }

    Sha256Hash start;
    Sha256Hash end = null;
    try {
      start = decodeHash(request.getStart());
      if (!request.getEnd().isEmpty()) {
        end = decodeHash(request.getEnd());
      }
    } catch (BadItemException e) {
      logger.error("Bad inventory request from {}: {}", peerId, e.getMessage());
      statistics.dropMalformed.add();
      return;
    }

    ExtendedBlock curr;
    try {
      curr = chain.findBlock(start);
    } catch (ItemNotFoundException e) {
      logger.error("Start block {} of inventory request from {} not found", start, peerId);
      statistics.dropNotFound.add();
      return;
    }

    List<String> entries = new ArrayList<>();
    while (entries.size() < MAX_INVENTORY_SIZE) {
      entries.add(curr.getHash().toString());
      if (curr.getHash().equals(end)) {
        break;
      }
      List<Sha256Hash> children = curr.getChildren();
      if (children.isEmpty()) {
        break;
      }
      Sha256Hash next = children.get(0);
      try {
        curr = chain.findBlock(next);
      } catch (ItemNotFoundException e) {
        logger.error("Failed to load block {} while serving inventory to {}", next, peerId);
        break;
      }
    }

    logger.debug("Send inventory of {} hashes to peer {}", entries.size(), peerId);
    dispatcher.sendInventory(Collections.singletonList(peerId),
        new InventoryResponseMessage(ChannelId.BLOCK, entries));
    statistics.syncOutInventoryResponse.add();
    statistics.syncOutInventoryElement.add(entries.size());
  }

  private void handleInventoryResponse(String peerId, InventoryResponseMessage response) {
    if (response.getChannelId() != ChannelId.BLOCK) {
      logger.error("Unsupported channel {} in inventory response from {}",
          response.getChannelId(), peerId);
      statistics.dropUnsupportedChannel.add();
      return;
    }
    List<String> peers = Collections.singletonList(peerId);
    for (String entry : response.getEntries()) {
      try {
        requestManager.addHash(decodeHash(entry), peers);
      } catch (BadItemException e) {
        logger.error("Skip bad inventory entry from {}: {}", peerId, e.getMessage());
        statistics.dropMalformed.add();
      }
    }
  }

  private void handleDataRequest(String peerId, DataRequestMessage request) {
    if (request.getChannelId() != ChannelId.BLOCK) {
      logger.error("Unsupported channel {} in data request from {}", request.getChannelId(),
          peerId);
      statistics.dropUnsupportedChannel.add();
      return;
    }
    List<String> peers = Collections.singletonList(peerId);
    for (String entry : request.getEntries()) {
      Sha256Hash hash;
      try {
        hash = decodeHash(entry);
      } catch (BadItemException e) {
        logger.error("Skip bad data request entry from {}: {}", peerId, e.getMessage());
        statistics.dropMalformed.add();
        continue;
      }
      ExtendedBlock block;
      try {
        block = chain.findBlock(hash);
      } catch (ItemNotFoundException e) {
        logger.error("Block {} requested by {} not found", hash, peerId);
        statistics.dropNotFound.add();
        continue;
      }
      dispatcher.sendData(peers,
          new DataResponseMessage(ChannelId.BLOCK, block.getBlock().getData()));
      statistics.syncOutDataResponse.add();
    }
  }

  private void handleDataResponse(String peerId, DataResponseMessage response) {
    try {
      switch (response.getChannelId()) {
        case BLOCK:
          handleBlock(new BlockCapsule(response.getPayload()));
          break;
        case VOTE:
          handleVote(new VoteCapsule(response.getPayload()));
          break;
        case PROPOSAL:
          handleProposal(new ProposalCapsule(response.getPayload()));
          break;
        default:
          logger.error("Unsupported channel {} in data response from {}",
              response.getChannelId(), peerId);
          statistics.dropUnsupportedChannel.add();
          break;
      }
    } catch (BadItemException e) {
      logger.error("Drop bad {} payload from {}: {}", response.getChannelId(), peerId,
          e.getMessage());
      statistics.dropMalformed.add();
    }
  }

  private void handleProposal(ProposalCapsule proposal) {
    logger.debug("Received proposal {}", proposal);
    if (proposal.hasCommitCertificate()) {
      for (VoteCapsule vote : proposal.getCommitCertificate().getVotes()) {
        consumer.addMessage(vote);
        statistics.consumerVote.add();
      }
    }
    handleBlock(proposal.getBlock());
  }

  private void handleBlock(BlockCapsule block) {
    logger.debug("Received block {}", block.getBlockId());
    requestManager.addBlock(block);
  }

  private void handleVote(VoteCapsule vote) {
    logger.debug("Received vote {}", vote);
    if (vote.hasBlock()) {
      requestManager.addHash(vote.getBlockHash(), Collections.emptyList());
    }
    consumer.addMessage(vote);
    statistics.consumerVote.add();
  }

  private static Sha256Hash decodeHash(String hash) throws BadItemException {
    try {
      return Sha256Hash.wrap(hash);
    } catch (IllegalArgumentException e) {
      throw new BadItemException("invalid hash " + hash, e);
    }
  }
}
