package com.ukulele.core.net.node;

import com.google.common.collect.Lists;
import com.google.protobuf.ByteString;
import com.ukulele.common.utils.Sha256Hash;
import com.ukulele.core.Constant;
import com.ukulele.core.capsule.BlockCapsule;
import com.ukulele.core.capsule.CommitCertificateCapsule;
import com.ukulele.core.capsule.ProposalCapsule;
import com.ukulele.core.capsule.ProtoCapsule;
import com.ukulele.core.capsule.VoteCapsule;
import com.ukulele.core.capsule.utils.BlockUtil;
import com.ukulele.core.chain.KhaosChain;
import com.ukulele.core.config.Parameter.NetConstants;
import com.ukulele.core.config.args.Args;
import com.ukulele.core.exception.P2pException;
import com.ukulele.core.exception.P2pException.TypeEnum;
import com.ukulele.core.net.message.DataRequestMessage;
import com.ukulele.core.net.message.DataResponseMessage;
import com.ukulele.core.net.message.InventoryRequestMessage;
import com.ukulele.core.net.message.InventoryResponseMessage;
import com.ukulele.core.net.message.MessageTypes;
import com.ukulele.core.net.message.PeerMessage;
import com.ukulele.protos.Protocol.Block;
import com.ukulele.protos.Protocol.ChannelId;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.junit.AfterClass;
import org.junit.Assert;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

@Slf4j
public class SyncManagerTest {

  private static final String PEER = "peer-a";

  private KhaosChain chain;

  private RecordingDispatcher dispatcher;

  private RecordingConsumer consumer;

  private SyncManager syncManager;

  private BlockCapsule genesis;

  private List<BlockCapsule> blocks;

  @BeforeClass
  public static void initArgs() {
    Args.setParam(new String[]{}, Constant.TEST_CONF);
  }

  @AfterClass
  public static void destroy() {
    Args.clearParam();
  }

  @Before
  public void init() throws Exception {
    chain = new KhaosChain();
    genesis = BlockUtil.newGenesisBlockCapsule();
    chain.start(genesis);
    blocks = BlockUtil.newChain(genesis, 3);
    for (BlockCapsule block : blocks) {
      chain.push(block);
    }
    dispatcher = new RecordingDispatcher();
    consumer = new RecordingConsumer();
    syncManager = new SyncManager(chain, new FixedConsensusEngine("node-a"), dispatcher,
        consumer);
  }

  @Test
  public void testChannelIds() {
    Assert.assertEquals(Lists.newArrayList(ChannelId.HEADER, ChannelId.BLOCK, ChannelId.PROPOSAL,
        ChannelId.COMMIT_CERTIFICATE, ChannelId.VOTE), syncManager.getChannelIds());
  }

  @Test
  public void testParseMessage() throws P2pException {
    InventoryRequestMessage request = new InventoryRequestMessage(ChannelId.BLOCK,
        genesis.getBlockId().toString(), "");
    PeerMessage message = syncManager.parseMessage(PEER, ChannelId.BLOCK,
        syncManager.encodeMessage(request));
    Assert.assertEquals(PEER, message.getPeerId());
    Assert.assertEquals(MessageTypes.INVENTORY_REQUEST, message.getMessage().getType());
    Assert.assertEquals(genesis.getBlockId().toString(),
        ((InventoryRequestMessage) message.getMessage()).getStart());

    try {
      syncManager.parseMessage(PEER, ChannelId.BLOCK, new byte[0]);
      Assert.fail("empty message parsed");
    } catch (P2pException e) {
      Assert.assertEquals(TypeEnum.PARSE_MESSAGE_FAILED, e.getType());
    }

    try {
      syncManager.parseMessage(PEER, ChannelId.BLOCK, new byte[]{0x7f, 0x01});
      Assert.fail("unknown type parsed");
    } catch (P2pException e) {
      Assert.assertEquals(TypeEnum.NO_SUCH_MESSAGE, e.getType());
    }
  }

  @Test
  public void testInventoryStartEqualsEnd() throws P2pException {
    String start = blocks.get(0).getBlockId().toString();
    syncManager.processMessage(inventoryRequest(ChannelId.BLOCK, start, start));

    Assert.assertEquals(1, dispatcher.inventories.size());
    Assert.assertEquals(Collections.singletonList(PEER), dispatcher.inventories.get(0).peerIds);
    Assert.assertEquals(Collections.singletonList(start),
        dispatcher.inventories.get(0).message.getEntries());
  }

  @Test
  public void testInventoryWalk() throws P2pException {
    syncManager.processMessage(inventoryRequest(ChannelId.BLOCK,
        genesis.getBlockId().toString(), blocks.get(1).getBlockId().toString()));
    Assert.assertEquals(Lists.newArrayList(genesis.getBlockId().toString(),
        blocks.get(0).getBlockId().toString(), blocks.get(1).getBlockId().toString()),
        dispatcher.inventories.get(0).message.getEntries());

    // empty end walks to the tip
    syncManager.processMessage(inventoryRequest(ChannelId.BLOCK,
        blocks.get(1).getBlockId().toString(), ""));
    Assert.assertEquals(Lists.newArrayList(blocks.get(1).getBlockId().toString(),
        blocks.get(2).getBlockId().toString()),
        dispatcher.inventories.get(1).message.getEntries());
  }

  @Test
  public void testInventoryBounded() throws Exception {
    for (BlockCapsule block : BlockUtil.newChain(blocks.get(2), 150)) {
      chain.push(block);
    }
    syncManager.processMessage(inventoryRequest(ChannelId.BLOCK,
        genesis.getBlockId().toString(), ""));
    List<String> entries = dispatcher.inventories.get(0).message.getEntries();
    Assert.assertEquals(NetConstants.MAX_INVENTORY_SIZE, entries.size());
    Assert.assertEquals(genesis.getBlockId().toString(), entries.get(0));
  }

  @Test
  public void testInventoryRequestDropped() throws P2pException {
    String unknown = Sha256Hash.of(new byte[]{1, 2, 3}).toString();
    syncManager.processMessage(inventoryRequest(ChannelId.BLOCK, unknown, ""));
    syncManager.processMessage(inventoryRequest(ChannelId.BLOCK, "", ""));
    syncManager.processMessage(inventoryRequest(ChannelId.BLOCK, "abc", ""));
    syncManager.processMessage(inventoryRequest(ChannelId.VOTE,
        genesis.getBlockId().toString(), ""));

    Assert.assertTrue(dispatcher.inventories.isEmpty());
    Assert.assertEquals(1, syncManager.getStatistics().dropNotFound.getTotalCount());
    Assert.assertEquals(2, syncManager.getStatistics().dropMalformed.getTotalCount());
    Assert.assertEquals(1, syncManager.getStatistics().dropUnsupportedChannel.getTotalCount());
  }

  @Test
  public void testInventoryResponseRegistersHashes() throws P2pException {
    List<BlockCapsule> remote = BlockUtil.newChain(blocks.get(2), 2);
    InventoryResponseMessage response = new InventoryResponseMessage(ChannelId.BLOCK,
        Lists.newArrayList(remote.get(0).getBlockId().toString(), "abc",
            remote.get(1).getBlockId().toString(), genesis.getBlockId().toString()));
    syncManager.processMessage(new PeerMessage(PEER, ChannelId.BLOCK, response));

    RequestManager requestManager = syncManager.getRequestManager();
    Assert.assertTrue(requestManager.isPending(remote.get(0).getBlockId()));
    Assert.assertTrue(requestManager.isPending(remote.get(1).getBlockId()));
    Assert.assertEquals(2, requestManager.getPendingCount());
    Assert.assertEquals(1, syncManager.getStatistics().dropMalformed.getTotalCount());

    requestManager.tryRequest(System.currentTimeMillis());
    Assert.assertEquals(Collections.singletonList(PEER), dispatcher.dataRequests.get(0).peerIds);
  }

  @Test
  public void testDataRequestSkipsMissingBlocks() throws P2pException {
    String unknown = Sha256Hash.of(new byte[]{9}).toString();
    DataRequestMessage request = new DataRequestMessage(ChannelId.BLOCK, Lists.newArrayList(
        blocks.get(0).getBlockId().toString(), unknown, "abcd",
        blocks.get(2).getBlockId().toString()));
    syncManager.processMessage(new PeerMessage(PEER, ChannelId.BLOCK, request));

    Assert.assertEquals(2, dispatcher.dataResponses.size());
    DataResponseMessage first = dispatcher.dataResponses.get(0).message;
    DataResponseMessage second = dispatcher.dataResponses.get(1).message;
    Assert.assertEquals(ChannelId.BLOCK, first.getChannelId());
    Assert.assertArrayEquals(blocks.get(0).getData(), first.getPayload());
    Assert.assertArrayEquals(blocks.get(2).getData(), second.getPayload());
    Assert.assertEquals(Collections.singletonList(PEER), dispatcher.dataResponses.get(1).peerIds);
    Assert.assertEquals(1, syncManager.getStatistics().dropNotFound.getTotalCount());
    Assert.assertEquals(1, syncManager.getStatistics().dropMalformed.getTotalCount());
  }

  @Test
  public void testBlockDeliveredOnce() throws P2pException {
    BlockCapsule next = BlockUtil.newBlock(blocks.get(2), "b");
    syncManager.getRequestManager().addHash(next.getBlockId(), Lists.newArrayList(PEER));

    PeerMessage response = new PeerMessage(PEER, ChannelId.BLOCK,
        new DataResponseMessage(ChannelId.BLOCK, next.getData()));
    syncManager.processMessage(response);
    syncManager.processMessage(response);
    syncManager.deliverCompleted();

    Assert.assertEquals(1, consumer.messages.size());
    Assert.assertEquals(next, consumer.messages.get(0));
    Assert.assertFalse(syncManager.getRequestManager().isPending(next.getBlockId()));
  }

  @Test
  public void testVoteForUnknownBlock() throws P2pException {
    Sha256Hash unknown = BlockUtil.newBlock(blocks.get(2), "x").getBlockId();
    VoteCapsule vote = new VoteCapsule(unknown, 4, 5, "validator-1");
    syncManager.processMessage(new PeerMessage(PEER, ChannelId.VOTE,
        new DataResponseMessage(ChannelId.VOTE, vote.getData())));

    Assert.assertEquals(1, consumer.messages.size());
    Assert.assertTrue(consumer.messages.get(0) instanceof VoteCapsule);
    Assert.assertEquals("validator-1", ((VoteCapsule) consumer.messages.get(0)).getVoterId());
    Assert.assertTrue(syncManager.getRequestManager().isPending(unknown));
  }

  @Test
  public void testNilVote() throws P2pException {
    VoteCapsule vote = new VoteCapsule(null, 0, 5, "validator-2");
    syncManager.processMessage(new PeerMessage(PEER, ChannelId.VOTE,
        new DataResponseMessage(ChannelId.VOTE, vote.getData())));

    Assert.assertEquals(1, consumer.messages.size());
    Assert.assertEquals(0, syncManager.getRequestManager().getPendingCount());
  }

  @Test
  public void testProposalVotesBeforeBlock() throws P2pException {
    BlockCapsule next = BlockUtil.newBlock(blocks.get(2), "p");
    VoteCapsule v1 = new VoteCapsule(blocks.get(2).getBlockId(), 3, 3, "validator-1");
    VoteCapsule v2 = new VoteCapsule(blocks.get(2).getBlockId(), 3, 3, "validator-2");
    CommitCertificateCapsule cc = new CommitCertificateCapsule(blocks.get(2).getBlockId(),
        Lists.newArrayList(v1, v2));
    ProposalCapsule proposal = new ProposalCapsule(next, cc, "proposer-p");

    syncManager.processMessage(new PeerMessage(PEER, ChannelId.PROPOSAL,
        new DataResponseMessage(ChannelId.PROPOSAL, proposal.getData())));
    syncManager.deliverCompleted();

    List<String> kinds = consumer.messages.stream()
        .map(m -> m.getClass().getSimpleName())
        .collect(Collectors.toList());
    Assert.assertEquals(Lists.newArrayList("VoteCapsule", "VoteCapsule", "BlockCapsule"), kinds);
    Assert.assertEquals(next, consumer.blocks().get(0));
  }

  @Test
  public void testBlockWithBadParentHashDropped() throws P2pException {
    Block bad = blocks.get(0).getInstance().toBuilder()
        .setHeader(blocks.get(0).getInstance().getHeader().toBuilder()
            .setParentHash(ByteString.copyFrom(new byte[]{1, 2, 3})))
        .build();
    syncManager.processMessage(new PeerMessage(PEER, ChannelId.BLOCK,
        new DataResponseMessage(ChannelId.BLOCK, bad.toByteArray())));
    syncManager.deliverCompleted();

    Assert.assertTrue(consumer.messages.isEmpty());
    Assert.assertEquals(1, syncManager.getStatistics().dropMalformed.getTotalCount());
    Assert.assertEquals(0, syncManager.getRequestManager().getPendingCount());
  }

  @Test
  public void testBadPayloadDropped() throws P2pException {
    syncManager.processMessage(new PeerMessage(PEER, ChannelId.BLOCK,
        new DataResponseMessage(ChannelId.BLOCK, new byte[]{0, 0, 0})));
    syncManager.processMessage(new PeerMessage(PEER, ChannelId.HEADER,
        new DataResponseMessage(ChannelId.HEADER, blocks.get(0).getData())));
    syncManager.deliverCompleted();

    Assert.assertTrue(consumer.messages.isEmpty());
    Assert.assertEquals(1, syncManager.getStatistics().dropMalformed.getTotalCount());
    Assert.assertEquals(1, syncManager.getStatistics().dropUnsupportedChannel.getTotalCount());
  }

  @Test
  public void testEmptyMessageRejected() {
    try {
      syncManager.processMessage(new PeerMessage(PEER, ChannelId.BLOCK, null));
      Assert.fail("empty message accepted");
    } catch (P2pException e) {
      Assert.assertEquals(TypeEnum.NO_SUCH_MESSAGE, e.getType());
    }
  }

  @Test
  public void testLoopSurvivesBadMessages() throws Exception {
    syncManager.start();
    try {
      syncManager.handleMessage(new PeerMessage(PEER, ChannelId.BLOCK, null));
      String start = blocks.get(0).getBlockId().toString();
      syncManager.handleMessage(inventoryRequest(ChannelId.BLOCK, start, start));

      waitFor(() -> !dispatcher.inventories.isEmpty());
      Assert.assertEquals(1, dispatcher.inventories.size());
      Assert.assertEquals(1, syncManager.getStatistics().dropUnexpectedMessage.getTotalCount());
    } finally {
      syncManager.stop();
      syncManager.stop();
      syncManager.await();
    }
    Assert.assertFalse(syncManager.isRunning());
  }

  @Test
  public void testRestartRequestsAndDelivers() throws Exception {
    syncManager.start();
    syncManager.stop();
    syncManager.await();

    BlockCapsule next = BlockUtil.newBlock(blocks.get(2), "n");
    syncManager.start();
    try {
      syncManager.handleMessage(new PeerMessage(PEER, ChannelId.BLOCK,
          new InventoryResponseMessage(ChannelId.BLOCK,
              Collections.singletonList(next.getBlockId().toString()))));
      waitFor(() -> !dispatcher.dataRequests.isEmpty());
      Assert.assertEquals(Collections.singletonList(PEER), dispatcher.dataRequests.get(0).peerIds);

      syncManager.handleMessage(new PeerMessage(PEER, ChannelId.BLOCK,
          new DataResponseMessage(ChannelId.BLOCK, next.getData())));
      waitFor(() -> !consumer.messages.isEmpty());
      Assert.assertEquals(next, consumer.messages.get(0));
    } finally {
      syncManager.stop();
      syncManager.await();
    }
  }

  /**
   * Node "local" learns a block hash from node "remote", fetches it and hands it to its consumer
   * exactly once.
   */
  @Test
  public void testAdvertiseRequestDeliver() throws Exception {
    KhaosChain localChain = new KhaosChain();
    localChain.start(genesis);
    RecordingConsumer localConsumer = new RecordingConsumer();
    LoopbackDispatcher localDispatcher = new LoopbackDispatcher("local");
    SyncManager local = new SyncManager(localChain, new FixedConsensusEngine("local"),
        localDispatcher, localConsumer);

    LoopbackDispatcher remoteDispatcher = new LoopbackDispatcher("remote");
    SyncManager remote = new SyncManager(chain, new FixedConsensusEngine("remote"),
        remoteDispatcher, new RecordingConsumer());

    localDispatcher.connect("remote", remote);
    remoteDispatcher.connect("local", local);

    local.start();
    remote.start();
    try {
      BlockCapsule wanted = blocks.get(0);
      local.handleMessage(new PeerMessage("remote", ChannelId.BLOCK,
          new InventoryResponseMessage(ChannelId.BLOCK,
              Collections.singletonList(wanted.getBlockId().toString()))));

      waitFor(() -> !localConsumer.messages.isEmpty());
      // a late duplicate must not be delivered again
      local.handleMessage(new PeerMessage("remote", ChannelId.BLOCK,
          new DataResponseMessage(ChannelId.BLOCK, wanted.getData())));
      Thread.sleep(300);

      List<ProtoCapsule<?>> delivered = localConsumer.messages;
      Assert.assertEquals(1, delivered.size());
      Assert.assertEquals(wanted, delivered.get(0));
      Assert.assertEquals(0, local.getRequestManager().getPendingCount());
    } finally {
      local.stop();
      remote.stop();
      local.await();
      remote.await();
    }
  }

  private static PeerMessage inventoryRequest(ChannelId channelId, String start, String end) {
    return new PeerMessage(PEER, channelId,
        new InventoryRequestMessage(channelId, start, end));
  }

  private static void waitFor(Condition condition) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5000;
    while (!condition.test() && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
    }
    Assert.assertTrue("condition not reached in time", condition.test());
  }

  private interface Condition {

    boolean test();
  }
}
