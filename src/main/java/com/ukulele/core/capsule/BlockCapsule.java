/*
 * java-ukulele is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * java-ukulele is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.ukulele.core.capsule;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.ukulele.common.utils.Sha256Hash;
import com.ukulele.core.exception.BadItemException;
import com.ukulele.protos.Protocol.Block;
import com.ukulele.protos.Protocol.BlockHeader;
import java.util.List;

/**
 * Block의 proto 객체를 감싸는 capsule. <br/>
 * block hash는 직렬화된 header의 SHA-256 값이다.
 */
public class BlockCapsule implements ProtoCapsule<Block> {

  private final Block block;

  private Sha256Hash blockId;

  public BlockCapsule(Block block) {
    this.block = block;
  }

  public BlockCapsule(byte[] data) throws BadItemException {
    try {
      this.block = Block.parseFrom(data);
    } catch (InvalidProtocolBufferException e) {
      throw new BadItemException("Block proto data parse exception", e);
    }
    validate(block);
  }

  static void validate(Block block) throws BadItemException {
    if (!block.hasHeader()) {
      throw new BadItemException("Block without header");
    }
    int parentLength = block.getHeader().getParentHash().size();
    if (parentLength != 0 && parentLength != Sha256Hash.LENGTH) {
      throw new BadItemException("Block parent hash length " + parentLength);
    }
  }

  public BlockCapsule(long height, Sha256Hash parentHash, long epoch, long timestamp,
      String proposer, List<ByteString> txs) {
    BlockHeader header = BlockHeader.newBuilder()
        .setParentHash(parentHash.getByteString())
        .setHeight(height)
        .setEpoch(epoch)
        .setTimestamp(timestamp)
        .setProposer(proposer)
        .build();
    this.block = Block.newBuilder().setHeader(header).addAllTxs(txs).build();
  }

  public synchronized Sha256Hash getBlockId() {
    if (blockId == null) {
      blockId = Sha256Hash.of(block.getHeader().toByteArray());
    }
    return blockId;
  }

  public Sha256Hash getParentHash() {
    ByteString parent = block.getHeader().getParentHash();
    return parent.isEmpty() ? Sha256Hash.ZERO_HASH : Sha256Hash.wrap(parent);
  }

  public long getNum() {
    return block.getHeader().getHeight();
  }

  public long getEpoch() {
    return block.getHeader().getEpoch();
  }

  public long getTimeStamp() {
    return block.getHeader().getTimestamp();
  }

  public List<ByteString> getTransactions() {
    return block.getTxsList();
  }

  @Override
  public byte[] getData() {
    return block.toByteArray();
  }

  @Override
  public Block getInstance() {
    return block;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return getBlockId().equals(((BlockCapsule) o).getBlockId());
  }

  @Override
  public int hashCode() {
    return getBlockId().hashCode();
  }

  @Override
  public String toString() {
    return "BlockCapsule [hash=" + getBlockId()
        + ", parent=" + getParentHash()
        + ", height=" + getNum()
        + ", epoch=" + getEpoch()
        + ", txs=" + block.getTxsCount() + "]";
  }
}
