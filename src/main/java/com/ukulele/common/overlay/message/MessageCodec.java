package com.ukulele.common.overlay.message;

import com.ukulele.core.exception.P2pException;
import com.ukulele.core.exception.P2pException.TypeEnum;
import com.ukulele.core.net.message.PeerMessage;
import com.ukulele.core.net.node.MessageHandler;
import com.ukulele.protos.Protocol.ChannelId;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageCodec;
import java.util.Arrays;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

/**
 * Converts between frames and {@link PeerMessage}s for one connection. A frame is the channel id
 * byte followed by the encoded sync message. Framing itself is done by the handlers in front of
 * this one.
 */
@Slf4j
@Component
@Scope("prototype")
public class MessageCodec extends ByteToMessageCodec<PeerMessage> {

  private String peerId;

  private MessageHandler messageHandler;

  @Override
  protected void decode(ChannelHandlerContext ctx, ByteBuf buffer, List<Object> out) {
    int length = buffer.readableBytes();
    byte[] encoded = new byte[length];
    buffer.readBytes(encoded);
    try {
      out.add(createMessage(encoded));
    } catch (P2pException e) {
      logger.warn("Drop frame from peer {}, type: {}, {}", peerId, e.getType(), e.getMessage());
    }
  }

  @Override
  protected void encode(ChannelHandlerContext ctx, PeerMessage msg, ByteBuf out) {
    out.writeByte(msg.getChannelId().getNumber());
    out.writeBytes(messageHandler.encodeMessage(msg.getMessage()));
  }

  public void setPeerId(String peerId) {
    this.peerId = peerId;
  }

  public void setMessageHandler(MessageHandler messageHandler) {
    this.messageHandler = messageHandler;
  }

  private PeerMessage createMessage(byte[] encoded) throws P2pException {
    if (encoded.length < 2) {
      throw new P2pException(TypeEnum.PARSE_MESSAGE_FAILED, "frame too short, len=" + encoded.length);
    }
    ChannelId channelId = ChannelId.forNumber(encoded[0]);
    if (channelId == null || !messageHandler.getChannelIds().contains(channelId)) {
      throw new P2pException(TypeEnum.UNSUPPORTED_CHANNEL, "channel=" + encoded[0]);
    }
    return messageHandler.parseMessage(peerId, channelId,
        Arrays.copyOfRange(encoded, 1, encoded.length));
  }
}
