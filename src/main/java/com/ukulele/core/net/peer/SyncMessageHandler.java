package com.ukulele.core.net.peer;

import com.ukulele.core.net.message.PeerMessage;
import com.ukulele.core.net.node.MessageHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@Scope("prototype")
public class SyncMessageHandler extends SimpleChannelInboundHandler<PeerMessage> {

  private MessageHandler messageHandler;

  public void setMessageHandler(MessageHandler messageHandler) {
    this.messageHandler = messageHandler;
  }

  @Override
  public void channelRead0(final ChannelHandlerContext ctx, PeerMessage msg) throws Exception {
    messageHandler.handleMessage(msg);
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.warn("Close connection {}, cause: {}", ctx.channel().remoteAddress(),
        cause.getMessage());
    ctx.close();
  }
}
