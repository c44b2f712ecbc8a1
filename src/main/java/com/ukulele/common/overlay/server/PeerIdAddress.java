package com.ukulele.common.overlay.server;

import com.ukulele.common.net.NetAddress;
import lombok.Getter;

@Getter
public class PeerIdAddress {

  private final String id;

  private final NetAddress addr;

  public PeerIdAddress(String id, NetAddress addr) {
    this.id = id;
    this.addr = addr;
  }

  @Override
  public String toString() {
    return id + "@" + addr;
  }
}
