package com.ukulele.common.net;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Network address of a peer. Two addresses are equal when host and port are equal.
 */
public class NetAddress {

  private final String host;
  private final int port;

  public NetAddress(String host, int port) {
    this.host = Objects.requireNonNull(host, "host");
    this.port = port;
  }

  public static NetAddress fromSocketAddress(InetSocketAddress address) {
    return new NetAddress(address.getHostString(), address.getPort());
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public InetSocketAddress toSocketAddress() {
    return InetSocketAddress.createUnresolved(host, port);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    NetAddress that = (NetAddress) o;
    return port == that.port && host.equals(that.host);
  }

  @Override
  public int hashCode() {
    return Objects.hash(host, port);
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
