package com.ukulele.core.capsule;

public interface ProtoCapsule<T> {

  byte[] getData();

  T getInstance();
}
