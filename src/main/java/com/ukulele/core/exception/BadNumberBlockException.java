package com.ukulele.core.exception;

public class BadNumberBlockException extends UkuleleException {

  public BadNumberBlockException() {
    super();
  }

  public BadNumberBlockException(String message) {
    super(message);
  }
}
