package com.ukulele.core.exception;

public class UkuleleException extends Exception {

  public UkuleleException() {
    super();
  }

  public UkuleleException(String message) {
    super(message);
  }

  public UkuleleException(String message, Throwable cause) {
    super(message, cause);
  }

}
