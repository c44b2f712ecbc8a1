package com.ukulele.core.exception;

/**
 * Raised when a payload received from a peer can not be decoded into the expected item.
 */
public class BadItemException extends UkuleleException {

  public BadItemException() {
    super();
  }

  public BadItemException(String message) {
    super(message);
  }

  public BadItemException(String message, Throwable cause) {
    super(message, cause);
  }
}
