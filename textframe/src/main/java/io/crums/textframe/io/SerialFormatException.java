/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe.io;

/**
 * Signifies a malformed serial representation.
 */
@SuppressWarnings("serial")
public class SerialFormatException extends IllegalArgumentException {

  public SerialFormatException() {
  }

  public SerialFormatException(String s) {
    super(s);
  }

  public SerialFormatException(Throwable cause) {
    super(cause);
  }

  public SerialFormatException(String message, Throwable cause) {
    super(message, cause);
  }

}
