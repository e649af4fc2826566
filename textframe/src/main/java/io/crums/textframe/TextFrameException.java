/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


/**
 * Base exception in the <code>textframe</code> module. Request-level subclasses
 * (bounds, alignment, etc.) leave the {@linkplain TextFile} they are raised from
 * intact.
 */
@SuppressWarnings("serial")
public class TextFrameException extends RuntimeException {

  public TextFrameException(String message) {
    super(message);
  }

  public TextFrameException(Throwable cause) {
    super(cause);
  }

  public TextFrameException(String message, Throwable cause) {
    super(message, cause);
  }

}
