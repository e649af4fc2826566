/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * Signifies a byte sequence that is not valid UTF-8. Provides the offset where
 * the offending sequence begins.
 */
@SuppressWarnings("serial")
public class InvalidEncodingException extends TextFrameException {
  
  private final long offset;
  
  
  public InvalidEncodingException(long offset) {
    this(offset, "invalid UTF-8 sequence at byte offset " + offset);
  }

  public InvalidEncodingException(long offset, String message) {
    super(message);
    this.offset = offset;
    if (offset < 0)
      throw new IllegalArgumentException("offset " + offset);
  }
  
  
  /** Returns the byte offset the invalid sequence begins at. */
  public final long offset() {
    return offset;
  }

}
