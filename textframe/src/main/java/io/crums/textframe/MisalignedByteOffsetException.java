/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * Thrown when a byte offset falls inside a multi-byte UTF-8 sequence.
 */
@SuppressWarnings("serial")
public class MisalignedByteOffsetException extends TextFrameException {
  
  private final long offset;

  public MisalignedByteOffsetException(long offset) {
    super("byte offset %d is not on a character boundary".formatted(offset));
    this.offset = offset;
  }
  
  
  public final long offset() {
    return offset;
  }

}
