/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * Thrown when a range's resolved start lies beyond its resolved end.
 */
@SuppressWarnings("serial")
public class InvertedRangeException extends TextFrameException {
  
  private final long start;
  private final long end;
  

  public InvertedRangeException(long start, long end) {
    super("inverted range [%d, %d)".formatted(start, end));
    this.start = start;
    this.end = end;
  }
  
  
  public final long start() {
    return start;
  }
  
  public final long end() {
    return end;
  }

}
