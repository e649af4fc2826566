/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * Thrown when a (resolved) line number falls outside the range
 * [0, line-count].
 */
@SuppressWarnings("serial")
public class LineOutOfBoundsException extends TextFrameException {
  
  private final long requested;
  private final long total;
  
  
  public LineOutOfBoundsException(long requested, long total) {
    super("line %d out of bounds [0, %d]".formatted(requested, total));
    this.requested = requested;
    this.total = total;
  }

  
  /** Returns the offending line no. */
  public final long requested() {
    return requested;
  }
  
  /** Returns the line count. */
  public final long total() {
    return total;
  }

}
