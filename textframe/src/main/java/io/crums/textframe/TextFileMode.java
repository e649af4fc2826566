/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * Text file indexing mode.
 */
public enum TextFileMode {
  
  /**
   * Compute a line index (takes memory and CPU time); allows queries
   * based on line ranges. The default.
   */
  WITH_LINE_INDEX,
  
  /**
   * Do not compute a line index (cheapest). Line-based queries fail with
   * {@linkplain LineIndexDisabledException}.
   */
  NO_LINE_INDEX;
  
  
  /** Returns the default mode, {@linkplain #WITH_LINE_INDEX}. */
  public static TextFileMode defaultMode() {
    return WITH_LINE_INDEX;
  }
  
  /** Returns {@code true} iff this is {@linkplain #WITH_LINE_INDEX}. */
  public boolean indexLines() {
    return this == WITH_LINE_INDEX;
  }

}
