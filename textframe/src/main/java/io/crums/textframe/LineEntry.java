/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * Location of a line in the text. A line includes its terminating
 * {@code '\n'}, if any (only the last line of a text may lack one).
 * Ranges are end-exclusive.
 * 
 * @param lineNo      0-based line no.
 * @param startChar   character offset the line starts at
 * @param endChar     character offset the line ends at (exclusive)
 * @param startByte   byte offset the line starts at
 * @param endByte     byte offset the line ends at (exclusive)
 */
public record LineEntry(
    long lineNo, long startChar, long endChar, long startByte, long endByte) {
  
  public LineEntry {
    if (lineNo < 0 || startChar < 0 || startByte < startChar ||
        endChar <= startChar || endByte - startByte < endChar - startChar)
      throw new IllegalArgumentException(
          "lineNo %d, chars [%d, %d), bytes [%d, %d)"
          .formatted(lineNo, startChar, endChar, startByte, endByte));
  }
  
  /** Returns the line's length in characters (&ge; 1). */
  public long length() {
    return endChar - startChar;
  }
  
  /** Returns the line's length in bytes. */
  public long byteLength() {
    return endByte - startByte;
  }

}
