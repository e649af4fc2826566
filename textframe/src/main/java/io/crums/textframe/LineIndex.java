/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import java.nio.BufferOverflowException;
import java.nio.ByteBuffer;

import io.crums.textframe.io.Serial;
import io.crums.textframe.io.SerialFormatException;

/**
 * Line start offsets, in both characters and bytes. Only {@code '\n'}
 * terminates a line, and it belongs to the line it ends. A {@code '\n'} at
 * the very end of the text does not begin an (empty) extra line.
 * <p>
 * Internally, the start offsets of every line are followed by a terminal
 * (char-size, byte-size) entry, so that line <em>n</em> spans
 * [start(n), start(n+1)).
 * </p>
 */
final class LineIndex implements Serial {
  
  private final OffsetVector chars;
  private final OffsetVector bytes;
  
  
  /**
   * @param chars   line start char offsets, plus the terminal char size
   * @param bytes   line start byte offsets, plus the terminal byte size
   * @throws IllegalArgumentException if inconsistent
   */
  LineIndex(OffsetVector chars, OffsetVector bytes) {
    this.chars = chars.trimToSize();
    this.bytes = bytes.trimToSize();
    
    if (chars.size() != bytes.size())
      throw new IllegalArgumentException(
          "chars.size() %d != bytes.size() %d".formatted(chars.size(), bytes.size()));
    if (chars.size() < 2)
      throw new IllegalArgumentException("no lines");
    if (chars.get(0) != 0 || bytes.get(0) != 0)
      throw new IllegalArgumentException("first line does not start at zero");
    
    for (int index = 1; index < chars.size(); ++index) {
      long dc = chars.get(index) - chars.get(index - 1);
      long db = bytes.get(index) - bytes.get(index - 1);
      if (dc <= 0 || db < dc || db > 4 * dc)
        throw new IllegalArgumentException(
            "inconsistent line start at index " + index);
    }
  }
  
  
  /** Returns the number of lines (&ge; 1). */
  long lineCount() {
    return chars.size() - 1;
  }
  
  long charSize() {
    return chars.last();
  }
  
  long byteSize() {
    return bytes.last();
  }
  
  
  /**
   * Returns the char offset the given line starts at.
   * 
   * @param lineNo      in the range [0, {@linkplain #lineCount()}]; the
   *                    line count itself maps to the char size
   */
  long startChar(long lineNo) {
    return chars.get(index(lineNo));
  }
  
  
  /**
   * Returns the byte offset the given line starts at.
   * 
   * @param lineNo      in the range [0, {@linkplain #lineCount()}]; the
   *                    line count itself maps to the byte size
   */
  long startByte(long lineNo) {
    return bytes.get(index(lineNo));
  }
  
  
  private int index(long lineNo) {
    if (lineNo < 0 || lineNo > lineCount())
      throw new LineOutOfBoundsException(lineNo, lineCount());
    return (int) lineNo;
  }
  
  
  /**
   * Returns the entry for the given line.
   * 
   * @param lineNo      in the range [0, {@linkplain #lineCount()})
   */
  LineEntry entry(long lineNo) {
    if (lineNo == lineCount())
      throw new LineOutOfBoundsException(lineNo, lineCount());
    int index = index(lineNo);
    return new LineEntry(
        lineNo,
        chars.get(index), chars.get(index + 1),
        bytes.get(index), bytes.get(index + 1));
  }
  
  
  /**
   * Returns the 0-based no. of the line containing the given char offset.
   * 
   * @param charOffset  in the range [0, char-size)
   */
  long lineNoOf(long charOffset) {
    if (charOffset < 0 || charOffset >= charSize())
      throw new OffsetOutOfBoundsException(charOffset, charSize());
    return chars.floorIndex(charOffset);
  }
  
  
  /** Converts an absolute line range to a char range. */
  OffsetRange toCharRange(OffsetRange lines) {
    return new OffsetRange(startChar(lines.begin()), startChar(lines.end()));
  }
  
  /** Converts an absolute line range to a byte range. */
  OffsetRange toByteRange(OffsetRange lines) {
    return new OffsetRange(startByte(lines.begin()), startByte(lines.end()));
  }
  
  
  @Override
  public boolean equals(Object o) {
    return
        o == this ||
        o instanceof LineIndex other &&
        other.chars.equals(chars) &&
        other.bytes.equals(bytes);
  }
  
  
  @Override
  public int hashCode() {
    return chars.hashCode() * 31 + bytes.hashCode();
  }
  
  
  //      S  E  R  I  A  L

  @Override
  public int serialSize() {
    return chars.serialSize() + bytes.serialSize();
  }


  @Override
  public ByteBuffer writeTo(ByteBuffer out) throws BufferOverflowException {
    chars.writeTo(out);
    return bytes.writeTo(out);
  }
  
  
  /**
   * Loads and returns an instance from its serial form.
   * 
   * @throws SerialFormatException if malformed or inconsistent
   */
  static LineIndex load(ByteBuffer in) throws SerialFormatException {
    var chars = OffsetVector.load(in);
    var bytes = OffsetVector.load(in);
    try {
      return new LineIndex(chars, bytes);
    } catch (IllegalArgumentException iax) {
      throw new SerialFormatException(
          "on loading line index: " + iax.getMessage(), iax);
    }
  }

}
