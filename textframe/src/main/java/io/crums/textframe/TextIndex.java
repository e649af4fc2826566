/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import java.nio.BufferOverflowException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Optional;

import io.crums.textframe.io.Serial;
import io.crums.textframe.io.SerialFormatException;

/**
 * Everything known about a text's layout: its sizes, its content digest,
 * its {@linkplain CheckpointIndex checkpoints}, and optionally, its
 * {@linkplain LineIndex line index}. Immutable.
 * 
 * <h2>Serial Format</h2>
 * <pre>
 *  long      charSize
 *  long      byteSize
 *  byte[32]  digest
 *  CheckpointIndex
 *  byte      lineFlag (0|1)
 *  [LineIndex]         (if lineFlag is 1)
 * </pre>
 * 
 * @see IndexBuilder
 * @see IndexFiles
 */
final class TextIndex implements Serial {
  
  private final long charSize;
  private final long byteSize;
  private final byte[] digest;
  private final CheckpointIndex checkpoints;
  private final LineIndex lines;
  
  
  /**
   * 
   * @param digest      the SHA-256 digest of the text (not copied)
   * @param checkpoints the checkpoint index (also supplies the sizes)
   * @param lines       optional line index (may be {@code null})
   */
  TextIndex(byte[] digest, CheckpointIndex checkpoints, LineIndex lines) {
    this.charSize = checkpoints.charSize();
    this.byteSize = checkpoints.byteSize();
    this.digest = digest;
    this.checkpoints = checkpoints;
    this.lines = lines;
    
    if (digest.length != TextFrameConstants.HASH_WIDTH)
      throw new IllegalArgumentException("digest length " + digest.length);
    if (lines != null &&
        (lines.charSize() != charSize || lines.byteSize() != byteSize))
      throw new IllegalArgumentException(
          "line index sizes (%d,%d) do not match text sizes (%d,%d)"
          .formatted(lines.charSize(), lines.byteSize(), charSize, byteSize));
  }
  
  
  long charSize() {
    return charSize;
  }
  
  long byteSize() {
    return byteSize;
  }
  
  /** Returns a read-only view of the 32-byte digest. */
  ByteBuffer digest() {
    return ByteBuffer.wrap(digest).asReadOnlyBuffer();
  }
  
  /** Returns {@code true} iff the given digest equals this instance's. */
  boolean digestEquals(byte[] other) {
    return Arrays.equals(digest, other);
  }
  
  CheckpointIndex checkpoints() {
    return checkpoints;
  }
  
  Optional<LineIndex> lines() {
    return Optional.ofNullable(lines);
  }
  
  boolean hasLines() {
    return lines != null;
  }
  
  /** Returns this instance, sans line index. */
  TextIndex withoutLines() {
    return lines == null ? this : new TextIndex(digest, checkpoints, null);
  }
  
  
  @Override
  public boolean equals(Object o) {
    return
        o == this ||
        o instanceof TextIndex other &&
        Arrays.equals(other.digest, digest) &&
        other.checkpoints.equals(checkpoints) &&
        (lines == null ? other.lines == null : lines.equals(other.lines));
  }
  
  
  @Override
  public int hashCode() {
    return Arrays.hashCode(digest);
  }
  
  
  @Override
  public String toString() {
    return
        "TextIndex[chars=%d, bytes=%d, checkpoints=%d, lines=%s]"
        .formatted(
            charSize, byteSize, checkpoints.count(),
            lines == null ? "none" : String.valueOf(lines.lineCount()));
  }
  
  
  //      S  E  R  I  A  L
  
  @Override
  public int serialSize() {
    return
        16 + digest.length + checkpoints.serialSize() + 1 +
        (lines == null ? 0 : lines.serialSize());
  }


  @Override
  public ByteBuffer writeTo(ByteBuffer out) throws BufferOverflowException {
    out.putLong(charSize).putLong(byteSize).put(digest);
    checkpoints.writeTo(out);
    out.put(lines == null ? (byte) 0 : 1);
    return lines == null ? out : lines.writeTo(out);
  }
  
  
  /**
   * Loads and returns an instance from its serial form. All structural
   * invariants are re-checked.
   * 
   * @throws SerialFormatException if malformed or inconsistent
   */
  static TextIndex load(ByteBuffer in) throws SerialFormatException {
    try {
      long charSize = in.getLong();
      long byteSize = in.getLong();
      byte[] digest = new byte[TextFrameConstants.HASH_WIDTH];
      in.get(digest);
      var checkpoints = CheckpointIndex.load(in, charSize, byteSize);
      int flag = 0xff & in.get();
      LineIndex lines;
      if (flag == 0)
        lines = null;
      else if (flag == 1)
        lines = LineIndex.load(in);
      else
        throw new SerialFormatException("line flag " + flag + ": " + in);
      if (in.hasRemaining())
        throw new SerialFormatException(
            in.remaining() + " trailing bytes after index");
      return new TextIndex(digest, checkpoints, lines);
    
    } catch (SerialFormatException sfx) {
      throw sfx;
    } catch (BufferUnderflowException | IllegalArgumentException x) {
      throw new SerialFormatException("on loading text index: " + x, x);
    }
  }

}
