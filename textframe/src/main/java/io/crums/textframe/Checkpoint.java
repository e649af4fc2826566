/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;

/**
 * A sampled (character offset, byte offset) pair. The byte offset is where
 * the character at {@code charOffset} begins.
 * 
 * @param charOffset    character (code point) offset (&ge; 0)
 * @param byteOffset    byte offset (&ge; {@code charOffset})
 */
public record Checkpoint(long charOffset, long byteOffset) {
  
  /** The first checkpoint of every text. */
  public final static Checkpoint ZERO = new Checkpoint(0, 0);
  
  public Checkpoint {
    if (charOffset < 0 || byteOffset < charOffset)
      throw new IllegalArgumentException(
          "charOffset %d, byteOffset %d".formatted(charOffset, byteOffset));
  }

}
