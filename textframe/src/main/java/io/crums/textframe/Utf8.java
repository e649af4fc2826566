/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import java.nio.ByteBuffer;

/**
 * UTF-8 (RFC 3629) byte-level utilities. Overlong forms, surrogates, code
 * points beyond {@code U+10FFFF}, and truncated sequences are all rejected.
 */
final class Utf8 {
  
  private Utf8() {  }   // never
  
  
  /**
   * Returns {@code true} iff the given byte is a continuation byte
   * ({@code 10xxxxxx}).
   */
  static boolean isContinuation(byte b) {
    return (b & 0xc0) == 0x80;
  }
  
  
  /**
   * Returns the length of the sequence the given lead byte begins, or -1
   * if {@code lead} cannot begin a sequence.
   */
  static int seqLength(byte lead) {
    int u = lead & 0xff;
    if (u < 0x80)
      return 1;
    if (u < 0xc2)
      return -1;
    if (u < 0xe0)
      return 2;
    if (u < 0xf0)
      return 3;
    return u < 0xf5 ? 4 : -1;
  }
  
  
  /**
   * Validates the given bytes and returns the number of characters (code
   * points) they encode.
   * 
   * @param bytes       the sequence
   * @param baseOffset  the file offset of {@code bytes[0]}; used in error
   *                    reporting only
   * 
   * @throws InvalidEncodingException
   *         reporting the file offset of the first bad sequence
   */
  static long validate(byte[] bytes, long baseOffset)
      throws InvalidEncodingException {
    var decoder = new Decoder();
    long chars = 0;
    for (int index = 0; index < bytes.length; ++index)
      if (decoder.next(bytes[index], baseOffset + index))
        ++chars;
    decoder.finish();
    return chars;
  }
  
  
  /**
   * Skips the given number of characters from the buffer's position and
   * returns the number of bytes skipped. The buffer's position is
   * advanced. The bytes are assumed valid.
   * 
   * @param segment     already validated UTF-8 bytes
   * @param chars       number of characters to skip (&ge; 0)
   * 
   * @return the number of bytes skipped
   * @throws IllegalArgumentException
   *         if {@code segment} has fewer than {@code chars} characters
   */
  static int skipChars(ByteBuffer segment, long chars) {
    final int start = segment.position();
    for (long count = 0; count < chars; ++count) {
      if (!segment.hasRemaining())
        throw new IllegalArgumentException(
            "segment ends after %d of %d characters".formatted(count, chars));
      int len = seqLength(segment.get(segment.position()));
      if (len == -1 || len > segment.remaining())
        throw new IllegalArgumentException(
            "corrupt segment at position " + segment.position());
      segment.position(segment.position() + len);
    }
    return segment.position() - start;
  }
  
  
  
  /**
   * Returns the number of characters beginning in the buffer's remaining
   * bytes. The buffer's position is not advanced.
   * 
   * @param bytes       already validated UTF-8 bytes
   */
  static int countChars(ByteBuffer bytes) {
    int count = 0;
    for (int index = bytes.position(); index < bytes.limit(); ++index)
      if (!isContinuation(bytes.get(index)))
        ++count;
    return count;
  }
  
  
  
  /**
   * Streaming validator. Bytes are fed one at a time, in order; the decoder
   * tracks sequences that straddle buffer boundaries.
   */
  static final class Decoder {
    
    /** Number of continuation bytes still expected. */
    private int pending;
    /** Inclusive bounds of the next continuation byte. */
    private int lo = 0x80;
    private int hi = 0xbf;
    /** File offset of the current sequence's lead byte. */
    private long leadOffset;
    
    
    /**
     * Returns {@code true} iff the next byte must begin a new character.
     */
    boolean atBoundary() {
      return pending == 0;
    }
    
    
    /**
     * Feeds the next byte.
     * 
     * @param b         the byte
     * @param offset    its file offset
     * 
     * @return {@code true} iff {@code b} completes a character
     * @throws InvalidEncodingException
     *         on a bad sequence; the reported offset is the sequence's lead byte's
     */
    boolean next(byte b, long offset) throws InvalidEncodingException {
      final int u = b & 0xff;
      if (pending == 0) {
        if (u < 0x80)
          return true;
        
        leadOffset = offset;
        if (u < 0xc2 || u > 0xf4)
          throw new InvalidEncodingException(offset);
        
        if (u < 0xe0)
          pending = 1;
        else if (u < 0xf0) {
          pending = 2;
          if (u == 0xe0)
            lo = 0xa0;          // overlong
          else if (u == 0xed)
            hi = 0x9f;          // surrogates
        } else {
          pending = 3;
          if (u == 0xf0)
            lo = 0x90;          // overlong
          else if (u == 0xf4)
            hi = 0x8f;          // > U+10FFFF
        }
        return false;
      }
      
      if (u < lo || u > hi)
        throw new InvalidEncodingException(leadOffset);
      lo = 0x80;
      hi = 0xbf;
      return --pending == 0;
    }
    
    
    /**
     * Signals the end of input.
     * 
     * @throws InvalidEncodingException if a sequence was left unfinished
     */
    void finish() throws InvalidEncodingException {
      if (pending != 0)
        throw new InvalidEncodingException(
            leadOffset, "truncated UTF-8 sequence at byte offset " + leadOffset);
    }
  }

}
