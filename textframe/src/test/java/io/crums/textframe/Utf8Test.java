/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

/**
 * 
 */
public class Utf8Test {
  
  
  private static byte[] bytes(int... values) {
    byte[] out = new byte[values.length];
    for (int index = 0; index < values.length; ++index)
      out[index] = (byte) values[index];
    return out;
  }
  
  
  private void assertInvalid(long expectedOffset, byte[] seq) {
    var x = assertThrows(InvalidEncodingException.class, () -> Utf8.validate(seq, 0));
    assertEquals(expectedOffset, x.offset());
  }
  
  
  @Test
  public void testSeqLength() {
    assertEquals(1, Utf8.seqLength((byte) 'a'));
    assertEquals(2, Utf8.seqLength((byte) 0xd0));
    assertEquals(3, Utf8.seqLength((byte) 0xe4));
    assertEquals(4, Utf8.seqLength((byte) 0xf0));
    assertEquals(-1, Utf8.seqLength((byte) 0x80));
    assertEquals(-1, Utf8.seqLength((byte) 0xc0));
    assertEquals(-1, Utf8.seqLength((byte) 0xf5));
    assertTrue(Utf8.isContinuation((byte) 0xbf));
    assertFalse(Utf8.isContinuation((byte) 0xc2));
  }
  
  
  @Test
  public void testValidCounts() {
    String text = "a\u041f\u0420\u7b2c\u4e00\u6761\uD83D\uDE00\uFEFF";
    byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
    assertEquals(text.codePointCount(0, text.length()), Utf8.validate(utf8, 0));
    assertEquals(0, Utf8.validate(new byte[0], 0));
  }
  
  
  @Test
  public void testInvalidLead() {
    assertInvalid(1, bytes('a', 0x80, 'b'));
    assertInvalid(0, bytes(0xff));
  }
  
  
  @Test
  public void testOverlong() {
    assertInvalid(0, bytes(0xc0, 0xaf));
    assertInvalid(2, bytes('x', 'y', 0xe0, 0x80, 0xaf));
    assertInvalid(0, bytes(0xf0, 0x80, 0x80, 0xaf));
  }
  
  
  @Test
  public void testSurrogate() {
    // U+D800
    assertInvalid(0, bytes(0xed, 0xa0, 0x80));
    // U+D7FF is fine
    assertEquals(1, Utf8.validate(bytes(0xed, 0x9f, 0xbf), 0));
  }
  
  
  @Test
  public void testBeyondMaxCodePoint() {
    assertInvalid(0, bytes(0xf4, 0x90, 0x80, 0x80));
    assertEquals(1, Utf8.validate(bytes(0xf4, 0x8f, 0xbf, 0xbf), 0));
  }
  
  
  @Test
  public void testTruncated() {
    assertInvalid(1, bytes('a', 0xe4, 0xb8));
    // bad continuation reports the lead byte
    assertInvalid(1, bytes('a', 0xe4, 0xb8, 'c'));
  }
  
  
  @Test
  public void testBaseOffset() {
    var x = assertThrows(
        InvalidEncodingException.class,
        () -> Utf8.validate(bytes('a', 'b', 0xfe), 1000));
    assertEquals(1002, x.offset());
  }
  
  
  @Test
  public void testSkipChars() {
    byte[] utf8 = "a\u041f\u7b2c\uD83D\uDE00z".getBytes(StandardCharsets.UTF_8);
    var segment = ByteBuffer.wrap(utf8);
    assertEquals(0, Utf8.skipChars(segment, 0));
    assertEquals(1 + 2 + 3, Utf8.skipChars(segment, 3));
    assertEquals(4, Utf8.skipChars(segment.duplicate(), 1));
    assertEquals(5, Utf8.skipChars(segment, 2));
    assertThrows(IllegalArgumentException.class, () -> Utf8.skipChars(segment, 1));
  }
  
  
  @Test
  public void testDecoderAcrossCalls() {
    var decoder = new Utf8.Decoder();
    byte[] seq = "\u7b2c".getBytes(StandardCharsets.UTF_8);
    assertTrue(decoder.atBoundary());
    assertFalse(decoder.next(seq[0], 0));
    assertFalse(decoder.atBoundary());
    assertFalse(decoder.next(seq[1], 1));
    assertTrue(decoder.next(seq[2], 2));
    assertTrue(decoder.atBoundary());
    decoder.finish();
  }

}
