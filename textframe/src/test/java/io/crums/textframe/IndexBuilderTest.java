/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.crums.textframe.io.SerialFormatException;

/**
 * 
 */
public class IndexBuilderTest {
  
  /** 6 chars, 12 bytes: widths 1, 2, 3, 4, 1, 1. */
  final static String MIXED = "aП第😀z\n";
  
  
  static TextIndex build(String text, int stride, boolean lines) throws IOException {
    return build(text.getBytes(StandardCharsets.UTF_8), stride, lines);
  }
  
  static TextIndex build(byte[] text, int stride, boolean lines) throws IOException {
    var ch = Channels.newChannel(new ByteArrayInputStream(text));
    return new IndexBuilder(stride, lines).build(ch, "test");
  }
  
  
  /** Serves segments from the given bytes, and records the requests. */
  static class RecordingReader implements CheckpointIndex.SegmentReader {
    final byte[] text;
    final List<long[]> requests = new ArrayList<>();
    
    RecordingReader(String text) {
      this.text = text.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public ByteBuffer read(long beginByte, long endByte) {
      requests.add(new long[] { beginByte, endByte });
      return ByteBuffer.wrap(text, (int) beginByte, (int) (endByte - beginByte)).slice();
    }
  }
  
  
  @Test
  public void testSizesAndDigest() throws Exception {
    var index = build(MIXED, 2, false);
    assertEquals(6, index.charSize());
    assertEquals(12, index.byteSize());
    assertFalse(index.hasLines());
    
    byte[] expected = MessageDigest.getInstance("SHA-256").digest(
        MIXED.getBytes(StandardCharsets.UTF_8));
    assertTrue(index.digestEquals(expected));
    assertEquals(ByteBuffer.wrap(expected), index.digest());
  }
  
  
  @Test
  public void testCheckpoints() throws IOException {
    var cps = build(MIXED, 2, false).checkpoints();
    assertEquals(2, cps.stride());
    assertEquals(3, cps.count());
    assertEquals(Checkpoint.ZERO, cps.checkpoint(0));
    assertEquals(new Checkpoint(2, 3), cps.checkpoint(1));
    assertEquals(new Checkpoint(4, 10), cps.checkpoint(2));
  }
  
  
  @Test
  public void testResolveMixed() throws IOException {
    var cps = build(MIXED, 2, false).checkpoints();
    var reader = new RecordingReader(MIXED);
    
    long[] expected = { 0, 1, 3, 6, 10, 11, 12 };
    for (int c = 0; c < expected.length; ++c)
      assertEquals(expected[c], cps.resolve(c, reader), "char " + c);
    
    // only chars 1 and 3 fall mid-segment; both segments are of mixed width
    assertEquals(2, reader.requests.size());
    assertArrayEquals(new long[] { 3, 7 }, reader.requests.get(1));
  }
  
  
  @Test
  public void testResolveFixed() throws IOException {
    var cps = build(MIXED, 2, false).checkpoints();
    long[] expected = { 0, -1, 3, -1, 10, 11, 12 };
    for (int c = 0; c < expected.length; ++c)
      assertEquals(expected[c], cps.resolveFixed(c), "char " + c);
    assertEquals(new Checkpoint(2, 3), cps.floor(3));
    assertThrows(OffsetOutOfBoundsException.class, () -> cps.resolveFixed(7));
  }
  
  
  @Test
  public void testCharOffsetOf() throws IOException {
    var cps = build(MIXED, 2, false).checkpoints();
    var reader = new RecordingReader(MIXED);
    
    long[] bytes = { 0, 1, 3, 6, 10, 11, 12 };
    for (int c = 0; c < bytes.length; ++c)
      assertEquals(c, cps.charOffsetOf(bytes[c], reader), "byte " + bytes[c]);
    
    // bytes 1 and 6 fall mid-segment, in segments of mixed width
    assertEquals(2, reader.requests.size());
    assertArrayEquals(new long[] { 0, 1 }, reader.requests.get(0));
    assertArrayEquals(new long[] { 3, 6 }, reader.requests.get(1));
    
    assertThrows(OffsetOutOfBoundsException.class, () -> cps.charOffsetOf(13, reader));
  }
  
  
  @Test
  public void testResolveUniformWidths() throws IOException {
    CheckpointIndex.SegmentReader noReads = (b, e) -> {
      throw new AssertionError("unexpected read [" + b + ", " + e + ")");
    };
    
    var ascii = build("abcdefghij", 4, false).checkpoints();
    for (int c = 0; c <= 10; ++c)
      assertEquals(c, ascii.resolve(c, noReads));
    
    var emoji = build("😀😁😂", 2, false).checkpoints();
    assertEquals(2, emoji.count());
    for (int c = 0; c <= 3; ++c)
      assertEquals(4 * c, emoji.resolve(c, noReads));
    
    assertThrows(OffsetOutOfBoundsException.class, () -> emoji.resolve(4, noReads));
    assertThrows(OffsetOutOfBoundsException.class, () -> emoji.resolve(-1, noReads));
  }
  
  
  @Test
  public void testStrideOfOne() throws IOException {
    var cps = build(MIXED, 1, false).checkpoints();
    assertEquals(6, cps.count());
    assertEquals(new Checkpoint(5, 11), cps.checkpoint(5));
  }
  
  
  @Test
  public void testLineStarts() throws IOException {
    var lines = build("a\nb\nc\n", 4096, true).lines().get();
    assertEquals(3, lines.lineCount());
    assertEquals(new LineEntry(0, 0, 2, 0, 2), lines.entry(0));
    assertEquals(new LineEntry(2, 4, 6, 4, 6), lines.entry(2));
    assertEquals(6, lines.startChar(3));
    
    var unterminated = build("a\nbc", 4096, true).lines().get();
    assertEquals(2, unterminated.lineCount());
    assertEquals(new LineEntry(1, 2, 4, 2, 4), unterminated.entry(1));
    
    var blanks = build("\n\n", 4096, true).lines().get();
    assertEquals(2, blanks.lineCount());
    
    var noEol = build("x", 4096, true).lines().get();
    assertEquals(1, noEol.lineCount());
  }
  
  
  @Test
  public void testLineBytes() throws IOException {
    var lines = build("第\n" + MIXED + "end", 4096, true).lines().get();
    assertEquals(3, lines.lineCount());
    assertEquals(new LineEntry(1, 2, 8, 4, 16), lines.entry(1));
    assertEquals(new LineEntry(2, 8, 11, 16, 19), lines.entry(2));
    assertEquals(1, lines.lineNoOf(2));
    assertEquals(1, lines.lineNoOf(7));
    assertEquals(2, lines.lineNoOf(8));
    assertThrows(LineOutOfBoundsException.class, () -> lines.entry(3));
    assertThrows(LineOutOfBoundsException.class, () -> lines.startByte(4));
  }
  
  
  @Test
  public void testEmpty() {
    assertThrows(EmptyTextException.class, () -> build(new byte[0], 16, true));
  }
  
  
  @Test
  public void testInvalidEncodingOffset() {
    byte[] text = "abc第d".getBytes(StandardCharsets.UTF_8);
    text[4] = (byte) 'X';   // clobber a continuation byte of the CJK char
    var x = assertThrows(InvalidEncodingException.class, () -> build(text, 2, true));
    assertEquals(3, x.offset());
  }
  
  
  @Test
  public void testInvalidAcrossBufferBoundary() {
    // the bad sequence straddles the 64k read buffer
    byte[] text = new byte[64 * 1024 + 2];
    Arrays.fill(text, (byte) 'a');
    text[64 * 1024 - 1] = (byte) 0xe4;
    text[64 * 1024] = (byte) 0xb8;
    var x = assertThrows(InvalidEncodingException.class, () -> build(text, 4096, false));
    assertEquals(64 * 1024 - 1, x.offset());
  }
  
  
  @Test
  public void testSerialForm() throws IOException {
    var index = build(MIXED + MIXED + "\n", 3, true);
    var loaded = TextIndex.load(index.serialize());
    assertEquals(index, loaded);
    assertEquals(index.lines().get().lineCount(), loaded.lines().get().lineCount());
    
    var sansLines = index.withoutLines();
    assertFalse(sansLines.hasLines());
    assertEquals(sansLines, TextIndex.load(sansLines.serialize()));
  }
  
  
  @Test
  public void testSerialFormValidated() throws IOException {
    var index = build(MIXED, 2, true);
    
    // stride zero
    ByteBuffer bad = index.serialize();
    bad.putInt(16 + TextFrameConstants.HASH_WIDTH, 0);
    assertThrows(SerialFormatException.class, () -> TextIndex.load(bad));
    
    // char size inconsistent with checkpoints
    ByteBuffer badSize = index.serialize();
    badSize.putLong(0, 13);
    assertThrows(SerialFormatException.class, () -> TextIndex.load(badSize));
    
    // truncated
    ByteBuffer truncated = index.serialize();
    truncated.limit(truncated.limit() - 3);
    assertThrows(SerialFormatException.class, () -> TextIndex.load(truncated));
    
    // trailing garbage
    var good = index.serialize();
    ByteBuffer padded = ByteBuffer.allocate(good.remaining() + 1).put(good);
    padded.put((byte) 0).flip();
    assertThrows(SerialFormatException.class, () -> TextIndex.load(padded));
  }

}
