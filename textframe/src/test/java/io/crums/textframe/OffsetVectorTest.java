/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;

import org.junit.jupiter.api.Test;

import io.crums.textframe.io.SerialFormatException;

/**
 * 
 */
public class OffsetVectorTest {
  
  
  @Test
  public void testGrowth() {
    var vector = new OffsetVector(2);
    for (int index = 0; index < 1000; ++index)
      vector.add(index * 3L);
    assertEquals(1000, vector.size());
    assertEquals(999 * 3L, vector.last());
    assertEquals(4, vector.width());
    assertEquals(5 + 4 * 1000, vector.serialSize());
  }
  
  
  @Test
  public void testWidensPastInt() {
    var vector = new OffsetVector();
    vector.add(5).add(Integer.MAX_VALUE);
    assertEquals(4, vector.width());
    long big = Integer.MAX_VALUE + 10L;
    vector.add(big);
    assertEquals(8, vector.width());
    assertEquals(5, vector.get(0));
    assertEquals(Integer.MAX_VALUE, vector.get(1));
    assertEquals(big, vector.get(2));
    
    var loaded = OffsetVector.load(vector.serialize());
    assertEquals(vector, loaded);
    assertEquals(8, loaded.width());
  }
  
  
  @Test
  public void testRejectsDescending() {
    var vector = new OffsetVector().add(10);
    assertThrows(IllegalArgumentException.class, () -> vector.add(9));
    assertThrows(IllegalArgumentException.class, () -> new OffsetVector().add(-1));
  }
  
  
  @Test
  public void testFloorIndex() {
    var vector = new OffsetVector().add(0).add(10).add(20).add(30);
    assertEquals(-1, new OffsetVector().floorIndex(5));
    assertEquals(0, vector.floorIndex(0));
    assertEquals(0, vector.floorIndex(9));
    assertEquals(1, vector.floorIndex(10));
    assertEquals(2, vector.floorIndex(29));
    assertEquals(3, vector.floorIndex(1000));
  }
  
  
  @Test
  public void testLoadRejectsBadWidth() {
    var buffer = new OffsetVector().add(1).add(2).serialize();
    ByteBuffer bad = ByteBuffer.allocate(buffer.remaining()).put(buffer).flip();
    bad.put(0, (byte) 3);
    assertThrows(SerialFormatException.class, () -> OffsetVector.load(bad));
  }
  
  
  @Test
  public void testLoadRejectsOutOfSequence() {
    var out = ByteBuffer.allocate(5 + 8);
    out.put((byte) 4).putInt(2).putInt(7).putInt(6).flip();
    assertThrows(SerialFormatException.class, () -> OffsetVector.load(out));
  }
  
  
  @Test
  public void testLoadRejectsTruncated() {
    var out = ByteBuffer.allocate(5 + 4);
    out.put((byte) 4).putInt(2).putInt(7).flip();
    assertThrows(SerialFormatException.class, () -> OffsetVector.load(out));
  }

}
