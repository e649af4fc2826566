/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import io.crums.textframe.RangeResolver.Unit;

/**
 * 
 */
public class RangeResolverTest {
  
  
  @Test
  public void testZeroZeroIsEverything() {
    assertEquals(new OffsetRange(0, 100), RangeResolver.resolve(0, 0, 100, Unit.CHAR));
  }
  
  @Test
  public void testTail() {
    assertEquals(new OffsetRange(90, 100), RangeResolver.resolve(-10, 0, 100, Unit.CHAR));
    assertEquals(new OffsetRange(90, 99), RangeResolver.resolve(-10, -1, 100, Unit.CHAR));
  }
  
  @Test
  public void testAbsolute() {
    assertEquals(new OffsetRange(1, 10), RangeResolver.resolve(1, 10, 100, Unit.CHAR));
    assertEquals(new OffsetRange(100, 100), RangeResolver.resolve(100, 0, 100, Unit.CHAR));
    assertTrue(RangeResolver.resolve(5, 5, 100, Unit.CHAR).isEmpty());
  }
  
  @Test
  public void testFarNegativeNotClamped() {
    var x = assertThrows(
        OffsetOutOfBoundsException.class,
        () -> RangeResolver.resolve(-150, 0, 100, Unit.CHAR));
    assertEquals(-50, x.requested());
    assertEquals(100, x.total());
  }
  
  @Test
  public void testEndOutOfBounds() {
    var x = assertThrows(
        OffsetOutOfBoundsException.class,
        () -> RangeResolver.resolve(1, 999, 914, Unit.CHAR));
    assertEquals(999, x.requested());
  }
  
  @Test
  public void testInverted() {
    var x = assertThrows(
        InvertedRangeException.class,
        () -> RangeResolver.resolve(10, 5, 100, Unit.CHAR));
    assertEquals(10, x.start());
    assertEquals(5, x.end());
    // -1 resolves to 99; end 0 is 100: fine
    RangeResolver.resolve(-1, 0, 100, Unit.CHAR);
    assertThrows(
        InvertedRangeException.class,
        () -> RangeResolver.resolve(-1, -2, 100, Unit.CHAR));
  }
  
  @Test
  public void testBoundsBeforeInversion() {
    assertThrows(
        OffsetOutOfBoundsException.class,
        () -> RangeResolver.resolve(200, 5, 100, Unit.CHAR));
  }
  
  @Test
  public void testLines() {
    assertEquals(new OffsetRange(2, 3), RangeResolver.resolve(-1, 0, 3, Unit.LINE));
    var x = assertThrows(
        LineOutOfBoundsException.class,
        () -> RangeResolver.resolve(1, 999, 16, Unit.LINE));
    assertEquals(999, x.requested());
    assertEquals(16, x.total());
  }
  
  @Test
  public void testResolvePosition() {
    assertEquals(0, RangeResolver.resolvePosition(0, 10, Unit.LINE));
    assertEquals(9, RangeResolver.resolvePosition(-1, 10, Unit.LINE));
    assertEquals(10, RangeResolver.resolvePosition(10, 10, Unit.LINE));
    assertThrows(
        LineOutOfBoundsException.class,
        () -> RangeResolver.resolvePosition(11, 10, Unit.LINE));
    assertThrows(
        OffsetOutOfBoundsException.class,
        () -> RangeResolver.resolvePosition(-11, 10, Unit.CHAR));
  }

}
