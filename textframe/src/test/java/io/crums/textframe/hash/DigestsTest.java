/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe.hash;


import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.security.MessageDigest;
import java.util.Random;

import org.apache.commons.codec.binary.Hex;
import org.junit.jupiter.api.Test;

/**
 * 
 */
public class DigestsTest {
  
  @Test
  public void testSha256() throws Exception {
    var digest = Digests.SHA_256;
    assertEquals(32, digest.hashWidth());
    assertEquals("SHA-256", digest.hashAlgo());
    assertEquals("SHA-256", digest.newDigest().getAlgorithm());
  }
  
  
  @Test
  public void testChannelDigest() throws Exception {
    byte[] data = new byte[200_000];
    new Random(7).nextBytes(data);
    byte[] expected = MessageDigest.getInstance("SHA-256").digest(data);
    byte[] actual = Digests.SHA_256.digest(
        Channels.newChannel(new ByteArrayInputStream(data)));
    assertArrayEquals(expected, actual);
  }
  
  
  @Test
  public void testEmptyChannel() throws IOException {
    byte[] actual = Digests.SHA_256.digest(
        Channels.newChannel(new ByteArrayInputStream(new byte[0])));
    assertEquals(
        "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
        Hex.encodeHexString(actual));
  }

}
