/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe.hash;


import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Specifies a hashing method. The text index records the content hash of its
 * source under this scheme, and checks it again before a cached index is
 * trusted.
 * 
 * @see Digests#SHA_256
 */
public interface Digest {
  
  
  /**
   * Returns the number of bytes used to form a hash.
   * 
   * @see MessageDigest#getDigestLength()
   */
  int hashWidth();
  
  
  /**
   * Returns the name of the hashing algorithm.
   * 
   * @see MessageDigest#getAlgorithm()
   */
  String hashAlgo();
  
  
  /**
   * Creates and returns a new {@code MessageDigest}. The
   * returned instance must match this specification.
   */
  default MessageDigest newDigest() {
    String algo = hashAlgo();
    try {
      
      MessageDigest digest = MessageDigest.getInstance(algo);
      assert digest.getDigestLength() == hashWidth();
      
      return digest;
      
    } catch (NoSuchAlgorithmException nsax) {
      throw new RuntimeException("on creating digest with algo " + algo, nsax);
    }
  }
  
  
  /**
   * Digests the given stream to its end and returns the hash.
   * 
   * @param in          the byte stream (consumed)
   * 
   * @return a {@linkplain #hashWidth()}-byte array
   */
  default byte[] digest(ReadableByteChannel in) throws IOException {
    MessageDigest digest = newDigest();
    ByteBuffer buffer = ByteBuffer.allocate(64 * 1024);
    while (in.read(buffer) != -1) {
      digest.update(buffer.flip());
      buffer.clear();
    }
    return digest.digest();
  }

}
