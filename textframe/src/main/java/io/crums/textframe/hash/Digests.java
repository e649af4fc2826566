/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe.hash;

/**
 * The hashing algorithms we use are gathered here. Only one, for now.
 */
public enum Digests implements Digest {
  
  /** SHA-256. Hash width: 32 bytes. */
  SHA_256("SHA-256", 32);
  
  
  private final String algo;
  private final int width;
  
  private Digests(String algo, int width) {
    this.algo = algo;
    this.width = width;
  }

  @Override
  public int hashWidth() {
    return width;
  }

  @Override
  public String hashAlgo() {
    return algo;
  }

}
