/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.textframe;


import java.lang.System.Logger;

import io.crums.textframe.hash.Digest;
import io.crums.textframe.hash.Digests;

/**
 * Library constants.
 */
public class TextFrameConstants {
  
  // never
  private TextFrameConstants() {  }
  
  
  /**
   * The library's logger name.
   * 
   * @see #sysLogger()
   */
  public final static String LOG_NAME = "io.crums.textframe";
  
  /** Returns the library's logger. */
  public static Logger sysLogger() {
    return System.getLogger(LOG_NAME);
  }
  
  
  /**
   * Digest used to fingerprint source files. Currently SHA-256.
   */
  public final static Digest DIGEST = Digests.SHA_256;
  
  /** Digest hash width in bytes (32). */
  public final static int HASH_WIDTH = DIGEST.hashWidth();
  
  
  /**
   * Default number of characters between checkpoints (4096). This bounds the
   * number of characters decoded per offset lookup.
   */
  public final static int DEFAULT_CHECKPOINT_STRIDE = 4096;
  
  /** Maximum checkpoint stride (1M characters). */
  public final static int MAX_CHECKPOINT_STRIDE = 1 << 20;
  
  
  /**
   * Checks the given checkpoint stride and returns it.
   * 
   * @throws IllegalArgumentException
   *         if not in the range [1, {@linkplain #MAX_CHECKPOINT_STRIDE}]
   */
  public static int checkStride(int stride) {
    if (stride < 1 || stride > MAX_CHECKPOINT_STRIDE)
      throw new IllegalArgumentException(
          "checkpoint stride %d not in range [1, %d]"
          .formatted(stride, MAX_CHECKPOINT_STRIDE));
    return stride;
  }

}
