/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public class Sha256MessageDigest {

  private Sha256MessageDigest() {
  }

  /**
   * Digests the concatenation of {@code inputs} with SHA-256, which every implementation of the Java platform is
   * required to support.
   *
   * @param inputs the byte arrays to digest, in order
   * @return the lowercase hex digest
   */
  public static String hexDigest(final byte[]... inputs) {
    final MessageDigest messageDigest;
    try {
      messageDigest = MessageDigest.getInstance("SHA-256");
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform is required to support SHA-256", e);
    }

    for (final byte[] input : inputs) {
      messageDigest.update(input);
    }
    return HexFormat.of().formatHex(messageDigest.digest());
  }
}
