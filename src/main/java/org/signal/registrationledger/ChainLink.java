/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger;

import java.nio.charset.StandardCharsets;
import org.signal.registrationledger.util.Sha256MessageDigest;

/**
 * Computes the hash that links a ledger entry to its predecessor.
 */
public class ChainLink {

  /**
   * Stands in for the chain hash of the entry before the first entry. Contains characters outside the hex alphabet,
   * so no digest output can ever be equal to it.
   */
  public static final String GENESIS_SENTINEL = "genesis:registration-ledger:0";

  private ChainLink() {
  }

  /**
   * @param previousChainHash the chain hash of the preceding entry, or {@link #GENESIS_SENTINEL}
   * @param canonicalBytes    the canonical bytes of the entry being chained
   * @return the lowercase hex SHA-256 digest of {@code previousChainHash || canonicalBytes}
   */
  public static String compute(final String previousChainHash, final byte[] canonicalBytes) {
    return Sha256MessageDigest.hexDigest(previousChainHash.getBytes(StandardCharsets.UTF_8), canonicalBytes);
  }
}
