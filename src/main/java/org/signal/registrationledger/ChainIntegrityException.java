/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger;

/**
 * Indicates that a stored ledger entry does not match the entry chained before it, its own chain hash, or its chain
 * signature. Every entry at or after {@link #getIndex()} should be treated as unverified.
 */
public class ChainIntegrityException extends Exception {

  private final int index;
  private final String expectedHash;
  private final String actualHash;

  public ChainIntegrityException(final int index, final String reason, final String expectedHash,
      final String actualHash) {

    super("Chain broken at entry " + index + ": " + reason + " (expected " + expectedHash + ", found " + actualHash
        + ")");

    this.index = index;
    this.expectedHash = expectedHash;
    this.actualHash = actualHash;
  }

  /**
   * Reports a failure that involves no hash mismatch, such as a rejected chain signature.
   */
  public ChainIntegrityException(final int index, final String reason) {
    super("Chain broken at entry " + index + ": " + reason);

    this.index = index;
    this.expectedHash = null;
    this.actualHash = null;
  }

  public int getIndex() {
    return index;
  }

  /**
   * @return the hash recomputed from the ledger, the predecessor's chain hash for a broken link, or {@code null} if
   * the failure involves no hash mismatch
   */
  public String getExpectedHash() {
    return expectedHash;
  }

  /**
   * @return the hash stored in the entry, or {@code null} if the failure involves no hash mismatch
   */
  public String getActualHash() {
    return actualHash;
  }
}
