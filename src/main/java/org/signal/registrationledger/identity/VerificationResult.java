/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

import java.util.Optional;

/**
 * The outcome of checking a signature. Verification failures are an expected outcome, so they are reported as values
 * rather than thrown.
 *
 * @param valid             whether the signature was valid
 * @param signerFingerprint the fingerprint of the key that produced a valid signature
 * @param failureReason     a diagnostic description of why verification failed
 */
public record VerificationResult(boolean valid, Optional<String> signerFingerprint, Optional<String> failureReason) {

  public static VerificationResult success(final String signerFingerprint) {
    return new VerificationResult(true, Optional.of(signerFingerprint), Optional.empty());
  }

  public static VerificationResult failure(final String reason) {
    return new VerificationResult(false, Optional.empty(), Optional.of(reason));
  }

  public String describe() {
    return valid
        ? "valid signature from " + signerFingerprint.orElse("unknown signer")
        : failureReason.orElse("invalid signature");
  }
}
