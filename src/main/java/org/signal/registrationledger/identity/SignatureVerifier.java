/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

/**
 * Checks signatures produced by one signature scheme. Implementations never throw: malformed input and backend
 * errors are reported as a failed {@link VerificationResult}.
 */
public interface SignatureVerifier {

  /**
   * @param payload   the exact bytes that were signed
   * @param signature the encoded signature, in the scheme's own text encoding
   * @param publicKey the encoded public key expected to have produced {@code signature}
   * @return the verification outcome
   */
  VerificationResult verify(byte[] payload, String signature, String publicKey);
}
