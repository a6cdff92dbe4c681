/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.Signature;
import java.security.SignatureException;
import java.security.interfaces.EdECPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.util.HexFormat;
import org.signal.registrationledger.util.Ed25519Keys;

/**
 * Verifies hex-encoded Ed25519 signatures against base64 X.509 public keys. Used for chain signatures.
 */
public class Ed25519SignatureVerifier implements SignatureVerifier {

  @Override
  public VerificationResult verify(final byte[] payload, final String signature, final String publicKey) {
    if (payload == null || signature == null || publicKey == null) {
      return VerificationResult.failure("Missing payload, signature or public key");
    }

    final EdECPublicKey edECPublicKey;
    try {
      edECPublicKey = Ed25519Keys.parsePublicKey(publicKey);
    } catch (final InvalidKeySpecException | IllegalArgumentException | ClassCastException e) {
      return VerificationResult.failure("Malformed Ed25519 public key: " + e.getMessage());
    }

    final byte[] signatureBytes;
    try {
      signatureBytes = HexFormat.of().parseHex(signature);
    } catch (final IllegalArgumentException e) {
      return VerificationResult.failure("Malformed signature encoding: " + e.getMessage());
    }

    try {
      final Signature verifier = Signature.getInstance("Ed25519");
      verifier.initVerify(edECPublicKey);
      verifier.update(payload);
      if (!verifier.verify(signatureBytes)) {
        return VerificationResult.failure("Signature did not match");
      }
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform since 15 supports Ed25519", e);
    } catch (final InvalidKeyException | SignatureException e) {
      return VerificationResult.failure("Could not verify signature: " + e.getMessage());
    }

    return VerificationResult.success(Ed25519Keys.fingerprint(edECPublicKey));
  }
}
