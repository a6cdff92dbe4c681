/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

import java.security.InvalidKeyException;
import java.security.KeyPair;
import java.security.NoSuchAlgorithmException;
import java.security.Signature;
import java.security.SignatureException;
import java.security.interfaces.EdECPrivateKey;
import java.security.interfaces.EdECPublicKey;
import java.util.HexFormat;
import org.signal.registrationledger.util.Ed25519Keys;

/**
 * An Ed25519 key pair held in memory. The ledger uses one of these, usually generated per ledger instance, as its
 * chain identity.
 */
public class Ed25519SigningIdentity implements SigningIdentity {

  private final EdECPrivateKey privateKey;
  private final EdECPublicKey publicKey;
  private final Ed25519SignatureVerifier verifier = new Ed25519SignatureVerifier();

  public Ed25519SigningIdentity(final EdECPrivateKey privateKey, final EdECPublicKey publicKey)
      throws InvalidKeyException {

    this.privateKey = privateKey;
    this.publicKey = publicKey;

    // Check that the keys are usable before accepting any work
    try {
      final Signature testSignature = Signature.getInstance("Ed25519");
      testSignature.initSign(privateKey);
      testSignature.initVerify(publicKey);
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform since 15 supports Ed25519", e);
    }
  }

  /**
   * @return a new identity with a freshly generated key pair
   */
  public static Ed25519SigningIdentity generate() {
    final KeyPair keyPair = Ed25519Keys.generateKeyPair();
    try {
      return new Ed25519SigningIdentity((EdECPrivateKey) keyPair.getPrivate(), (EdECPublicKey) keyPair.getPublic());
    } catch (final InvalidKeyException e) {
      throw new AssertionError("Freshly generated keys must be valid", e);
    }
  }

  @Override
  public String sign(final byte[] payload) throws SigningBackendException {
    try {
      final Signature signature = Signature.getInstance("Ed25519");
      signature.initSign(privateKey);
      signature.update(payload);
      return HexFormat.of().formatHex(signature.sign());
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform since 15 supports Ed25519", e);
    } catch (final InvalidKeyException | SignatureException e) {
      throw new SigningBackendException("Could not produce Ed25519 signature", e);
    }
  }

  @Override
  public String exportPublicKey() {
    return Ed25519Keys.encodePublicKey(publicKey);
  }

  @Override
  public String fingerprint() {
    return Ed25519Keys.fingerprint(publicKey);
  }

  @Override
  public VerificationResult verify(final byte[] payload, final String signature, final String publicKey) {
    return verifier.verify(payload, signature, publicKey);
  }
}
