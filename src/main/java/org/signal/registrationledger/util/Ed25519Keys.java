/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.util;

import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PublicKey;
import java.security.interfaces.EdECPrivateKey;
import java.security.interfaces.EdECPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Locale;

/**
 * Encoding helpers for Ed25519 keys. Public keys travel as base64 X.509 and private keys as base64 PKCS#8.
 */
public class Ed25519Keys {

  private static final String ALGORITHM = "Ed25519";

  private Ed25519Keys() {
  }

  public static KeyPair generateKeyPair() {
    try {
      return KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform since 15 supports Ed25519", e);
    }
  }

  /**
   * @throws InvalidKeySpecException if the decoded bytes are not an X.509-encoded Ed25519 public key
   * @throws IllegalArgumentException if {@code base64} is not valid base64
   */
  public static EdECPublicKey parsePublicKey(final String base64) throws InvalidKeySpecException {
    final byte[] publicKeyBytes = Base64.getDecoder().decode(base64);
    return (EdECPublicKey) keyFactory().generatePublic(new X509EncodedKeySpec(publicKeyBytes));
  }

  /**
   * @throws InvalidKeySpecException if the decoded bytes are not a PKCS#8-encoded Ed25519 private key
   * @throws IllegalArgumentException if {@code base64} is not valid base64
   */
  public static EdECPrivateKey parsePrivateKey(final String base64) throws InvalidKeySpecException {
    final byte[] privateKeyBytes = Base64.getDecoder().decode(base64);
    return (EdECPrivateKey) keyFactory().generatePrivate(new PKCS8EncodedKeySpec(privateKeyBytes));
  }

  public static String encodePublicKey(final PublicKey publicKey) {
    return Base64.getEncoder().encodeToString(publicKey.getEncoded());
  }

  /**
   * @return the uppercase hex SHA-256 digest of the X.509 encoding of {@code publicKey}
   */
  public static String fingerprint(final PublicKey publicKey) {
    return Sha256MessageDigest.hexDigest(publicKey.getEncoded()).toUpperCase(Locale.ROOT);
  }

  private static KeyFactory keyFactory() {
    try {
      return KeyFactory.getInstance(ALGORITHM);
    } catch (final NoSuchAlgorithmException e) {
      throw new AssertionError("Every implementation of the Java platform since 15 supports Ed25519", e);
    }
  }
}
