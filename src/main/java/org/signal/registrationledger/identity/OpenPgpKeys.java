/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Iterator;
import org.bouncycastle.bcpg.ArmoredOutputStream;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openpgp.PGPCompressedData;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPPublicKeyRingCollection;
import org.bouncycastle.openpgp.PGPSecretKeyRing;
import org.bouncycastle.openpgp.PGPSecretKeyRingCollection;
import org.bouncycastle.openpgp.PGPSignature;
import org.bouncycastle.openpgp.PGPSignatureList;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.jcajce.JcaPGPObjectFactory;
import org.bouncycastle.openpgp.operator.jcajce.JcaKeyFingerprintCalculator;

/**
 * Reading and writing of ASCII-armored OpenPGP keys and signatures.
 */
public class OpenPgpKeys {

  /**
   * Passed explicitly to every JCA operation so that the provider never has to be installed globally.
   */
  public static final BouncyCastleProvider PROVIDER = new BouncyCastleProvider();

  private OpenPgpKeys() {
  }

  /**
   * @return the uppercase hex fingerprint of {@code publicKey}
   */
  public static String fingerprint(final PGPPublicKey publicKey) {
    return HexFormat.of().withUpperCase().formatHex(publicKey.getFingerprint());
  }

  public static PGPSecretKeyRing readSecretKeyRing(final String armored) throws IOException, PGPException {
    try (final InputStream inputStream = decoderStream(armored)) {
      final Iterator<PGPSecretKeyRing> keyRings =
          new PGPSecretKeyRingCollection(inputStream, new JcaKeyFingerprintCalculator()).getKeyRings();

      if (!keyRings.hasNext()) {
        throw new PGPException("No secret key found");
      }
      return keyRings.next();
    }
  }

  public static PGPPublicKeyRing readPublicKeyRing(final String armored) throws IOException, PGPException {
    try (final InputStream inputStream = decoderStream(armored)) {
      final Iterator<PGPPublicKeyRing> keyRings =
          new PGPPublicKeyRingCollection(inputStream, new JcaKeyFingerprintCalculator()).getKeyRings();

      if (!keyRings.hasNext()) {
        throw new PGPException("No public key found");
      }
      return keyRings.next();
    }
  }

  public static PGPSignature readSignature(final String armored) throws IOException, PGPException {
    try (final InputStream inputStream = decoderStream(armored)) {
      Object object = new JcaPGPObjectFactory(inputStream).nextObject();

      if (object instanceof PGPCompressedData compressedData) {
        object = new JcaPGPObjectFactory(compressedData.getDataStream()).nextObject();
      }

      if (object instanceof PGPSignatureList signatures && signatures.size() > 0) {
        return signatures.get(0);
      }
      throw new PGPException("No detached signature found");
    }
  }

  /**
   * @return {@code publicKey}, with its user IDs and certifications, as an armored public key block
   */
  public static String armor(final PGPPublicKey publicKey) throws IOException {
    final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
    try (final ArmoredOutputStream armoredOutputStream = new ArmoredOutputStream(outputStream)) {
      publicKey.encode(armoredOutputStream);
    }
    return outputStream.toString(StandardCharsets.US_ASCII);
  }

  public static String armor(final PGPSignature signature) throws IOException {
    final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
    try (final ArmoredOutputStream armoredOutputStream = new ArmoredOutputStream(outputStream)) {
      signature.encode(armoredOutputStream);
    }
    return outputStream.toString(StandardCharsets.US_ASCII);
  }

  private static InputStream decoderStream(final String armored) throws IOException {
    return PGPUtil.getDecoderStream(new ByteArrayInputStream(armored.getBytes(StandardCharsets.US_ASCII)));
  }
}
