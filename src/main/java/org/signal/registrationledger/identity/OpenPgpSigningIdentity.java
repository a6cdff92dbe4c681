/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

import java.io.IOException;
import org.bouncycastle.bcpg.HashAlgorithmTags;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPPrivateKey;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPSecretKey;
import org.bouncycastle.openpgp.PGPSecretKeyRing;
import org.bouncycastle.openpgp.PGPSignature;
import org.bouncycastle.openpgp.PGPSignatureGenerator;
import org.bouncycastle.openpgp.operator.jcajce.JcaPGPContentSignerBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcaPGPDigestCalculatorProviderBuilder;
import org.bouncycastle.openpgp.operator.jcajce.JcePBESecretKeyDecryptorBuilder;

/**
 * A long-lived external identity backed by an OpenPGP secret key. Produces ASCII-armored detached signatures over
 * binary documents with SHA-256, the same shape {@code gpg --detach-sign --armor} produces.
 */
public class OpenPgpSigningIdentity implements SigningIdentity {

  private final PGPSecretKey secretKey;
  private final PGPPrivateKey privateKey;
  private final PGPPublicKey publicKey;
  private final String fingerprint;
  private final OpenPgpSignatureVerifier verifier = new OpenPgpSignatureVerifier();

  /**
   * @param secretKeyRing a secret key ring whose primary key is able to sign
   * @param passphrase    the passphrase protecting the primary key; empty if the key is unprotected
   * @throws PGPException if the primary key can't sign or can't be unlocked with {@code passphrase}
   */
  public OpenPgpSigningIdentity(final PGPSecretKeyRing secretKeyRing, final char[] passphrase) throws PGPException {
    this.secretKey = secretKeyRing.getSecretKey();

    if (!secretKey.isSigningKey()) {
      throw new PGPException("Primary key " + OpenPgpKeys.fingerprint(secretKey.getPublicKey()) + " cannot sign");
    }

    this.privateKey = secretKey.extractPrivateKey(
        new JcePBESecretKeyDecryptorBuilder(
            new JcaPGPDigestCalculatorProviderBuilder().setProvider(OpenPgpKeys.PROVIDER).build())
            .setProvider(OpenPgpKeys.PROVIDER)
            .build(passphrase));

    this.publicKey = secretKey.getPublicKey();
    this.fingerprint = OpenPgpKeys.fingerprint(publicKey);
  }

  public static OpenPgpSigningIdentity fromArmoredSecretKey(final String armoredSecretKey, final char[] passphrase)
      throws IOException, PGPException {

    return new OpenPgpSigningIdentity(OpenPgpKeys.readSecretKeyRing(armoredSecretKey), passphrase);
  }

  @Override
  public String sign(final byte[] payload) throws SigningBackendException {
    try {
      final PGPSignatureGenerator signatureGenerator = new PGPSignatureGenerator(
          new JcaPGPContentSignerBuilder(publicKey.getAlgorithm(), HashAlgorithmTags.SHA256)
              .setProvider(OpenPgpKeys.PROVIDER));

      signatureGenerator.init(PGPSignature.BINARY_DOCUMENT, privateKey);
      signatureGenerator.update(payload);

      return OpenPgpKeys.armor(signatureGenerator.generate());
    } catch (final PGPException | IOException e) {
      throw new SigningBackendException("Could not produce OpenPGP signature with key " + fingerprint, e);
    }
  }

  @Override
  public String exportPublicKey() throws SigningBackendException {
    try {
      return OpenPgpKeys.armor(publicKey);
    } catch (final IOException e) {
      throw new SigningBackendException("Could not export OpenPGP public key " + fingerprint, e);
    }
  }

  @Override
  public String fingerprint() {
    return fingerprint;
  }

  @Override
  public VerificationResult verify(final byte[] payload, final String signature, final String publicKey) {
    return verifier.verify(payload, signature, publicKey);
  }
}
