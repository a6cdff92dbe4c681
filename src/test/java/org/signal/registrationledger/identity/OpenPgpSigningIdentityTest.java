/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.openpgp.PGPException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.signal.registrationledger.util.PgpTestKeys;

class OpenPgpSigningIdentityTest {

  private static final byte[] PAYLOAD = "{\"identity_fingerprint\":\"ABC\",\"v\":1}".getBytes(StandardCharsets.UTF_8);

  private static String armoredSecretKey;
  private static OpenPgpSigningIdentity signingIdentity;
  private static OpenPgpSigningIdentity otherSigningIdentity;

  private final OpenPgpSignatureVerifier verifier = new OpenPgpSignatureVerifier();

  @BeforeAll
  static void setUpKeys() throws PGPException, IOException {
    armoredSecretKey = PgpTestKeys.generateArmoredSecretKey("Registrant <registrant@example.org>");
    signingIdentity = OpenPgpSigningIdentity.fromArmoredSecretKey(armoredSecretKey, PgpTestKeys.PASSPHRASE);
    otherSigningIdentity = PgpTestKeys.generateIdentity("Someone Else <someone@example.org>");
  }

  @Test
  void testSignAndVerify() throws SigningBackendException {
    final String signature = signingIdentity.sign(PAYLOAD);

    assertTrue(signature.contains("BEGIN PGP SIGNATURE"));

    final VerificationResult result = verifier.verify(PAYLOAD, signature, signingIdentity.exportPublicKey());

    assertTrue(result.valid(), result.describe());
    assertEquals(signingIdentity.fingerprint(), result.signerFingerprint().orElseThrow());
  }

  @Test
  void testFingerprint() {
    assertEquals(40, signingIdentity.fingerprint().length());
    assertTrue(signingIdentity.fingerprint().matches("[0-9A-F]+"));
  }

  @Test
  void testExportedPublicKeyIsArmored() throws SigningBackendException {
    assertTrue(signingIdentity.exportPublicKey().contains("BEGIN PGP PUBLIC KEY BLOCK"));
  }

  @Test
  void testTamperedPayloadRejected() throws SigningBackendException {
    final String signature = signingIdentity.sign(PAYLOAD);
    final byte[] tampered = "{\"identity_fingerprint\":\"ABC\",\"v\":2}".getBytes(StandardCharsets.UTF_8);

    assertFalse(verifier.verify(tampered, signature, signingIdentity.exportPublicKey()).valid());
  }

  @Test
  void testWrongKeyRejected() throws SigningBackendException {
    final String signature = signingIdentity.sign(PAYLOAD);

    final VerificationResult result = verifier.verify(PAYLOAD, signature, otherSigningIdentity.exportPublicKey());

    assertFalse(result.valid());
    assertTrue(result.failureReason().isPresent());
  }

  @Test
  void testMalformedInputsRejected() throws SigningBackendException {
    final String signature = signingIdentity.sign(PAYLOAD);
    final String publicKey = signingIdentity.exportPublicKey();

    assertFalse(verifier.verify(PAYLOAD, "garbage", publicKey).valid());
    assertFalse(verifier.verify(PAYLOAD, signature, "garbage").valid());
    assertFalse(verifier.verify(PAYLOAD, null, publicKey).valid());
    assertFalse(verifier.verify(PAYLOAD, publicKey, publicKey).valid());
  }

  @Test
  void testWrongPassphrase() {
    assertThrows(PGPException.class,
        () -> OpenPgpSigningIdentity.fromArmoredSecretKey(armoredSecretKey, "wrong".toCharArray()));
  }
}
