/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

import java.io.IOException;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPSignature;
import org.bouncycastle.openpgp.operator.jcajce.JcaPGPContentVerifierBuilderProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies ASCII-armored detached OpenPGP signatures against an ASCII-armored public key. A successful result names
 * the fingerprint of the key ring's primary key, even if the signature was made by one of its subkeys.
 */
public class OpenPgpSignatureVerifier implements SignatureVerifier {

  private static final Logger logger = LoggerFactory.getLogger(OpenPgpSignatureVerifier.class);

  @Override
  public VerificationResult verify(final byte[] payload, final String signature, final String publicKey) {
    if (payload == null || signature == null || publicKey == null) {
      return VerificationResult.failure("Missing payload, signature or public key");
    }

    try {
      final PGPPublicKeyRing publicKeyRing = OpenPgpKeys.readPublicKeyRing(publicKey);
      final PGPSignature pgpSignature = OpenPgpKeys.readSignature(signature);
      final PGPPublicKey signingKey = publicKeyRing.getPublicKey(pgpSignature.getKeyID());

      if (signingKey == null) {
        return VerificationResult.failure(
            String.format("Signature was issued by key %016X, which is not part of the given key",
                pgpSignature.getKeyID()));
      }

      pgpSignature.init(new JcaPGPContentVerifierBuilderProvider().setProvider(OpenPgpKeys.PROVIDER), signingKey);
      pgpSignature.update(payload);

      if (!pgpSignature.verify()) {
        return VerificationResult.failure("Signature did not match");
      }

      return VerificationResult.success(OpenPgpKeys.fingerprint(publicKeyRing.getPublicKey()));
    } catch (final IOException | PGPException e) {
      return VerificationResult.failure("Could not verify OpenPGP signature: " + e.getMessage());
    } catch (final RuntimeException e) {
      // Bouncy Castle signals some kinds of malformed input with unchecked exceptions
      logger.debug("Unexpected error verifying OpenPGP signature", e);
      return VerificationResult.failure("Malformed OpenPGP data: " + e);
    }
  }
}
