/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

/**
 * A key holder that can sign on behalf of one identity. Signatures and public keys are opaque text to callers; only
 * the identity's own {@link SignatureVerifier} interprets them.
 */
public interface SigningIdentity extends SignatureVerifier {

  /**
   * @param payload the bytes to sign
   * @return the encoded signature
   * @throws SigningBackendException if no signature could be produced; never returns an invalid signature instead
   */
  String sign(byte[] payload) throws SigningBackendException;

  /**
   * @return the encoded public key that verifies this identity's signatures
   * @throws SigningBackendException if the backend could not export the key
   */
  String exportPublicKey() throws SigningBackendException;

  /**
   * @return the stable identifier of this identity's public key
   */
  String fingerprint();
}
