/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.util;

import io.micronaut.context.annotation.Prototype;
import io.micronaut.core.convert.ConversionContext;
import io.micronaut.core.convert.TypeConverter;
import java.security.interfaces.EdECPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.util.Optional;

/**
 * Reads the ledger's configured chain-signing public key from base64 X.509.
 */
@Prototype
class EdECPublicKeyDeserializer implements TypeConverter<String, EdECPublicKey> {

  @Override
  public Optional<EdECPublicKey> convert(final String base64, final Class<EdECPublicKey> targetType,
      final ConversionContext context) {
    try {
      return Optional.of(Ed25519Keys.parsePublicKey(base64));
    } catch (final InvalidKeySpecException | IllegalArgumentException | ClassCastException e) {
      context.reject(base64, e);
      return Optional.empty();
    }
  }
}
