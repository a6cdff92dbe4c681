/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.security.InvalidKeyException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.bouncycastle.openpgp.PGPException;
import org.signal.registrationledger.identity.Ed25519SigningIdentity;
import org.signal.registrationledger.identity.OpenPgpSignatureVerifier;
import org.signal.registrationledger.identity.OpenPgpSigningIdentity;
import org.signal.registrationledger.identity.SignatureVerifier;
import org.signal.registrationledger.identity.SigningIdentity;
import org.signal.registrationledger.identity.TimeLimitedSignatureVerifier;
import org.signal.registrationledger.identity.TimeLimitedSigningIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Factory
class SigningIdentityFactory {

  private static final Logger logger = LoggerFactory.getLogger(SigningIdentityFactory.class);

  @Singleton
  @Named("signing")
  @Bean(preDestroy = "shutdown")
  ExecutorService signingExecutor() {
    return Executors.newCachedThreadPool(new ThreadFactoryBuilder()
        .setDaemon(true)
        .setNameFormat("signing-%d")
        .build());
  }

  @Singleton
  @Named("chain")
  SigningIdentity chainSigningIdentity(final LedgerConfiguration configuration,
      @Named("signing") final ExecutorService signingExecutor) throws InvalidKeyException {

    final SigningIdentity signingIdentity;

    if (configuration.chainPrivateKey() != null && configuration.chainPublicKey() != null) {
      signingIdentity = new Ed25519SigningIdentity(configuration.chainPrivateKey(), configuration.chainPublicKey());
      logger.info("Using configured chain signing key {}", signingIdentity.fingerprint());
    } else {
      if (configuration.chainPrivateKey() != null || configuration.chainPublicKey() != null) {
        logger.warn("Only one half of the chain signing key pair is configured; ignoring it");
      }

      signingIdentity = Ed25519SigningIdentity.generate();
      logger.info("No chain signing key configured; generated ephemeral key {}", signingIdentity.fingerprint());
    }

    return new TimeLimitedSigningIdentity(signingIdentity, configuration.signingTimeout(), signingExecutor);
  }

  @Singleton
  @Named("external")
  @Requires(property = "identity.openpgp.secret-key")
  SigningIdentity externalSigningIdentity(@Value("${identity.openpgp.secret-key}") final String armoredSecretKey,
      @Value("${identity.openpgp.passphrase:}") final String passphrase,
      final LedgerConfiguration configuration,
      @Named("signing") final ExecutorService signingExecutor) throws IOException, PGPException {

    final OpenPgpSigningIdentity signingIdentity =
        OpenPgpSigningIdentity.fromArmoredSecretKey(armoredSecretKey, passphrase.toCharArray());

    logger.info("Loaded OpenPGP identity {}", signingIdentity.fingerprint());

    return new TimeLimitedSigningIdentity(signingIdentity, configuration.signingTimeout(), signingExecutor);
  }

  @Singleton
  @Named("identity")
  SignatureVerifier identitySignatureVerifier(final LedgerConfiguration configuration,
      @Named("signing") final ExecutorService signingExecutor) {

    return new TimeLimitedSignatureVerifier(new OpenPgpSignatureVerifier(), configuration.signingTimeout(),
        signingExecutor);
  }
}
