/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micronaut.core.annotation.Nullable;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.Comparator;
import java.util.List;
import org.signal.registrationledger.identity.SigningBackendException;
import org.signal.registrationledger.identity.SigningIdentity;
import org.signal.registrationledger.identity.VerificationResult;
import org.signal.registrationledger.metrics.MetricsUtil;
import org.signal.registrationledger.storage.RegistrationRepository;
import org.signal.registrationledger.verification.IdentityVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers members: records their proofs in the ledger, binds those entries to their external identities and keeps
 * a per-identity copy of each member's registration for later identity checks.
 */
@Singleton
public class Registrar {

  private static final Logger logger = LoggerFactory.getLogger(Registrar.class);

  private final Ledger ledger;
  private final RegistrationRepository registrationRepository;
  private final IdentityVerifier identityVerifier;
  @Nullable
  private final SigningIdentity defaultExternalIdentity;

  private final Counter registeredCounter;
  private final Counter memberRejectedCounter;

  public Registrar(final Ledger ledger,
      final RegistrationRepository registrationRepository,
      final IdentityVerifier identityVerifier,
      @Nullable @Named("external") final SigningIdentity defaultExternalIdentity,
      final MeterRegistry meterRegistry) {

    this.ledger = ledger;
    this.registrationRepository = registrationRepository;
    this.identityVerifier = identityVerifier;
    this.defaultExternalIdentity = defaultExternalIdentity;

    this.registeredCounter = meterRegistry.counter(MetricsUtil.name(Registrar.class, "registered"));
    this.memberRejectedCounter = meterRegistry.counter(MetricsUtil.name(Registrar.class, "memberRejected"));
  }

  /**
   * Appends {@code payload} to the ledger, signs the new entry with {@code externalIdentity} and stores the result
   * as that identity's registration.
   *
   * @return the identity-signed entry
   */
  public RegistrationEntry register(final Object payload, final String proofName,
      final SigningIdentity externalIdentity) throws IOException, SigningBackendException {

    final RegistrationEntry appended = ledger.append(payload, proofName);
    final RegistrationEntry identitySigned = ledger.attachIdentitySignature(appended, externalIdentity);

    registrationRepository.store(identitySigned);
    identityVerifier.invalidate(identitySigned.identityFingerprint());
    registeredCounter.increment();

    logger.info("Registered {} for {}", proofName, identitySigned.identityFingerprint());

    return identitySigned;
  }

  /**
   * Registers {@code payload} with the OpenPGP identity configured for this service.
   *
   * @throws IllegalStateException if no OpenPGP identity is configured
   */
  public RegistrationEntry register(final Object payload, final String proofName)
      throws IOException, SigningBackendException {

    if (defaultExternalIdentity == null) {
      throw new IllegalStateException("No OpenPGP identity configured");
    }

    return register(payload, proofName, defaultExternalIdentity);
  }

  /**
   * Stores a registration produced elsewhere, provided it carries a valid identity signature from the fingerprint it
   * names.
   *
   * @return {@code true} if the registration was stored
   */
  public boolean registerMember(final RegistrationEntry entry) throws IOException {
    if (entry.identityFingerprint() == null) {
      logger.warn("Refusing registration without an identity fingerprint");
      memberRejectedCounter.increment();
      return false;
    }

    final VerificationResult result = identityVerifier.verifyEntry(entry, entry.identityFingerprint());

    if (!result.valid()) {
      logger.warn("Refusing registration for {}: {}", entry.identityFingerprint(), result.describe());
      memberRejectedCounter.increment();
      return false;
    }

    try {
      registrationRepository.store(entry);
    } catch (final IllegalArgumentException e) {
      logger.warn("Refusing registration for {}: {}", entry.identityFingerprint(), e.getMessage());
      memberRejectedCounter.increment();
      return false;
    }

    identityVerifier.invalidate(entry.identityFingerprint());
    registeredCounter.increment();

    return true;
  }

  /**
   * @return every stored registration, sorted by fingerprint, each marked with whether it currently verifies
   */
  public List<MemberInfo> listMembers() throws IOException {
    return registrationRepository.findAll().stream()
        .filter(entry -> entry.identityFingerprint() != null)
        .map(entry -> new MemberInfo(entry.identityFingerprint(),
            entry.proofName(),
            entry.timestamp(),
            identityVerifier.verifyEntry(entry, entry.identityFingerprint()).valid()))
        .sorted(Comparator.comparing(MemberInfo::fingerprint))
        .toList();
  }
}
