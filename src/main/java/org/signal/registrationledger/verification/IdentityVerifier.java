/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.verification;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.signal.registrationledger.RegistrationEntry;
import org.signal.registrationledger.codec.CanonicalCodec;
import org.signal.registrationledger.codec.CanonicalizationException;
import org.signal.registrationledger.identity.SignatureVerifier;
import org.signal.registrationledger.identity.VerificationResult;
import org.signal.registrationledger.metrics.MetricsUtil;
import org.signal.registrationledger.storage.RegistrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a fingerprint belongs to a registered member, meaning that a registration stored for that
 * fingerprint carries a valid identity signature made by the same fingerprint.
 * <p>
 * Successful verifications are cached until explicitly invalidated; failures are never cached, so a member who
 * registers after a failed check is recognized on the next one.
 */
@Singleton
public class IdentityVerifier {

  private static final Logger logger = LoggerFactory.getLogger(IdentityVerifier.class);

  private final RegistrationRepository registrationRepository;
  private final CanonicalCodec canonicalCodec;
  private final SignatureVerifier identitySignatureVerifier;

  private final Map<String, RegistrationEntry> verifiedIdentities = new ConcurrentHashMap<>();

  private final Counter cacheHitCounter;
  private final Counter verifiedCounter;
  private final Counter rejectedCounter;

  public IdentityVerifier(final RegistrationRepository registrationRepository,
      final CanonicalCodec canonicalCodec,
      @Named("identity") final SignatureVerifier identitySignatureVerifier,
      final MeterRegistry meterRegistry) {

    this.registrationRepository = registrationRepository;
    this.canonicalCodec = canonicalCodec;
    this.identitySignatureVerifier = identitySignatureVerifier;

    this.cacheHitCounter = meterRegistry.counter(MetricsUtil.name(IdentityVerifier.class, "cacheHit"));
    this.verifiedCounter = meterRegistry.counter(MetricsUtil.name(IdentityVerifier.class, "verified"));
    this.rejectedCounter = meterRegistry.counter(MetricsUtil.name(IdentityVerifier.class, "rejected"));
  }

  /**
   * @return {@code true} if {@code fingerprint} has a stored registration with a valid identity signature from that
   * same fingerprint
   */
  public boolean verify(final String fingerprint) {
    if (fingerprint == null || fingerprint.isBlank()) {
      return false;
    }

    final String normalizedFingerprint = normalize(fingerprint);

    if (verifiedIdentities.containsKey(normalizedFingerprint)) {
      cacheHitCounter.increment();
      return true;
    }

    final Optional<RegistrationEntry> maybeRegistration;
    try {
      maybeRegistration = registrationRepository.findByFingerprint(normalizedFingerprint);
    } catch (final IOException e) {
      logger.warn("Could not load registration for {}", normalizedFingerprint, e);
      rejectedCounter.increment();
      return false;
    }

    if (maybeRegistration.isEmpty()) {
      logger.debug("No registration for {}", normalizedFingerprint);
      rejectedCounter.increment();
      return false;
    }

    final VerificationResult result = verifyEntry(maybeRegistration.get(), normalizedFingerprint);

    if (!result.valid()) {
      logger.info("Rejected registration for {}: {}", normalizedFingerprint, result.describe());
      rejectedCounter.increment();
      return false;
    }

    verifiedIdentities.put(normalizedFingerprint, maybeRegistration.get());
    verifiedCounter.increment();
    return true;
  }

  /**
   * Checks that {@code entry} carries an identity signature that binds it to {@code claimedFingerprint}.
   */
  public VerificationResult verifyEntry(final RegistrationEntry entry, final String claimedFingerprint) {
    if (!entry.hasIdentitySignature() || entry.identityPublicKey() == null) {
      return VerificationResult.failure("Entry carries no identity signature");
    }

    if (!entry.identityFingerprint().equalsIgnoreCase(claimedFingerprint)) {
      return VerificationResult.failure("Entry is bound to " + entry.identityFingerprint() + ", not "
          + claimedFingerprint);
    }

    final byte[] signedBytes;
    try {
      signedBytes = canonicalCodec.encode(entry, RegistrationEntry.IDENTITY_SIGNATURE_EXCLUSIONS);
    } catch (final CanonicalizationException e) {
      return VerificationResult.failure("Entry could not be canonicalized: " + e.getMessage());
    }

    final VerificationResult result =
        identitySignatureVerifier.verify(signedBytes, entry.identitySignature(), entry.identityPublicKey());

    if (!result.valid()) {
      return result;
    }

    if (result.signerFingerprint().map(signer -> !signer.equalsIgnoreCase(claimedFingerprint)).orElse(true)) {
      return VerificationResult.failure("Signed by " + result.signerFingerprint().orElse("an unknown key")
          + " rather than " + claimedFingerprint);
    }

    return result;
  }

  public void invalidate(final String fingerprint) {
    if (fingerprint != null) {
      verifiedIdentities.remove(normalize(fingerprint));
    }
  }

  public void invalidateAll() {
    verifiedIdentities.clear();
  }

  public boolean isCached(final String fingerprint) {
    return verifiedIdentities.containsKey(normalize(fingerprint));
  }

  private static String normalize(final String fingerprint) {
    return fingerprint.trim().toUpperCase(Locale.ROOT);
  }
}
