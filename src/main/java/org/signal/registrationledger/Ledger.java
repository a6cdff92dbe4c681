/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.inject.Named;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.signal.registrationledger.codec.CanonicalCodec;
import org.signal.registrationledger.identity.SigningBackendException;
import org.signal.registrationledger.identity.SigningIdentity;
import org.signal.registrationledger.identity.VerificationResult;
import org.signal.registrationledger.metrics.MetricsUtil;
import org.signal.registrationledger.storage.LedgerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An append-only sequence of registration entries. Each entry is signed by the ledger's chain identity and carries
 * a chain hash that commits to its content and to the chain hash of the entry before it, so that changing or
 * removing any stored entry is detectable by {@link #verifyChain()}.
 * <p>
 * Appends are serialized by a single writer lock; each append persists the complete sequence before the new entry
 * becomes the tip. Entries may later have an external identity signature attached, which sits outside the chain
 * hash and therefore never disturbs the chain.
 */
@Singleton
public class Ledger {

  private static final Logger logger = LoggerFactory.getLogger(Ledger.class);

  private final CanonicalCodec canonicalCodec;
  private final LedgerRepository ledgerRepository;
  private final SigningIdentity chainIdentity;
  private final Clock clock;
  private final ReentrantLock writeLock;

  private final Counter appendCounter;
  private final Counter appendFailedCounter;
  private final Counter identitySignatureCounter;
  private final Timer appendTimer;
  private final Timer verifyChainTimer;

  private volatile String tipHash;
  private volatile boolean tipLoaded;
  private volatile boolean lastWriteSucceeded = true;

  public Ledger(final CanonicalCodec canonicalCodec,
      final LedgerRepository ledgerRepository,
      @Named("chain") final SigningIdentity chainIdentity,
      final MeterRegistry meterRegistry,
      final Clock clock) {

    this.canonicalCodec = canonicalCodec;
    this.ledgerRepository = ledgerRepository;
    this.chainIdentity = chainIdentity;
    this.clock = clock;
    this.writeLock = new ReentrantLock();

    this.appendCounter = meterRegistry.counter(MetricsUtil.name(Ledger.class, "append"));
    this.appendFailedCounter = meterRegistry.counter(MetricsUtil.name(Ledger.class, "appendFailed"));
    this.identitySignatureCounter = meterRegistry.counter(MetricsUtil.name(Ledger.class, "identitySignature"));
    this.appendTimer = meterRegistry.timer(MetricsUtil.name(Ledger.class, "appendTimer"));
    this.verifyChainTimer = meterRegistry.timer(MetricsUtil.name(Ledger.class, "verifyChainTimer"));
  }

  @PostConstruct
  @VisibleForTesting
  void loadTip() throws IOException {
    writeLock.lock();

    try {
      final List<RegistrationEntry> entries = ledgerRepository.getEntries();
      tipHash = entries.isEmpty() ? null : entries.get(entries.size() - 1).chainHash();
      tipLoaded = true;

      logger.info("Loaded ledger with {} entries", entries.size());
    } finally {
      writeLock.unlock();
    }
  }

  public boolean isHealthy() {
    return lastWriteSucceeded;
  }

  public boolean isReady() {
    return tipLoaded;
  }

  /**
   * @return the chain hash of the most recently appended entry, or empty if the ledger has no entries
   */
  public Optional<String> getTipHash() {
    return Optional.ofNullable(tipHash);
  }

  /**
   * Chain-signs {@code payload}, links it to the current tip and persists it as the new last entry.
   *
   * @param payload   arbitrary content; converted to a JSON tree, which is what gets stored and signed
   * @param proofName a human-readable label for the entry
   * @return the persisted entry
   * @throws SigningBackendException if the chain identity could not sign; nothing is persisted
   * @throws IOException             if the entry could not be persisted; the tip is unchanged
   * @throws org.signal.registrationledger.codec.CanonicalizationException if {@code payload} can't be represented as
   *                                 canonical JSON
   */
  public RegistrationEntry append(final Object payload, final String proofName)
      throws IOException, SigningBackendException {

    Objects.requireNonNull(payload, "Payload must not be null");
    Objects.requireNonNull(proofName, "Proof name must not be null");

    // A fresh tree in stored form; it never aliases the caller's payload
    final JsonNode payloadTree = canonicalCodec.toTree(payload);
    final Timer.Sample sample = Timer.start();

    writeLock.lock();

    try {
      final List<RegistrationEntry> entries = ledgerRepository.getEntries();
      final String previousChainHash = entries.isEmpty()
          ? ChainLink.GENESIS_SENTINEL
          : entries.get(entries.size() - 1).chainHash();

      final RegistrationEntry draft = RegistrationEntry.draft(proofName,
          payloadTree,
          clock.instant().getEpochSecond(),
          previousChainHash,
          chainIdentity.exportPublicKey());

      final RegistrationEntry chainSigned = draft.withChainSignature(
          chainIdentity.sign(canonicalCodec.encode(draft, RegistrationEntry.CHAIN_SIGNATURE_EXCLUSIONS)));

      final RegistrationEntry chained = chainSigned.withChainHash(ChainLink.compute(previousChainHash,
          canonicalCodec.encode(chainSigned, RegistrationEntry.CHAIN_HASH_EXCLUSIONS)));

      final List<RegistrationEntry> updatedEntries = new ArrayList<>(entries.size() + 1);
      updatedEntries.addAll(entries);
      updatedEntries.add(chained);

      store(updatedEntries);

      tipHash = chained.chainHash();
      appendCounter.increment();

      logger.debug("Appended entry {} ({}) with chain hash {}", entries.size(), proofName, chained.chainHash());

      return chained;
    } catch (final IOException | SigningBackendException e) {
      appendFailedCounter.increment();
      throw e;
    } finally {
      writeLock.unlock();
      sample.stop(appendTimer);
    }
  }

  /**
   * Binds an entry to an external identity by adding the identity's fingerprint, detached signature and public key,
   * and replaces the stored entry with the result. The chain hash is unaffected.
   *
   * @param entry            an entry previously returned by {@link #append(Object, String)}; matched by chain hash
   * @param externalIdentity the identity that signs the entry
   * @return the stored, identity-signed entry
   * @throws IllegalArgumentException if no stored entry has the same chain hash as {@code entry}
   */
  public RegistrationEntry attachIdentitySignature(final RegistrationEntry entry,
      final SigningIdentity externalIdentity) throws IOException, SigningBackendException {

    writeLock.lock();

    try {
      if (entry.chainHash() == null) {
        throw new IllegalArgumentException("Entry has not been chained");
      }

      final List<RegistrationEntry> entries = new ArrayList<>(ledgerRepository.getEntries());

      int index = -1;
      for (int i = 0; i < entries.size(); i++) {
        if (Objects.equals(entries.get(i).chainHash(), entry.chainHash())) {
          index = i;
          break;
        }
      }

      if (index < 0) {
        throw new IllegalArgumentException("Entry " + entry.chainHash() + " is not in the ledger");
      }

      // Sign the stored copy, not the caller's
      final RegistrationEntry withFingerprint =
          entries.get(index).withIdentityFingerprint(externalIdentity.fingerprint());

      final String identitySignature = externalIdentity.sign(
          canonicalCodec.encode(withFingerprint, RegistrationEntry.IDENTITY_SIGNATURE_EXCLUSIONS));

      final RegistrationEntry identitySigned =
          withFingerprint.withIdentitySignature(identitySignature, externalIdentity.exportPublicKey());

      entries.set(index, identitySigned);
      store(entries);

      identitySignatureCounter.increment();
      logger.debug("Attached identity signature from {} to entry {}", externalIdentity.fingerprint(), index);

      return identitySigned;
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Walks every stored entry from the first, checking that each links to its predecessor, that its chain hash
   * matches its content and that its chain signature is valid. Never repairs anything.
   *
   * @return the number of entries verified
   * @throws ChainIntegrityException at the first entry that fails a check
   */
  public long verifyChain() throws IOException, ChainIntegrityException {
    final Timer.Sample sample = Timer.start();

    try {
      final List<RegistrationEntry> entries = ledgerRepository.getEntries();
      String previousChainHash = ChainLink.GENESIS_SENTINEL;

      for (int i = 0; i < entries.size(); i++) {
        final RegistrationEntry entry = entries.get(i);

        if (!previousChainHash.equals(entry.previousChainHash())) {
          throw new ChainIntegrityException(i, "previous chain hash does not match preceding entry",
              previousChainHash, entry.previousChainHash());
        }

        final String computedChainHash = ChainLink.compute(entry.previousChainHash(),
            canonicalCodec.encode(entry, RegistrationEntry.CHAIN_HASH_EXCLUSIONS));

        if (!computedChainHash.equals(entry.chainHash())) {
          throw new ChainIntegrityException(i, "content does not match chain hash", computedChainHash,
              entry.chainHash());
        }

        final VerificationResult chainSignatureResult = chainIdentity.verify(
            canonicalCodec.encode(entry, RegistrationEntry.CHAIN_SIGNATURE_EXCLUSIONS),
            entry.chainSignature(),
            entry.chainPublicKey());

        if (!chainSignatureResult.valid()) {
          throw new ChainIntegrityException(i, "chain signature from key " + entry.chainPublicKey()
              + " rejected: " + chainSignatureResult.describe());
        }

        previousChainHash = entry.chainHash();
      }

      return entries.size();
    } finally {
      sample.stop(verifyChainTimer);
    }
  }

  /**
   * @return every persisted entry in append order
   */
  public List<RegistrationEntry> load() throws IOException {
    return ledgerRepository.getEntries();
  }

  private void store(final List<RegistrationEntry> entries) throws IOException {
    try {
      ledgerRepository.storeEntries(entries);
      lastWriteSucceeded = true;
    } catch (final IOException e) {
      lastWriteSucceeded = false;
      throw e;
    }
  }
}
