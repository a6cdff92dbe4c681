/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.proposal;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.signal.registrationledger.LedgerConfiguration;
import org.signal.registrationledger.codec.CanonicalCodec;
import org.signal.registrationledger.gate.AccessGate;
import org.signal.registrationledger.gate.PermissionDeniedException;
import org.signal.registrationledger.metrics.MetricsUtil;
import org.signal.registrationledger.storage.ProposalRepository;
import org.signal.registrationledger.util.Sha256MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts governance proposals from verified members. Proposals are stored write-once under an ID derived from their
 * content.
 */
@Singleton
public class ProposalService {

  private static final Logger logger = LoggerFactory.getLogger(ProposalService.class);

  private final AccessGate accessGate;
  private final ProposalRepository proposalRepository;
  private final CanonicalCodec canonicalCodec;
  private final Clock clock;
  private final int proposalIdLength;

  private final Counter submittedCounter;
  private final Counter duplicateCounter;

  public ProposalService(final AccessGate accessGate,
      final ProposalRepository proposalRepository,
      final CanonicalCodec canonicalCodec,
      final LedgerConfiguration configuration,
      final MeterRegistry meterRegistry,
      final Clock clock) {

    this.accessGate = accessGate;
    this.proposalRepository = proposalRepository;
    this.canonicalCodec = canonicalCodec;
    this.clock = clock;
    this.proposalIdLength = configuration.proposalIdLength();

    this.submittedCounter = meterRegistry.counter(MetricsUtil.name(ProposalService.class, "submitted"));
    this.duplicateCounter = meterRegistry.counter(MetricsUtil.name(ProposalService.class, "duplicate"));
  }

  /**
   * Submits a proposal on behalf of {@code fingerprint}, which must belong to a verified member. Submitting a
   * proposal identical to one already stored returns the stored proposal unchanged.
   *
   * @param rationale may be {@code null}
   * @throws PermissionDeniedException if {@code fingerprint} is not a verified member; nothing is stored
   */
  public SubmittedProposal submit(final String title, final String description, final String rationale,
      final String fingerprint) throws PermissionDeniedException, IOException {

    Objects.requireNonNull(title, "Title must not be null");
    Objects.requireNonNull(description, "Description must not be null");

    return accessGate.guard(fingerprint, () -> store(new Proposal(title, description, rationale, fingerprint)))
        .call();
  }

  public Optional<SubmittedProposal> find(final String proposalId) throws IOException {
    return proposalRepository.findById(proposalId);
  }

  String proposalId(final Proposal proposal) {
    return Sha256MessageDigest.hexDigest(canonicalCodec.encode(proposal)).substring(0, proposalIdLength);
  }

  private SubmittedProposal store(final Proposal proposal) throws IOException {
    final SubmittedProposal submittedProposal =
        new SubmittedProposal(proposalId(proposal), clock.instant().getEpochSecond(), proposal);

    if (proposalRepository.storeIfAbsent(submittedProposal)) {
      submittedCounter.increment();
      logger.info("Stored proposal {} from {}", submittedProposal.proposalId(), proposal.submittedBy());
      return submittedProposal;
    }

    duplicateCounter.increment();
    logger.info("Proposal {} already exists", submittedProposal.proposalId());

    return proposalRepository.findById(submittedProposal.proposalId()).orElse(submittedProposal);
  }
}
