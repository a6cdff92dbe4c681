/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicLong;
import org.signal.registrationledger.metrics.MetricsUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically re-verifies the whole ledger. Once a break has been found the ledger is reported as not intact until
 * the process restarts, since the ledger never repairs itself.
 */
@Singleton
public class LedgerAuditor {

  private static final Logger logger = LoggerFactory.getLogger(LedgerAuditor.class);

  private final Ledger ledger;

  private final Counter chainBrokenCounter;
  private final Counter auditFailedCounter;
  private final Timer auditTimer;
  private final AtomicLong entriesVerified;

  private volatile boolean chainIntact = true;

  public LedgerAuditor(final Ledger ledger, final MeterRegistry meterRegistry) {
    this.ledger = ledger;

    this.chainBrokenCounter = meterRegistry.counter(MetricsUtil.name(LedgerAuditor.class, "chainBroken"));
    this.auditFailedCounter = meterRegistry.counter(MetricsUtil.name(LedgerAuditor.class, "auditFailed"));
    this.auditTimer = meterRegistry.timer(MetricsUtil.name(LedgerAuditor.class, "auditTimer"));
    this.entriesVerified = meterRegistry.gauge(MetricsUtil.name(LedgerAuditor.class, "entriesVerified"),
        new AtomicLong());
  }

  public boolean isChainIntact() {
    return chainIntact;
  }

  @Scheduled(fixedDelay = "${ledger.audit-interval:5m}")
  void auditLedger() {
    final Timer.Sample sample = Timer.start();

    try {
      entriesVerified.set(ledger.verifyChain());
    } catch (final ChainIntegrityException e) {
      chainIntact = false;
      chainBrokenCounter.increment();
      logger.error("Ledger chain broken at entry {}: expected hash {}, found {}",
          e.getIndex(), e.getExpectedHash(), e.getActualHash(), e);
    } catch (final IOException e) {
      auditFailedCounter.increment();
      logger.warn("Could not read ledger for audit", e);
    } finally {
      sample.stop(auditTimer);
    }
  }
}
