/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.health;

import io.micronaut.core.async.publisher.Publishers;
import io.micronaut.health.HealthStatus;
import io.micronaut.management.health.indicator.HealthIndicator;
import io.micronaut.management.health.indicator.HealthResult;
import io.micronaut.management.health.indicator.annotation.Readiness;
import jakarta.inject.Singleton;
import org.reactivestreams.Publisher;
import org.signal.registrationledger.Ledger;
import org.signal.registrationledger.LedgerAuditor;

@Singleton
@Readiness
public class ReadinessIndicator implements HealthIndicator {

  private final Ledger ledger;
  private final LedgerAuditor ledgerAuditor;

  ReadinessIndicator(final Ledger ledger, final LedgerAuditor ledgerAuditor) {
    this.ledger = ledger;
    this.ledgerAuditor = ledgerAuditor;
  }

  @Override
  public Publisher<HealthResult> getResult() {
    return Publishers.just(HealthResult.builder(
            "LedgerReady",
            ledger.isReady() && ledgerAuditor.isChainIntact() ? HealthStatus.UP : HealthStatus.DOWN)
        .build());
  }
}
