/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.signal.registrationledger.metrics.MetricsUtil;

class LedgerAuditorTest {

  private Ledger ledger;
  private SimpleMeterRegistry meterRegistry;
  private LedgerAuditor ledgerAuditor;

  @BeforeEach
  void setUp() {
    ledger = mock(Ledger.class);
    meterRegistry = new SimpleMeterRegistry();
    ledgerAuditor = new LedgerAuditor(ledger, meterRegistry);
  }

  @Test
  void testIntactChain() throws IOException, ChainIntegrityException {
    when(ledger.verifyChain()).thenReturn(3L);

    ledgerAuditor.auditLedger();

    assertTrue(ledgerAuditor.isChainIntact());
    assertEquals(3, meterRegistry.get(MetricsUtil.name(LedgerAuditor.class, "entriesVerified")).gauge().value());
  }

  @Test
  void testBrokenChainStaysBroken() throws IOException, ChainIntegrityException {
    when(ledger.verifyChain())
        .thenThrow(new ChainIntegrityException(1, "content does not match chain hash", "expected", "actual"))
        .thenReturn(3L);

    ledgerAuditor.auditLedger();
    assertFalse(ledgerAuditor.isChainIntact());

    ledgerAuditor.auditLedger();
    assertFalse(ledgerAuditor.isChainIntact());
    assertEquals(1, meterRegistry.get(MetricsUtil.name(LedgerAuditor.class, "chainBroken")).counter().count());
  }

  @Test
  void testUnreadableLedger() throws IOException, ChainIntegrityException {
    when(ledger.verifyChain()).thenThrow(new IOException("unreadable"));

    ledgerAuditor.auditLedger();

    assertTrue(ledgerAuditor.isChainIntact());
    assertEquals(1, meterRegistry.get(MetricsUtil.name(LedgerAuditor.class, "auditFailed")).counter().count());
  }
}
