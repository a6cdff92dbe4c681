/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.proposal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.signal.registrationledger.LedgerConfiguration;
import org.signal.registrationledger.codec.CanonicalCodec;
import org.signal.registrationledger.gate.AccessGate;
import org.signal.registrationledger.gate.PermissionDeniedException;
import org.signal.registrationledger.storage.file.FileProposalRepository;
import org.signal.registrationledger.util.Sha256MessageDigest;
import org.signal.registrationledger.util.TestClock;
import org.signal.registrationledger.verification.IdentityVerifier;

class ProposalServiceTest {

  private static final Instant NOW = Instant.ofEpochSecond(1_700_000_000);

  @TempDir
  Path tempDirectory;

  private CanonicalCodec canonicalCodec;
  private TestClock clock;
  private ProposalService proposalService;

  @BeforeEach
  void setUp() {
    final IdentityVerifier identityVerifier = mock(IdentityVerifier.class);
    when(identityVerifier.verify("FP1")).thenReturn(true);
    when(identityVerifier.verify("FP2")).thenReturn(false);

    canonicalCodec = new CanonicalCodec();
    clock = TestClock.pinned(NOW);

    proposalService = new ProposalService(new AccessGate(identityVerifier, new SimpleMeterRegistry()),
        new FileProposalRepository(tempDirectory.toString()),
        canonicalCodec,
        new LedgerConfiguration(null, null, Duration.ofSeconds(10), 16),
        new SimpleMeterRegistry(),
        clock);
  }

  @Test
  void testSubmit() throws PermissionDeniedException, IOException {
    final SubmittedProposal submitted =
        proposalService.submit("Raise quorum", "Raise the quorum to 60%", "More legitimacy", "FP1");

    final Proposal expectedProposal = new Proposal("Raise quorum", "Raise the quorum to 60%", "More legitimacy", "FP1");

    assertEquals(expectedProposal, submitted.proposal());
    assertEquals(NOW.getEpochSecond(), submitted.timestamp());
    assertEquals(Sha256MessageDigest.hexDigest(canonicalCodec.encode(expectedProposal)).substring(0, 16),
        submitted.proposalId());
    assertTrue(submitted.proposalId().matches("[0-9a-f]{16}"));

    assertEquals(submitted, proposalService.find(submitted.proposalId()).orElseThrow());
    assertTrue(Files.exists(tempDirectory.resolve("proposal_" + submitted.proposalId() + ".json")));
  }

  @Test
  void testDuplicateSubmissionIsIdempotent() throws PermissionDeniedException, IOException {
    final SubmittedProposal first = proposalService.submit("Raise quorum", "Raise the quorum", null, "FP1");

    clock.pin(NOW.plusSeconds(60));
    final SubmittedProposal second = proposalService.submit("Raise quorum", "Raise the quorum", null, "FP1");

    assertEquals(first, second);
    assertEquals(NOW.getEpochSecond(), second.timestamp());
  }

  @Test
  void testDifferentContentDifferentId() throws PermissionDeniedException, IOException {
    final SubmittedProposal first = proposalService.submit("Raise quorum", "Raise the quorum", null, "FP1");
    final SubmittedProposal second = proposalService.submit("Lower quorum", "Lower the quorum", null, "FP1");

    assertNotEquals(first.proposalId(), second.proposalId());
  }

  @Test
  void testUnverifiedSubmitterDenied() throws IOException {
    assertThrows(PermissionDeniedException.class,
        () -> proposalService.submit("Raise quorum", "Raise the quorum", null, "FP2"));

    try (final Stream<Path> files = Files.list(tempDirectory)) {
      assertEquals(0, files.count());
    }
  }

  @Test
  void testFindMissing() throws IOException {
    assertTrue(proposalService.find("0123456789abcdef").isEmpty());
  }
}
