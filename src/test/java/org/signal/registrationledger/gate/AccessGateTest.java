/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.gate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.signal.registrationledger.verification.IdentityVerifier;

class AccessGateTest {

  private IdentityVerifier identityVerifier;
  private AccessGate accessGate;
  private AtomicInteger invocations;

  @BeforeEach
  void setUp() {
    identityVerifier = mock(IdentityVerifier.class);
    when(identityVerifier.verify("FP1")).thenReturn(true);
    when(identityVerifier.verify("FP2")).thenReturn(false);

    accessGate = new AccessGate(identityVerifier, new SimpleMeterRegistry());
    invocations = new AtomicInteger();
  }

  @Test
  void testVerifiedOperationRunsOnce() throws PermissionDeniedException {
    final ProtectedOperation<String, RuntimeException> guarded = accessGate.guard("FP1", () -> {
      invocations.incrementAndGet();
      return "result";
    });

    assertEquals("result", guarded.call());
    assertEquals(1, invocations.get());
  }

  @Test
  void testUnverifiedOperationNeverRuns() {
    final ProtectedOperation<String, RuntimeException> guarded = accessGate.guard("FP2", () -> {
      invocations.incrementAndGet();
      return "result";
    });

    final PermissionDeniedException e = assertThrows(PermissionDeniedException.class, guarded::call);
    assertEquals("FP2", e.getFingerprint());
    assertEquals(0, invocations.get());
  }

  @Test
  void testIdentityCheckedOnEveryCall() throws PermissionDeniedException {
    final ProtectedOperation<Integer, RuntimeException> guarded = accessGate.guard("FP1",
        () -> invocations.incrementAndGet());

    guarded.call();
    guarded.call();

    verify(identityVerifier, times(2)).verify("FP1");
  }

  @Test
  void testFunction() throws PermissionDeniedException {
    final ProtectedFunction<Integer, Integer, RuntimeException> doubler = accessGate.guard("FP1", (Integer x) -> {
      invocations.incrementAndGet();
      return x * 2;
    });

    assertEquals(42, doubler.apply(21));
    assertEquals(1, invocations.get());

    final ProtectedFunction<Integer, Integer, RuntimeException> denied = accessGate.guard("FP2", (Integer x) -> {
      invocations.incrementAndGet();
      return x * 2;
    });

    assertThrows(PermissionDeniedException.class, () -> denied.apply(21));
    assertEquals(1, invocations.get());
  }

  @Test
  void testBiFunction() throws PermissionDeniedException {
    final ProtectedBiFunction<String, Integer, String, RuntimeException> repeater =
        accessGate.guard("FP1", (String s, Integer n) -> {
          invocations.incrementAndGet();
          return s.repeat(n);
        });

    assertEquals("ababab", repeater.apply("ab", 3));
    assertEquals(1, invocations.get());

    final ProtectedBiFunction<String, Integer, String, RuntimeException> denied =
        accessGate.guard("FP2", (String s, Integer n) -> {
          invocations.incrementAndGet();
          return s.repeat(n);
        });

    final PermissionDeniedException e = assertThrows(PermissionDeniedException.class, () -> denied.apply("ab", 3));
    assertEquals("FP2", e.getFingerprint());
    assertEquals(1, invocations.get());
  }

  @Test
  void testOperationExceptionPropagates() {
    final ProtectedOperation<String, IOException> guarded = accessGate.guard("FP1", () -> {
      throw new IOException("operation failed");
    });

    assertThrows(IOException.class, guarded::call);
  }
}
