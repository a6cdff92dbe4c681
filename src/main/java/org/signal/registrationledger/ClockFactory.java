/*
 * Copyright 2025 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger;

import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Supplies the clock used to timestamp ledger entries and proposals.
 */
@Factory
public class ClockFactory {

  @Singleton
  public Clock getClock() {
    return Clock.systemUTC();
  }
}
