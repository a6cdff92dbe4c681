/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.storage;

import java.io.IOException;
import java.util.List;
import org.signal.registrationledger.RegistrationEntry;

/**
 * Stores the ordered sequence of ledger entries. Readers must only ever observe a complete sequence, either before or
 * after a store, never a partially written one.
 */
public interface LedgerRepository {

  /**
   * @return every stored entry in append order, or an empty list if nothing has been stored yet
   */
  List<RegistrationEntry> getEntries() throws IOException;

  /**
   * Atomically replace the stored sequence of entries.
   *
   * @param entries the complete sequence of entries in append order
   */
  void storeEntries(List<RegistrationEntry> entries) throws IOException;
}
