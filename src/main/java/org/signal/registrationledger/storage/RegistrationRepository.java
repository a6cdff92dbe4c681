/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.storage;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.signal.registrationledger.RegistrationEntry;

/**
 * Stores identity-signed registration entries keyed by identity fingerprint, independently of the ordered ledger.
 * Fingerprints are matched case-insensitively.
 */
public interface RegistrationRepository {

  /**
   * @return the registration stored for {@code fingerprint}, or empty if there is none or the fingerprint is not a
   * valid key
   */
  Optional<RegistrationEntry> findByFingerprint(String fingerprint) throws IOException;

  /**
   * Stores {@code entry} under its {@link RegistrationEntry#identityFingerprint()}, replacing any previous
   * registration for the same fingerprint.
   *
   * @throws IllegalArgumentException if the entry has no valid identity fingerprint
   */
  void store(RegistrationEntry entry) throws IOException;

  /**
   * @return every stored registration
   */
  List<RegistrationEntry> findAll() throws IOException;
}
