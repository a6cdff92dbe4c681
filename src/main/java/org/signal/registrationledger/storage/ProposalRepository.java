/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.storage;

import java.io.IOException;
import java.util.Optional;
import org.signal.registrationledger.proposal.SubmittedProposal;

/**
 * Write-once storage for submitted proposals, keyed by proposal ID.
 */
public interface ProposalRepository {

  Optional<SubmittedProposal> findById(String proposalId) throws IOException;

  /**
   * Stores {@code proposal} unless a proposal with the same ID already exists. Existing proposals are never
   * overwritten.
   *
   * @return {@code true} if the proposal was stored or {@code false} if one with the same ID already existed
   */
  boolean storeIfAbsent(SubmittedProposal proposal) throws IOException;
}
