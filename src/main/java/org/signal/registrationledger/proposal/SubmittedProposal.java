/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.proposal;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A stored proposal.
 *
 * @param timestamp seconds since the Unix epoch at which the proposal was first stored
 */
public record SubmittedProposal(
    @JsonProperty("proposal_id")
    String proposalId,
    @JsonProperty("timestamp")
    long timestamp,
    @JsonProperty("proposal")
    Proposal proposal) {
}
