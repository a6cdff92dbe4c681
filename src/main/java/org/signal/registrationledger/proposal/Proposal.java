/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.proposal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A governance proposal as submitted by a registered member. The proposal ID is derived from the canonical form of
 * this record, so identical submissions by the same member map to the same ID.
 *
 * @param rationale optional; omitted from JSON when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Proposal(
    @JsonProperty("title")
    String title,
    @JsonProperty("description")
    String description,
    @JsonProperty("rationale")
    String rationale,
    @JsonProperty("submitted_by")
    String submittedBy) {
}
