/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A summary of one stored registration.
 *
 * @param verified whether the registration's identity signature verified at the time the summary was produced
 */
public record MemberInfo(
    @JsonProperty("fingerprint")
    String fingerprint,
    @JsonProperty("proof_name")
    String proofName,
    @JsonProperty("timestamp")
    long timestamp,
    @JsonProperty("verified")
    boolean verified) {
}
