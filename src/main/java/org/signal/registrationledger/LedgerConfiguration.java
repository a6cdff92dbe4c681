/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger;

import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.core.annotation.Nullable;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.security.interfaces.EdECPrivateKey;
import java.security.interfaces.EdECPublicKey;
import java.time.Duration;

/**
 * Configuration parameters for a {@link Ledger} and the services built on it.
 *
 * @param chainPrivateKey  An Ed25519 private key used to produce chain signatures. If either this or
 *                         {@code chainPublicKey} is absent, a new key pair is generated at startup.
 * @param chainPublicKey   The public counterpart to {@code chainPrivateKey}.
 * @param signingTimeout   The longest any single signing or verification call may take.
 * @param proposalIdLength The number of hex characters of the proposal digest kept as the proposal ID.
 */
@ConfigurationProperties("ledger")
public record LedgerConfiguration(
    @Nullable
    EdECPrivateKey chainPrivateKey,
    @Nullable
    EdECPublicKey chainPublicKey,
    @NotNull
    Duration signingTimeout,
    @Positive
    @Max(64)
    int proposalIdLength) {
}
