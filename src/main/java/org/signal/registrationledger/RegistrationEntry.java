/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Set;

/**
 * A single attestation in the registration ledger.
 * <p>
 * Entries are immutable. The {@code with*} methods return copies and are only used while an entry is being built
 * and, after chaining, to add the identity-signature fields, none of which are covered by the chain hash.
 *
 * @param proofName           a human-readable label; not unique
 * @param payload             caller-supplied content, opaque to the ledger
 * @param timestamp           creation time in seconds since the Unix epoch; advisory only, since append order is the
 *                            only ordering guarantee
 * @param previousChainHash   the chain hash of the preceding entry, or {@link ChainLink#GENESIS_SENTINEL}
 * @param chainPublicKey      the public key of the ledger's chain identity
 * @param chainSignature      the chain identity's signature over {@link #CHAIN_SIGNATURE_EXCLUSIONS canonical bytes}
 * @param chainHash           see {@link ChainLink#compute(String, byte[])}
 * @param identityFingerprint the fingerprint of the external identity that signed this entry, if any
 * @param identitySignature   the external identity's detached signature over
 *                            {@link #IDENTITY_SIGNATURE_EXCLUSIONS canonical bytes}, if any
 * @param identityPublicKey   the external identity's exported public key, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegistrationEntry(
    @JsonProperty("proof_name")
    String proofName,
    @JsonProperty("payload")
    JsonNode payload,
    @JsonProperty("timestamp")
    long timestamp,
    @JsonProperty("prev_chain_hash")
    String previousChainHash,
    @JsonProperty("chain_public_key")
    String chainPublicKey,
    @JsonProperty("chain_signature")
    String chainSignature,
    @JsonProperty("chain_hash")
    String chainHash,
    @JsonProperty("identity_fingerprint")
    String identityFingerprint,
    @JsonProperty("identity_signature")
    String identitySignature,
    @JsonProperty("identity_public_key")
    String identityPublicKey) {

  public static final String CHAIN_SIGNATURE = "chain_signature";
  public static final String CHAIN_HASH = "chain_hash";
  public static final String IDENTITY_FINGERPRINT = "identity_fingerprint";
  public static final String IDENTITY_SIGNATURE = "identity_signature";
  public static final String IDENTITY_PUBLIC_KEY = "identity_public_key";

  /**
   * Fields left out of the chain signature's input. The chain hash is computed over the same field set.
   */
  public static final Set<String> CHAIN_SIGNATURE_EXCLUSIONS =
      Set.of(CHAIN_SIGNATURE, CHAIN_HASH, IDENTITY_FINGERPRINT, IDENTITY_SIGNATURE, IDENTITY_PUBLIC_KEY);

  public static final Set<String> CHAIN_HASH_EXCLUSIONS = CHAIN_SIGNATURE_EXCLUSIONS;

  /**
   * Fields left out of the identity signature's input. The identity fingerprint and chain hash remain in the input,
   * which binds an identity signature to exactly one chained entry.
   */
  public static final Set<String> IDENTITY_SIGNATURE_EXCLUSIONS =
      Set.of(CHAIN_SIGNATURE, IDENTITY_SIGNATURE, IDENTITY_PUBLIC_KEY);

  static RegistrationEntry draft(final String proofName,
      final JsonNode payload,
      final long timestamp,
      final String previousChainHash,
      final String chainPublicKey) {

    return new RegistrationEntry(proofName, payload, timestamp, previousChainHash, chainPublicKey,
        null, null, null, null, null);
  }

  RegistrationEntry withChainSignature(final String chainSignature) {
    return new RegistrationEntry(proofName, payload, timestamp, previousChainHash, chainPublicKey,
        chainSignature, chainHash, identityFingerprint, identitySignature, identityPublicKey);
  }

  RegistrationEntry withChainHash(final String chainHash) {
    return new RegistrationEntry(proofName, payload, timestamp, previousChainHash, chainPublicKey,
        chainSignature, chainHash, identityFingerprint, identitySignature, identityPublicKey);
  }

  RegistrationEntry withIdentityFingerprint(final String identityFingerprint) {
    return new RegistrationEntry(proofName, payload, timestamp, previousChainHash, chainPublicKey,
        chainSignature, chainHash, identityFingerprint, null, null);
  }

  RegistrationEntry withIdentitySignature(final String identitySignature, final String identityPublicKey) {
    return new RegistrationEntry(proofName, payload, timestamp, previousChainHash, chainPublicKey,
        chainSignature, chainHash, identityFingerprint, identitySignature, identityPublicKey);
  }

  public boolean hasIdentitySignature() {
    return identitySignature != null && identityFingerprint != null;
  }
}
