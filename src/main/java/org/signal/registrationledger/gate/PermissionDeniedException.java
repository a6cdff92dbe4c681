/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.gate;

/**
 * Indicates that a protected operation was refused because its caller's identity could not be verified.
 */
public class PermissionDeniedException extends Exception {

  private final String fingerprint;

  public PermissionDeniedException(final String fingerprint) {
    super("Identity " + fingerprint + " is not a verified member");
    this.fingerprint = fingerprint;
  }

  public String getFingerprint() {
    return fingerprint;
  }
}
