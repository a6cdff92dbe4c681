/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.identity;

/**
 * Indicates that a signing backend could not produce a signature or export a key, because it was unavailable, did
 * not hold the requested key, or did not answer in time.
 */
public class SigningBackendException extends Exception {

  public SigningBackendException(final String message) {
    super(message);
  }

  public SigningBackendException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
