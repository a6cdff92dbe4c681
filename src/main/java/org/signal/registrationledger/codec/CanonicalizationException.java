/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.codec;

/**
 * Indicates that a record could not be reduced to canonical bytes, for example because it has no serializable
 * properties or contains a non-finite number. Never retried.
 */
public class CanonicalizationException extends RuntimeException {

  public CanonicalizationException(final String message) {
    super(message);
  }

  public CanonicalizationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
