/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.gate;

/**
 * An operation that may only run on behalf of a verified identity.
 *
 * @param <T> the operation's result type
 * @param <E> the checked exception the operation itself may throw
 */
@FunctionalInterface
public interface ProtectedOperation<T, E extends Exception> {

  T call() throws E, PermissionDeniedException;
}
