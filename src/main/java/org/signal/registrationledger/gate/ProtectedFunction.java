/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.gate;

/**
 * A single-argument function that may only run on behalf of a verified identity.
 *
 * @param <A> the argument type
 * @param <R> the result type
 * @param <E> the checked exception the function itself may throw
 */
@FunctionalInterface
public interface ProtectedFunction<A, R, E extends Exception> {

  R apply(A argument) throws E, PermissionDeniedException;
}
