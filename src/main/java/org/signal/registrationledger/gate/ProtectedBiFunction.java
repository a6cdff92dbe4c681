/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.gate;

/**
 * A two-argument function that may only run on behalf of a verified identity. Operations with more arguments bundle
 * them into a record and use {@link ProtectedFunction}.
 *
 * @param <A> the first argument type
 * @param <B> the second argument type
 * @param <R> the result type
 * @param <E> the checked exception the function itself may throw
 */
@FunctionalInterface
public interface ProtectedBiFunction<A, B, R, E extends Exception> {

  R apply(A first, B second) throws E, PermissionDeniedException;
}
