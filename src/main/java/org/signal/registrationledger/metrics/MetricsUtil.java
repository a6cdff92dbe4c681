/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.metrics;

public class MetricsUtil {

  private static final String METRIC_NAME_PREFIX = "registration_ledger";

  private MetricsUtil() {
  }

  /**
   * @return a metric name of the form {@code registration_ledger.<ClassSimpleName>.<metricName>}
   */
  public static String name(final Class<?> clazz, final String metricName) {
    return String.join(".", METRIC_NAME_PREFIX, clazz.getSimpleName(), metricName);
  }
}
