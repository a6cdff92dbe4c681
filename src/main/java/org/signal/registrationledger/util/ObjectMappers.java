/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

public class ObjectMappers {

  private ObjectMappers() {
  }

  /**
   * @return a new mapper that omits null properties, used both for canonical encoding and for the JSON files in the
   * store so that both see the same field set. Non-integral numbers in trees are kept as exact decimals with their
   * original scale, so a tree read back from a file holds the same numbers as the tree that was written. Non-finite
   * numbers are written as bare tokens, which the mapper refuses to read back.
   */
  public static ObjectMapper newObjectMapper() {
    final JsonFactory jsonFactory = JsonFactory.builder()
        .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
        .build();

    return new ObjectMapper(jsonFactory)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true))
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }
}
