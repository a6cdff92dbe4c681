/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.codec;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Singleton;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.signal.registrationledger.util.ObjectMappers;

/**
 * Produces the canonical byte form of a record, which is the exact input to every hash and signature in the ledger.
 * <p>
 * The canonical form is compact UTF-8 JSON in which the fields of every object, at every depth, are sorted
 * lexicographically by name, array order is preserved, and all non-ASCII characters are escaped. Two records that
 * differ only in field insertion order always encode to identical bytes.
 */
@Singleton
public class CanonicalCodec {

  private final ObjectMapper objectMapper;
  private final JsonFactory canonicalJsonFactory;

  public CanonicalCodec() {
    this.objectMapper = ObjectMappers.newObjectMapper();
    this.canonicalJsonFactory = JsonFactory.builder()
        .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
        .build();
  }

  /**
   * Converts an arbitrary value (a {@link JsonNode}, a map, a record or a bean) into a new JSON tree.
   * <p>
   * The value is written as JSON text and parsed back, so the returned tree is exactly what a later read of stored
   * JSON produces. In particular, every non-integral number becomes an exact decimal, whether it started out as a
   * {@code double}, a {@code BigDecimal} or a node read from a file.
   *
   * @throws CanonicalizationException if the value cannot be represented as JSON
   */
  public JsonNode toTree(final Object value) {
    try {
      return objectMapper.readTree(objectMapper.writeValueAsBytes(value));
    } catch (final IOException | IllegalArgumentException e) {
      throw new CanonicalizationException("Value of type " + (value == null ? "null" : value.getClass().getName())
          + " is not serializable", e);
    }
  }

  /**
   * @param record  the record to encode
   * @param exclude names of top-level fields to drop before encoding
   * @return the canonical bytes of {@code record} without the fields named in {@code exclude}
   * @throws CanonicalizationException if the record cannot be encoded, or if exclusions are requested for a value that
   *                                   is not a JSON object
   */
  public byte[] encode(final Object record, final Set<String> exclude) {
    JsonNode tree = toTree(record);

    if (!exclude.isEmpty()) {
      if (!tree.isObject()) {
        throw new CanonicalizationException("Field exclusions require an object, but got " + tree.getNodeType());
      }
      final ObjectNode copy = ((ObjectNode) tree).deepCopy();
      copy.remove(exclude);
      tree = copy;
    }

    final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
    try (final JsonGenerator generator = canonicalJsonFactory.createGenerator(outputStream, JsonEncoding.UTF8)) {
      writeCanonical(generator, tree);
    } catch (final IOException e) {
      // Writing to memory only fails if the tree itself can't be written
      throw new CanonicalizationException("Could not encode record", e);
    }
    return outputStream.toByteArray();
  }

  public byte[] encode(final Object record) {
    return encode(record, Set.of());
  }

  private void writeCanonical(final JsonGenerator generator, final JsonNode node) throws IOException {
    if (node.isObject()) {
      final List<String> fieldNames = new ArrayList<>();
      node.fieldNames().forEachRemaining(fieldNames::add);
      Collections.sort(fieldNames);

      generator.writeStartObject();
      for (final String fieldName : fieldNames) {
        generator.writeFieldName(fieldName);
        writeCanonical(generator, node.get(fieldName));
      }
      generator.writeEndObject();
    } else if (node.isArray()) {
      generator.writeStartArray();
      for (final JsonNode element : node) {
        writeCanonical(generator, element);
      }
      generator.writeEndArray();
    } else {
      if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
        throw new CanonicalizationException("Non-finite numbers have no canonical form");
      }
      objectMapper.writeTree(generator, node);
    }
  }
}
