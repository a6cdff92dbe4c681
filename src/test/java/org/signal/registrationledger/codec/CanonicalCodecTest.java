/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.registrationledger.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class CanonicalCodecTest {

  private CanonicalCodec canonicalCodec;

  @BeforeEach
  void setUp() {
    canonicalCodec = new CanonicalCodec();
  }

  @ParameterizedTest
  @MethodSource
  void testEncode(final Object record, final String expectedJson) {
    assertEquals(expectedJson, new String(canonicalCodec.encode(record), StandardCharsets.UTF_8));
  }

  private static Stream<Arguments> testEncode() {
    final Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("z", List.of(3, 1, 2));
    nested.put("a", Map.of("y", true, "b", "text"));

    return Stream.of(
        Arguments.of(Map.of("v", 1), "{\"v\":1}"),
        Arguments.of(nested, "{\"a\":{\"b\":\"text\",\"y\":true},\"z\":[3,1,2]}"),
        Arguments.of(Map.of("name", "Zoë"), "{\"name\":\"Zo\\u00EB\"}"),
        Arguments.of(List.of("b", "a"), "[\"b\",\"a\"]"),
        Arguments.of(new Sample("x", 2), "{\"label\":\"x\",\"size\":2}"));
  }

  @Test
  void testInsertionOrderDoesNotMatter() {
    final Map<String, Object> forward = new LinkedHashMap<>();
    forward.put("alpha", 1);
    forward.put("beta", Map.of("inner", "x"));
    forward.put("gamma", List.of(1, 2));

    final Map<String, Object> reverse = new LinkedHashMap<>();
    reverse.put("gamma", List.of(1, 2));
    reverse.put("beta", Map.of("inner", "x"));
    reverse.put("alpha", 1);

    assertArrayEquals(canonicalCodec.encode(forward), canonicalCodec.encode(reverse));
    assertArrayEquals(canonicalCodec.encode(forward), canonicalCodec.encode(forward));
  }

  @Test
  void testExclusions() {
    final Map<String, Object> record = Map.of("keep", 1, "drop", 2, "nested", Map.of("drop", 3));

    assertEquals("{\"keep\":1,\"nested\":{\"drop\":3}}",
        new String(canonicalCodec.encode(record, Set.of("drop", "absent")), StandardCharsets.UTF_8));
  }

  @Test
  void testExclusionsRequireObject() {
    assertThrows(CanonicalizationException.class, () -> canonicalCodec.encode(List.of(1, 2), Set.of("drop")));
  }

  @Test
  void testDecimalsEncodeExactly() {
    assertEquals("{\"a\":0.5,\"b\":1.00000000000000001,\"c\":1E+2}",
        new String(canonicalCodec.encode(Map.of("a", 0.5d,
            "b", new BigDecimal("1.00000000000000001"),
            "c", new BigDecimal("100").stripTrailingZeros())), StandardCharsets.UTF_8));

    assertArrayEquals(canonicalCodec.encode(Map.of("v", 0.5d)),
        canonicalCodec.encode(Map.of("v", new BigDecimal("0.5"))));
  }

  @Test
  void testNonFiniteNumbersRejected() {
    assertThrows(CanonicalizationException.class, () -> canonicalCodec.encode(Map.of("v", Double.NaN)));
    assertThrows(CanonicalizationException.class,
        () -> canonicalCodec.encode(Map.of("v", Double.POSITIVE_INFINITY)));
  }

  @Test
  void testUnserializableValueRejected() {
    assertThrows(CanonicalizationException.class, () -> canonicalCodec.encode(new Object()));
  }

  record Sample(String label, int size) {
  }
}
