package com.dev.marketflow.exchange;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ExchangeRegistry.
 * Covers both lookup directions, case handling and construction rules.
 */
class ExchangeRegistryTest {

  private ExchangeRegistry registry;

  @BeforeEach
  void setUp() {
    registry = ExchangeRegistry.defaults();
  }

  @Test
  void testResolveAddress_KnownId_TypicalCase() {
    assertEquals(Optional.of("exchange1:40101"), registry.resolveAddress("exchange1"));
    assertEquals(Optional.of("exchange3:40103"), registry.resolveAddress("exchange3"));
  }

  @Test
  void testResolveAddress_IsCaseInsensitive() {
    assertEquals(Optional.of("exchange2:40102"), registry.resolveAddress("EXCHANGE2"));
    assertEquals(Optional.of("exchange2:40102"), registry.resolveAddress("Exchange2"));
  }

  @Test
  void testResolveAddress_UnknownId_ReturnsEmpty() {
    assertEquals(Optional.empty(), registry.resolveAddress("xyz"));
    assertEquals(Optional.empty(), registry.resolveAddress(""));
    assertEquals(Optional.empty(), registry.resolveAddress(null));
  }

  @Test
  void testShortIdFor_IsExactMatch() {
    assertEquals(Optional.of("exchange2"), registry.shortIdFor("exchange2:40102"));
    assertEquals(Optional.empty(), registry.shortIdFor("EXCHANGE2:40102"));
    assertEquals(Optional.empty(), registry.shortIdFor("exchange2"));
  }

  @Test
  void testToShortId_UnmappedAddress_PassesThrough() {
    assertEquals("exchange1", registry.toShortId("exchange1:40101"));
    assertEquals("exchange9:40109", registry.toShortId("exchange9:40109"));
    assertEquals("", registry.toShortId(""));
  }

  /**
   * canonical -> short -> canonical is the identity for every mapped address.
   */
  @Test
  void testRoundTrip_EveryMappedAddress() {
    for (String shortId : registry.shortIds()) {
      String address = registry.resolveAddress(shortId).orElseThrow();
      String back = registry.toShortId(address);
      assertEquals(address, registry.resolveAddress(back).orElseThrow());
    }
  }

  @Test
  void testConstructor_ArbitraryEntries_AtypicalCase() {
    Map<String, String> entries = new LinkedHashMap<>();
    entries.put("Alpha", "10.0.0.1:9000");
    entries.put("beta", "10.0.0.2:9000");
    entries.put("gamma", "10.0.0.3:9000");
    entries.put("delta", "10.0.0.4:9000");

    ExchangeRegistry custom = new ExchangeRegistry(entries);

    assertEquals(4, custom.size());
    assertEquals(Set.of("alpha", "beta", "gamma", "delta"), custom.shortIds());
    assertEquals(Optional.of("10.0.0.1:9000"), custom.resolveAddress("alpha"));
    assertEquals("alpha", custom.toShortId("10.0.0.1:9000"));
  }

  @Test
  void testConstructor_DuplicateAddress_Throws() {
    Map<String, String> entries = Map.of(
        "one", "host:1",
        "two", "host:1");

    assertThrows(IllegalArgumentException.class, () -> new ExchangeRegistry(entries));
  }

  @Test
  void testConstructor_IdsDifferingOnlyByCase_Throws() {
    Map<String, String> entries = Map.of(
        "one", "host:1",
        "ONE", "host:2");

    assertThrows(IllegalArgumentException.class, () -> new ExchangeRegistry(entries));
  }

  @Test
  void testConstructor_BlankEntry_Throws() {
    assertThrows(IllegalArgumentException.class,
        () -> new ExchangeRegistry(Map.of(" ", "host:1")));
    assertThrows(IllegalArgumentException.class,
        () -> new ExchangeRegistry(Map.of("one", "")));
  }

  @Test
  void testShortIds_IsUnmodifiable() {
    Set<String> ids = registry.shortIds();
    assertThrows(UnsupportedOperationException.class, () -> ids.add("exchange4"));
    assertTrue(registry.resolveAddress("exchange4").isEmpty());
  }
}
