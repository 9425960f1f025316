package com.dev.marketflow.exchange;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * <p>Immutable, bidirectional lookup between the short exchange identifiers
 * used by API clients (e.g. <code>exchange1</code>) and the canonical
 * addresses used by the aggregate data service (e.g.
 * <code>exchange1:40101</code>).</p>
 *
 * <p>Short identifiers are matched case-insensitively; canonical addresses
 * are matched exactly. The registry is built once at startup and shared
 * read-only between request threads.</p>
 */
public final class ExchangeRegistry {

  private final Map<String, String> addressById;
  private final Map<String, String> idByAddress;

  /**
   * Builds the registry from a short identifier to canonical address mapping.
   *
   * @param addresses short identifier to canonical address entries
   * @throws IllegalArgumentException if an entry is blank or two identifiers
   *         share the same canonical address
   */
  public ExchangeRegistry(Map<String, String> addresses) {
    Map<String, String> byId = new HashMap<>();
    Map<String, String> byAddress = new HashMap<>();

    for (Map.Entry<String, String> entry : addresses.entrySet()) {
      String id = entry.getKey();
      String address = entry.getValue();
      if (id == null || id.isBlank() || address == null || address.isBlank()) {
        throw new IllegalArgumentException("Exchange mapping must not be blank: "
            + id + " -> " + address);
      }

      String normalizedId = id.trim().toLowerCase(Locale.ROOT);
      String trimmedAddress = address.trim();
      if (byId.put(normalizedId, trimmedAddress) != null) {
        throw new IllegalArgumentException("Duplicate exchange identifier: " + normalizedId);
      }
      if (byAddress.put(trimmedAddress, normalizedId) != null) {
        throw new IllegalArgumentException("Duplicate exchange address: " + trimmedAddress);
      }
    }

    this.addressById = Collections.unmodifiableMap(byId);
    this.idByAddress = Collections.unmodifiableMap(byAddress);
  }

  /**
   * Registry holding the three exchanges of the default deployment.
   */
  public static ExchangeRegistry defaults() {
    return new ExchangeRegistry(Map.of(
        "exchange1", "exchange1:40101",
        "exchange2", "exchange2:40102",
        "exchange3", "exchange3:40103"));
  }

  /**
   * Looks up the canonical address for a short identifier.
   *
   * @param shortId the identifier supplied by the client, any case
   * @return the canonical address, or empty if the identifier is unknown
   */
  public Optional<String> resolveAddress(String shortId) {
    if (shortId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(addressById.get(shortId.toLowerCase(Locale.ROOT)));
  }

  /**
   * Looks up the short identifier for a canonical address (exact match).
   *
   * @param address the canonical address
   * @return the short identifier, or empty if the address is not mapped
   */
  public Optional<String> shortIdFor(String address) {
    if (address == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(idByAddress.get(address));
  }

  /**
   * Returns the short identifier for a canonical address, or the address
   * itself when it is not mapped.
   */
  public String toShortId(String address) {
    return shortIdFor(address).orElse(address);
  }

  public Set<String> shortIds() {
    return Collections.unmodifiableSet(new TreeSet<>(addressById.keySet()));
  }

  public int size() {
    return addressById.size();
  }
}
