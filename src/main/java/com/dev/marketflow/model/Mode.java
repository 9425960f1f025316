package com.dev.marketflow.model;

import java.util.Locale;

/**
 * Data source selection of the aggregate data service.
 */
public enum Mode {
  TEST,
  LIVE;

  /**
   * Lower-case name used on the wire, e.g. "test".
   */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
