package com.dev.marketflow.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Exchange identity configuration, bound from
 * <code>marketflow.exchange.addresses.&lt;shortId&gt;=&lt;address&gt;</code>.
 */
@ConfigurationProperties(prefix = "marketflow.exchange")
public class ExchangeProperties {

  private Map<String, String> addresses = new LinkedHashMap<>();

  public Map<String, String> getAddresses() {
    return addresses;
  }

  public void setAddresses(Map<String, String> addresses) {
    this.addresses = addresses;
  }
}
