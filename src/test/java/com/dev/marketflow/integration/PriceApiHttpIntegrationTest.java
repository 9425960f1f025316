package com.dev.marketflow.integration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.dev.marketflow.exception.AggregateServiceException;
import com.dev.marketflow.model.MarketData;
import com.dev.marketflow.model.Mode;
import com.dev.marketflow.service.AggregateDataService;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * HTTP-level integration tests that start the full Spring context with the
 * aggregate data service mocked, and exercise the price, health and mode
 * endpoints through MockMvc.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PriceApiHttpIntegrationTest {

  @Autowired
  private MockMvc mockMvc;

  @MockBean
  private AggregateDataService aggregateDataService;

  private static MarketData record(String symbol, String exchange, String price) {
    return new MarketData(symbol, exchange, new BigDecimal(price),
        Instant.parse("2024-05-01T12:00:00Z"));
  }

  @Test
  void highestWithPeriod_allExchanges_overHttp() throws Exception {
    when(aggregateDataService.getHighestByPeriod("", "BTC", Duration.ofMinutes(5)))
        .thenReturn(record("BTC", "exchange1:40101", "64999.99"));

    mockMvc.perform(get("/price/highest/BTC").param("period", "5m"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.symbol").value("BTC"))
        .andExpect(jsonPath("$.exchange").value("exchange1"))
        .andExpect(jsonPath("$.price").value(64999.99));
  }

  @Test
  void averageByExchange_resolvesCanonicalAddress() throws Exception {
    when(aggregateDataService.getAverageByExchange("exchange1:40101", "ETH"))
        .thenReturn(record("ETH", "exchange1:40101", "3100.5"));

    mockMvc.perform(get("/price/average/exchange1/eth"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.symbol").value("ETH"))
        .andExpect(jsonPath("$.exchange").value("exchange1"));
  }

  @Test
  void latestByExchange_rewritesExchangeInResponse() throws Exception {
    when(aggregateDataService.getLatestByExchange("exchange2:40102", "SOL"))
        .thenReturn(record("SOL", "exchange2:40102", "145.2"));

    mockMvc.perform(get("/price/latest/exchange2/SOL"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.exchange").value("exchange2"));
  }

  @Test
  void unknownExchange_returns400_withoutBackingCall() throws Exception {
    mockMvc.perform(get("/price/latest/xyz/BTC"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("unknown exchange"));

    verifyNoInteractions(aggregateDataService);
  }

  @Test
  void latestWithPeriod_returns400() throws Exception {
    mockMvc.perform(get("/price/latest/BTC").param("period", "5m"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("period parameter is not applicable for latest price"));

    verifyNoInteractions(aggregateDataService);
  }

  @Test
  void averagePeriodWithoutExchange_returns400() throws Exception {
    mockMvc.perform(get("/price/average/BTC").param("period", "1h"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("cannot get average by period without exchange"));

    verifyNoInteractions(aggregateDataService);
  }

  @Test
  void invalidPathAndPeriod_return400() throws Exception {
    mockMvc.perform(get("/price/lowest/exchange1/BTC/extra"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid path"));

    mockMvc.perform(get("/price/lowest/BTC").param("period", "abc"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid period format"));

    mockMvc.perform(get("/price/lowest/BTC").param("period", "0s"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("period must be positive"));

    mockMvc.perform(get("/price/lowest/BTC-USD"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("symbol must be alphanumeric"));

    verifyNoInteractions(aggregateDataService);
  }

  @Test
  void domainError_surfacedWithBackingStatus() throws Exception {
    when(aggregateDataService.getLowestAggregate("DOGE"))
        .thenThrow(new AggregateServiceException(404, "no data for DOGE"));

    mockMvc.perform(get("/price/lowest/DOGE"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("no data for DOGE"));
  }

  @Test
  void unexpectedError_returnsGeneric500() throws Exception {
    when(aggregateDataService.getHighestByExchange(anyString(), anyString()))
        .thenThrow(new IllegalStateException("redis connection reset"));

    mockMvc.perform(get("/price/highest/exchange3/BTC"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("Internal server error"));
  }

  @Test
  void health_okAndUnavailable() throws Exception {
    mockMvc.perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(content().string("OK"));

    doThrow(new IllegalStateException("down")).when(aggregateDataService).healthCheck();

    mockMvc.perform(get("/health"))
        .andExpect(status().isServiceUnavailable());
  }

  @Test
  void modeSwitch_redirectsToIndex() throws Exception {
    mockMvc.perform(post("/mode/live"))
        .andExpect(status().isSeeOther())
        .andExpect(header().string("Location", "/"));

    mockMvc.perform(get("/mode/test"))
        .andExpect(status().isSeeOther());

    verify(aggregateDataService).setMode(Mode.LIVE);
    verify(aggregateDataService).setMode(Mode.TEST);
  }

  @Test
  void semicolonInSymbol_returns400() throws Exception {
    mockMvc.perform(get("/price/latest/BTC;x=1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("symbol must be alphanumeric"));

    verifyNoInteractions(aggregateDataService);
  }

  @Test
  void repeatedPeriod_usesFirstValue() throws Exception {
    when(aggregateDataService.getHighestByPeriod("", "BTC", Duration.ofMinutes(5)))
        .thenReturn(record("BTC", "exchange2:40102", "65000"));

    mockMvc.perform(get("/price/highest/BTC").param("period", "5m", "10m"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.exchange").value("exchange2"));

    verify(aggregateDataService).getHighestByPeriod("", "BTC", Duration.ofMinutes(5));
  }

  @Test
  void unknownStatistic_returns404() throws Exception {
    mockMvc.perform(get("/price/median/BTC"))
        .andExpect(status().isNotFound());

    mockMvc.perform(get("/price/LATEST/BTC"))
        .andExpect(status().isNotFound());

    verify(aggregateDataService, never()).getLatestAggregate(any());
  }
}
