package com.dev.marketflow.filter;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Filter that writes one access log line per HTTP request: method, path,
 * query, status and latency. Health probes are logged at DEBUG only.
 */
@Component
public class RequestLoggingFilter implements Filter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  @Override
  public void doFilter(ServletRequest request, ServletResponse response,
                       FilterChain chain) throws IOException, ServletException {
    if (!(request instanceof HttpServletRequest) || !(response instanceof HttpServletResponse)) {
      chain.doFilter(request, response);
      return;
    }

    HttpServletRequest httpRequest = (HttpServletRequest) request;
    HttpServletResponse httpResponse = (HttpServletResponse) response;

    long startTime = System.currentTimeMillis();
    try {
      chain.doFilter(request, response);
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      String path = httpRequest.getRequestURI();
      String query = httpRequest.getQueryString();
      String target = query == null ? path : path + "?" + query;

      if (path != null && path.startsWith("/health")) {
        log.debug("{} {} -> {} ({} ms)", httpRequest.getMethod(), target,
            httpResponse.getStatus(), duration);
      } else {
        log.info("{} {} -> {} ({} ms)", httpRequest.getMethod(), target,
            httpResponse.getStatus(), duration);
      }
    }
  }
}
