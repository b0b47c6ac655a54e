package com.newsagent.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Locale;

/**
 * Logs every request with status, latency and client address, and reports the processing time
 * in an {@code X-Process-Time} header (seconds).
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    static final String PROCESS_TIME_HEADER = "X-Process-Time";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        String method = request.getMethod();
        String path = request.getRequestURI();
        String client = clientIp(request);

        log.info("{} {} - Client: {}", method, path, client);
        try {
            chain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("{} {} - ERROR: {} - {}ms - Client: {}", method, path, e.getMessage(), millis(start), client);
            throw e;
        }

        int status = response.getStatus();
        String elapsed = millis(start);
        if (status >= 500) {
            log.error("{} {} - {} - {}ms - Client: {}", method, path, status, elapsed, client);
        } else if (status >= 400) {
            log.warn("{} {} - {} - {}ms - Client: {}", method, path, status, elapsed, client);
        } else {
            log.info("{} {} - {} - {}ms - Client: {}", method, path, status, elapsed, client);
        }
        if (!response.isCommitted()) {
            response.setHeader(PROCESS_TIME_HEADER, String.valueOf((System.nanoTime() - start) / 1_000_000_000.0));
        }
    }

    static String clientIp(HttpServletRequest request) {
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return forwardedFor.split(",")[0].trim();
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return realIp;
        }
        String remote = request.getRemoteAddr();
        return remote != null ? remote : "Unknown";
    }

    private static String millis(long startNanos) {
        return String.format(Locale.ROOT, "%.2f", (System.nanoTime() - startNanos) / 1_000_000.0);
    }
}
