package com.github.dimitryivaniuta.gateway.jobs.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs method, path, status and duration of API calls. Slow requests are logged at WARN.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestTimingFilter extends OncePerRequestFilter {

    private static final long SLOW_REQUEST_MS = 1000;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        long t0 = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long ms = (System.nanoTime() - t0) / 1_000_000;
            if (ms >= SLOW_REQUEST_MS) {
                log.warn("Slow HTTP {} {} -> {} in {}ms", req.getMethod(), req.getRequestURI(), res.getStatus(), ms);
            } else {
                log.info("HTTP {} {} -> {} in {}ms", req.getMethod(), req.getRequestURI(), res.getStatus(), ms);
            }
        }
    }
}
