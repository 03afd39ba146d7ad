package com.kpiforecast.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Makes sure every API request carries an {@code X-Request-ID}: the caller's value is kept, a
 * random one is minted otherwise. The id is echoed on the response and put in the MDC.
 */
@Slf4j
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-ID";
    static final String MDC_KEY = "requestId";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String existing = request.getHeader(HEADER);
        String requestId = existing != null && !existing.isBlank() ? existing : UUID.randomUUID().toString();
        response.setHeader(HEADER, requestId);

        HttpServletRequest wrapped = existing != null && !existing.isBlank() ? request
            : new HttpServletRequestWrapper(request) {
                @Override
                public String getHeader(String name) {
                    return HEADER.equalsIgnoreCase(name) ? requestId : super.getHeader(name);
                }
            };

        MDC.put(MDC_KEY, requestId);
        long started = System.nanoTime();
        try {
            filterChain.doFilter(wrapped, response);
        } finally {
            log.debug("{} {} | status={} | tookMs={} | requestId={}", request.getMethod(), request.getRequestURI(),
                      response.getStatus(), (System.nanoTime() - started) / 1_000_000, requestId);
            MDC.remove(MDC_KEY);
        }
    }
}
