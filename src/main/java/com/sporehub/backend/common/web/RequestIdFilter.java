package com.sporehub.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with an id (taken from {@code X-Request-Id} or generated),
 * echoes it on the response, and writes one access log line per request.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private final ErrorResponseWriter errors;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = req.getHeader(HEADER);
        if (rid == null || rid.isBlank()) rid = UUID.randomUUID().toString();

        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);
        res.setHeader(HEADER, rid);

        long start = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } catch (ServletException | IOException | RuntimeException | Error e) {
            // no stack trace reaches the client
            log.error("request failed {} {}", req.getMethod(), req.getRequestURI(), e);
            errors.write(res, ErrorKind.INTERNAL, "Internal server error");
        } finally {
            long tookMs = (System.nanoTime() - start) / 1_000_000;
            log.info("http method={} path={} status={} durationMs={} remote={} ua={}",
                    req.getMethod(), req.getRequestURI(), res.getStatus(), tookMs,
                    req.getRemoteAddr(), req.getHeader("User-Agent"));
            MDC.remove(MDC_KEY);
        }
    }
}
