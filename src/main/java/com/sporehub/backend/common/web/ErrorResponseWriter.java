package com.sporehub.backend.common.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Writes the failure envelope from servlet filters, where controller advice does not reach.
 */
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

    private final ObjectMapper om;

    public void write(HttpServletResponse res, ApiException e) throws IOException {
        if (e instanceof RateLimitedException rl) {
            res.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(rl.retryAfterSec()));
        }
        write(res, e.kind(), e.getMessage());
    }

    public void write(HttpServletResponse res, ErrorKind kind, String message) throws IOException {
        if (res.isCommitted()) return;
        res.setStatus(kind.status().value());
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        res.setCharacterEncoding(StandardCharsets.UTF_8.name());
        om.writeValue(res.getWriter(), ErrorResponse.of(kind, message));
    }
}
