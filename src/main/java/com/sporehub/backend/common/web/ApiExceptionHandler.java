package com.sporehub.backend.common.web;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps every exception reaching a controller to the failure envelope:
 * - {@link ApiException}: its own {@link ErrorKind}
 * - binding / parsing problems: 400
 * - unknown route: 404
 * - anything else: 500, logged, no internal detail in the body
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApi(ApiException e) {
        var builder = ResponseEntity.status(e.kind().status());
        if (e instanceof RateLimitedException rl) {
            builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(rl.retryAfterSec()));
        }
        if (e.kind() == ErrorKind.DELIVERY_FAILED) {
            log.warn("delivery failed: {}", e.getMessage());
        }
        return builder.body(ErrorResponse.of(e.kind(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String msg = e.getBindingResult().getFieldErrors().isEmpty()
                ? "Validation failed"
                : e.getBindingResult().getFieldErrors().get(0).getField()
                + " " + e.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return of(ErrorKind.INVALID_REQUEST, msg);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMediaTypeNotSupportedException.class,
            HttpRequestMethodNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return of(ErrorKind.INVALID_REQUEST, firstLine(e.getMessage(), "Malformed request"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoRoute(NoResourceFoundException e) {
        return of(ErrorKind.NOT_FOUND, "Route not found");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, HttpServletRequest req) {
        log.error("unhandled failure {} {}", req.getMethod(), req.getRequestURI(), e);
        return of(ErrorKind.INTERNAL, "Internal server error");
    }

    private static ResponseEntity<ErrorResponse> of(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.status()).body(ErrorResponse.of(kind, message));
    }

    private static String firstLine(String msg, String fallback) {
        if (msg == null || msg.isBlank()) return fallback;
        int nl = msg.indexOf('\n');
        String s = (nl >= 0 ? msg.substring(0, nl) : msg).trim();
        // Jackson messages end with ": " plus the offending source location
        int colon = s.indexOf(": ");
        return colon > 0 ? s.substring(0, colon) : s;
    }
}
