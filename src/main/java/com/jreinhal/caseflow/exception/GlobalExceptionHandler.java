package com.jreinhal.caseflow.exception;

import com.jreinhal.caseflow.casework.CaseworkException;
import com.jreinhal.caseflow.filter.CorrelationIdFilter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CaseworkException.class)
    public ResponseEntity<Map<String, Object>> handleCasework(CaseworkException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status == HttpStatus.CONFLICT) {
            log.warn("Concurrent modification rejected: {}", ex.getDetails());
        } else {
            log.debug("Casework request rejected: {} {}", ex.getKind(), ex.getCode());
        }
        Map<String, Object> body = errorBody(ex.getKind().name(), ex.getCode(), ex.getMessage(), ex.getMessageAr());
        if (!ex.getDetails().isEmpty()) {
            body.put("details", ex.getDetails());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        log.debug("Unreadable request: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(CaseworkException.Kind.INVALID_INPUT.name(), "VALIDATION_ERROR", "Malformed request", "طلب غير صالح"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("INTERNAL", "INTERNAL_ERROR", "Internal server error", "خطأ في الخادم"));
    }

    static HttpStatus statusFor(CaseworkException.Kind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case CONFLICT -> HttpStatus.CONFLICT;
            case INVALID_INPUT, INVALID_STATE, INVALID_STAGE -> HttpStatus.BAD_REQUEST;
        };
    }

    private static Map<String, Object> errorBody(String kind, String code, String message, String messageAr) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", true);
        body.put("kind", kind);
        body.put("code", code);
        body.put("message", message);
        body.put("messageAr", messageAr);
        body.put("correlationId", CorrelationIdFilter.currentCorrelationId());
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
