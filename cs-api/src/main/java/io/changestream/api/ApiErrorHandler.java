package io.changestream.api;

import io.changestream.core.ChangeLogException;
import io.changestream.core.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps the change log error taxonomy onto HTTP statuses. Bodies are always JSON, including for
 * failures raised on the event-stream endpoint.
 */
@RestControllerAdvice
public class ApiErrorHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiErrorHandler.class);

    static final String RETRY_AFTER_SECONDS = "5";

    public record ErrorBody(String kind, String message) {}

    @ExceptionHandler(ChangeLogException.class)
    public ResponseEntity<ErrorBody> changeLog(ChangeLogException e) {
        var status = status(e.kind());
        var response = ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON);
        if (e.kind().retryable()) {
            log.warn("Rejected request: {}", e.getMessage());
            response.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        } else {
            log.debug("Rejected request: {}", e.getMessage());
        }
        return response.body(new ErrorBody(e.kind().name(), e.getMessage()));
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            NullPointerException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorBody> badRequest(Exception e) {
        log.debug("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().contentType(MediaType.APPLICATION_JSON).body(new ErrorBody("BAD_REQUEST", e.getMessage()));
    }

    static HttpStatus status(ErrorKind kind) {
        return switch (kind) {
            case OUT_OF_RANGE -> HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case INVALID_RANGE -> HttpStatus.BAD_REQUEST;
            case CLOSED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
