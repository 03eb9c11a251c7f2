package com.vigil.healthservice.infrastructure.web;

import com.vigil.healthservice.api.UnknownHealthCheckException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler: maps exceptions to RFC 7807 ProblemDetail responses.
 *
 * <pre>
 * {
 *   "type": "https://vigil.dev/errors/not-found",
 *   "title": "Health Check Not Found",
 *   "status": 404,
 *   "detail": "unknown health check: 'postgres'",
 *   "timestamp": "2026-07-12T10:30:00Z",
 *   "checkId": "postgres"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create("https://vigil.dev/errors/bad-request"));
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(UnknownHealthCheckException.class)
    public ProblemDetail handleUnknownCheck(UnknownHealthCheckException ex) {
        log.debug("Unknown health check requested: {}", ex.checkId());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setTitle("Health Check Not Found");
        problem.setType(URI.create("https://vigil.dev/errors/not-found"));
        problem.setProperty("checkId", ex.checkId());
        enrich(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create("https://vigil.dev/errors/internal"));
        enrich(problem);
        return problem;
    }

    private void enrich(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
    }
}
