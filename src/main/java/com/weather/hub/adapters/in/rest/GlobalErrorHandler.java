package com.weather.hub.adapters.in.rest;

import java.time.Instant;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.weather.hub.domain.exception.ForecastUnavailableException;
import com.weather.hub.domain.exception.SimulatedFailureException;
import com.weather.hub.domain.exception.ZoneNotFoundException;

/**
 * Maps exceptions to RFC 7807 problem details.
 * <p>
 * Every body carries a {@code requestId} that also appears in the log line,
 * so a client report can be matched to the server log.
 * </p>
 */
@RestControllerAdvice
public class GlobalErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleBadRequest(IllegalArgumentException ex) {
        String requestId = UUID.randomUUID().toString();
        log.warn("action=bad_request requestId={} error={}", requestId, ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), requestId);
    }

    @ExceptionHandler(ZoneNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleZoneNotFound(ZoneNotFoundException ex) {
        String requestId = UUID.randomUUID().toString();
        log.warn("action=zone_not_found requestId={} zoneId={}", requestId, ex.getZoneId());
        return problem(HttpStatus.NOT_FOUND, "Zone Not Found", ex.getMessage(), requestId);
    }

    @ExceptionHandler(ForecastUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleUpstream(ForecastUnavailableException ex) {
        String requestId = UUID.randomUUID().toString();
        log.error("action=forecast_unavailable requestId={} zoneId={} error={}",
                requestId, ex.getZoneId(), ex.getMessage(), ex);
        return problem(HttpStatus.BAD_GATEWAY, "Forecast Unavailable",
                "The upstream weather service did not return a forecast.", requestId);
    }

    @ExceptionHandler(SimulatedFailureException.class)
    public ResponseEntity<ProblemDetail> handleSimulated(SimulatedFailureException ex) {
        String requestId = UUID.randomUUID().toString();
        log.error("action=simulated_failure requestId={} call={}", requestId, ex.getCallNumber(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", ex.getMessage(), requestId);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericError(Exception ex) {
        String requestId = UUID.randomUUID().toString();

        // Framework exceptions (unknown path, wrong method) already know their status
        if (ex instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("action=request_rejected requestId={} status={} error={}",
                    requestId, status.value(), ex.getMessage());
            ProblemDetail body = errorResponse.getBody();
            body.setProperty("requestId", requestId);
            body.setProperty("timestamp", Instant.now().toString());
            return ResponseEntity.status(status).body(body);
        }

        log.error("action=internal_error requestId={} error={}", requestId, ex.getMessage(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", requestId);
    }

    private ResponseEntity<ProblemDetail> problem(HttpStatus status, String title, String detail, String requestId) {
        ProblemDetail body = ProblemDetail.forStatusAndDetail(status, detail);
        body.setTitle(title);
        body.setProperty("requestId", requestId);
        body.setProperty("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
