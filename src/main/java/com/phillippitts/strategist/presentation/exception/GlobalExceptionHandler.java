package com.phillippitts.strategist.presentation.exception;

import com.phillippitts.strategist.exception.AnalysisFailedException;
import com.phillippitts.strategist.exception.GatewayConfigurationException;
import com.phillippitts.strategist.exception.GatewayException;
import com.phillippitts.strategist.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Primary agent failed or overran its deadline (HTTP 502). Cause details stay in the log.
     */
    @ExceptionHandler(AnalysisFailedException.class)
    ResponseEntity<ApiError> handleAnalysisFailed(AnalysisFailedException ex) {
        LOG.error("Analysis failed: session={}", ex.getSessionId(), ex);
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Analysis could not be completed",
                "Please retry the analysis",
                Instant.now()
            ));
    }

    /**
     * Transient agent error - retry possible (HTTP 503).
     */
    @ExceptionHandler(GatewayException.class)
    ResponseEntity<ApiError> handleGatewayFailure(GatewayException ex) {
        LOG.error("Agent call failed: agent={}", ex.getAgentKind(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Agent service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Configuration error - fails startup, but if encountered at runtime return 503.
     */
    @ExceptionHandler(GatewayConfigurationException.class)
    ResponseEntity<ApiError> handleGatewayConfiguration(GatewayConfigurationException ex) {
        LOG.error("Gateway misconfigured: property={}", ex.getProperty());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Analysis service unavailable",
                "Service not configured. Contact administrator.",
                Instant.now()
            ));
    }

    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.warn("Unknown session: {}", ex.getSessionId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Session not found",
                "Create a session first",
                Instant.now()
            ));
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class,
            HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex instanceof IllegalArgumentException ? ex.getMessage() : "Request body or path is malformed",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
