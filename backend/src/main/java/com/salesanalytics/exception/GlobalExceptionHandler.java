package com.salesanalytics.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Global exception handler for REST API endpoints.
 *
 * Converts exceptions into RFC 7807 (Problem Details for HTTP APIs) responses.
 * Domain failures carry their stable {@link ErrorCode} in the {@code errorCode}
 * property; internal exception detail is never exposed.
 *
 * <p>RFC 7807 Response Format:
 * <pre>
 * {
 *   "type": "https://api.salesanalytics.com/errors/not-found",
 *   "title": "Call Not Found",
 *   "status": 404,
 *   "detail": "Call 'call-404' not found.",
 *   "instance": "/api/v1/calls/call-404/recommendations",
 *   "timestamp": "2024-02-26T10:30:00",
 *   "errorCode": "NOT_FOUND"
 * }
 * </pre>
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7807">RFC 7807 Specification</a>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String BASE_ERROR_URI = "https://api.salesanalytics.com/errors";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;

    /**
     * Handles every domain failure of the streaming and recommendation core.
     *
     * The HTTP status, title and type URI come from the exception's error code.
     *
     * @param ex the domain exception
     * @param request the web request context
     * @return RFC 7807 problem details
     */
    @ExceptionHandler(AnalyticsException.class)
    public ResponseEntity<ProblemDetail> handleAnalyticsException(
            AnalyticsException ex,
            WebRequest request
    ) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus().is5xxServerError()) {
            log.error("Request failed: code={}, message={}", errorCode, ex.getMessage(), ex);
        } else {
            log.warn("Request rejected: code={}, message={}", errorCode, ex.getMessage());
        }

        ProblemDetail problemDetail = createProblemDetail(
                errorCode.getHttpStatus(),
                errorCode.getTitle(),
                ex.getMessage(),
                request,
                errorCode.getTypeSlug()
        );
        problemDetail.setProperty("errorCode", errorCode.name());

        if (ex instanceof ProcessingException processing && processing.getProcessingStage() != null) {
            problemDetail.setProperty("processingStage", processing.getProcessingStage());
        }

        return ResponseEntity.status(errorCode.getHttpStatus()).body(problemDetail);
    }

    /**
     * Handles AccessDeniedException - role check failed on a method-secured endpoint.
     *
     * @param ex the AccessDeniedException
     * @param request the web request context
     * @return RFC 7807 problem details with 403 status
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDeniedException(
            AccessDeniedException ex,
            WebRequest request
    ) {
        log.warn("Access denied: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.FORBIDDEN,
                "Access Denied",
                "Your role does not allow access to this resource.",
                request,
                "access-denied"
        );

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problemDetail);
    }

    /**
     * Handles MethodArgumentTypeMismatchException - e.g. a non-numeric {@code k}.
     *
     * @param ex the MethodArgumentTypeMismatchException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex,
            WebRequest request
    ) {
        log.warn("Invalid request parameter '{}': {}", ex.getName(), ex.getValue());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                String.format("Parameter '%s' has an invalid value.", ex.getName()),
                request,
                "invalid-argument"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles IllegalArgumentException - illegal argument passed to a method.
     *
     * @param ex the IllegalArgumentException
     * @param request the web request context
     * @return RFC 7807 problem details with 400 status
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        log.warn("Invalid argument: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Argument",
                ex.getMessage(),
                request,
                "invalid-argument"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Fallback handler for all unhandled exceptions.
     *
     * Logs the full stack trace and returns a generic 500 error with an error id
     * that can be matched against the logs.
     *
     * @param ex the unhandled exception
     * @param request the web request context
     * @return RFC 7807 problem details with 500 status
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnhandledException(
            Exception ex,
            WebRequest request
    ) {
        String errorId = generateErrorId();
        log.error("Unexpected error occurred [{}]: {}", errorId, ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later or contact support if the issue persists.",
                request,
                "internal-error"
        );
        problemDetail.setProperty("errorId", errorId);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    private ProblemDetail createProblemDetail(
            HttpStatus status,
            String title,
            String detail,
            WebRequest request,
            String errorType
    ) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);

        problemDetail.setType(URI.create(String.format("%s/%s", BASE_ERROR_URI, errorType)));
        problemDetail.setTitle(title);

        // Instance is the request path where the error occurred
        String description = request.getDescription(false);
        if (description != null && description.startsWith("uri=")) {
            problemDetail.setInstance(URI.create(description.substring(4)));
        }

        problemDetail.setProperty("timestamp", LocalDateTime.now().format(TIMESTAMP_FORMATTER));

        return problemDetail;
    }

    private String generateErrorId() {
        return String.format("ERR-%d", System.currentTimeMillis());
    }
}
