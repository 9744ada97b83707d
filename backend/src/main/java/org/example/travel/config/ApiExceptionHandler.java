package org.example.travel.config;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.example.travel.exception.DestinationNotFoundException;
import org.example.travel.exception.InvalidInputException;
import org.example.travel.exception.UpstreamUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
            HttpStatus.BAD_REQUEST, "invalid-input",
            HttpStatus.NOT_FOUND, "not-found",
            HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
            HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type",
            HttpStatus.SERVICE_UNAVAILABLE, "upstream-unavailable",
            HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
    );

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ProblemDetail> handleInvalidInput(InvalidInputException ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.BAD_REQUEST, ex.getMessage(), ex, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        return buildProblem(HttpStatus.BAD_REQUEST, "Malformed or missing request body", ex, request);
    }

    @ExceptionHandler(DestinationNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(DestinationNotFoundException ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.NOT_FOUND, ex.getMessage(), ex, request);
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleUpstream(UpstreamUnavailableException ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), ex, request);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            NoResourceFoundException.class})
    public ResponseEntity<ProblemDetail> handleFramework(Exception ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.resolve(((ErrorResponse) ex).getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return buildProblem(status, ex.getMessage(), ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex, request);
    }

    private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, String message, Exception ex,
                                                       HttpServletRequest request) {
        logException(status, ex, request);
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
        detail.setTitle(status.getReasonPhrase());
        detail.setInstance(URI.create(request.getRequestURI()));
        detail.setType(URI.create("urn:travel-aggregator:problem:"
                + TYPE_SLUGS.getOrDefault(status, "internal-error")));
        detail.setProperty("path", request.getRequestURI());
        return ResponseEntity.status(status).body(detail);
    }

    private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getName();
        }
        if (status.is5xxServerError()) {
            log.error("Request {} {} failed with status {}: {}",
                    request.getMethod(), RequestLoggingFilter.uriWithQuery(request), status.value(), message, ex);
        } else {
            log.warn("Request {} {} returned status {}: {}",
                    request.getMethod(), RequestLoggingFilter.uriWithQuery(request), status.value(), message);
        }
    }
}
