package com.msp.forecast.web;

import com.msp.forecast.forecast.InsufficientDataException;
import com.msp.forecast.forecast.ModelUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Maps failures to RFC 7807 problem responses.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    private static final String TYPE_BASE = "urn:msp-forecast:problem:";

    private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
            HttpStatus.BAD_REQUEST, "invalid-parameter",
            HttpStatus.NOT_FOUND, "not-found",
            HttpStatus.UNPROCESSABLE_ENTITY, "insufficient-data",
            HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
    );

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<ProblemDetail> handleInsufficientData(InsufficientDataException ex,
                                                                HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.UNPROCESSABLE_ENTITY, ex, request);
        response.getBody().setProperty("seriesKey", ex.getSeriesKey());
        response.getBody().setProperty("available", ex.getAvailable());
        response.getBody().setProperty("required", ex.getRequired());
        return response;
    }

    @ExceptionHandler(ModelUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleModelUnavailable(ModelUnavailableException ex,
                                                                HttpServletRequest request) {
        ResponseEntity<ProblemDetail> response = buildProblem(HttpStatus.NOT_FOUND, ex, request);
        response.getBody().setProperty("seriesKey", ex.getSeriesKey());
        return response;
    }

    @ExceptionHandler({NoSuchElementException.class, NoResourceFoundException.class})
    public ResponseEntity<ProblemDetail> handleNotFound(Exception ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.NOT_FOUND, ex, request);
    }

    @ExceptionHandler({IllegalArgumentException.class, ConstraintViolationException.class,
            HandlerMethodValidationException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
        return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    }

    private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex, HttpServletRequest request) {
        logException(status, ex, request);
        ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        detail.setTitle(status.getReasonPhrase());
        detail.setInstance(URI.create(request.getRequestURI()));
        detail.setType(URI.create(TYPE_BASE + TYPE_SLUGS.getOrDefault(status, "internal-error")));
        return ResponseEntity.status(status).body(detail);
    }

    private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
        String message = ex.getMessage() == null || ex.getMessage().isBlank() ? ex.getClass().getName() : ex.getMessage();
        if (status.is5xxServerError()) {
            log.error("Request {} {} failed with status {}: {}",
                    request.getMethod(), request.getRequestURI(), status.value(), message, ex);
        } else {
            log.warn("Request {} {} returned status {}: {}",
                    request.getMethod(), request.getRequestURI(), status.value(), message);
        }
    }
}
