package com.storefront.authservice.exception;

import com.storefront.authservice.utils.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.io.IOException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final String PROBLEMS = "https://storefront.dev/problems/";

    private final ErrorResponseWriter writer;

    // ---------- Custom domain / API exceptions ----------

    @ExceptionHandler(ApiException.class)
    public void handleApiException(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull ApiException ex) throws IOException {
        if (ex instanceof AuthExceptions.PersistenceUnavailable) {
            log.error("Persistence unavailable on {}: {}", req.getRequestURI(), ex.getCause() != null
                    ? ex.getCause().toString() : ex.getMessage());
        } else {
            log.debug("ApiException: status={}, code={}, title={}, detail={}",
                    ex.getStatus(), ex.code(), ex.getTitle(), ex.getMessage());
        }
        writer.write(req, resp, ex);
    }

    // ---------- Validation & request-shape errors ----------

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public void handleMethodArgumentNotValid(@NonNull HttpServletRequest req,
                                             @NonNull HttpServletResponse resp,
                                             @NonNull MethodArgumentNotValidException ex) throws IOException {
        var fieldDetails = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + (fe.getDefaultMessage() != null ? fe.getDefaultMessage() : "invalid"));
        var globalDetails = ex.getBindingResult().getGlobalErrors().stream()
                .map(ge -> ge.getDefaultMessage() != null ? ge.getDefaultMessage() : "invalid");
        var details = Stream.concat(fieldDetails, globalDetails)
                .limit(5) // keep payload small
                .collect(Collectors.joining("; "));
        writer.write(req, resp, HttpStatus.UNPROCESSABLE_ENTITY,
                PROBLEMS + "validation-error",
                "Validation Error",
                details.isBlank() ? "Request validation failed." : details);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public void handleConstraintViolation(@NonNull HttpServletRequest req,
                                          @NonNull HttpServletResponse resp,
                                          @NonNull ConstraintViolationException ex) throws IOException {
        var details = ex.getConstraintViolations().stream()
                .limit(5)
                .map(cv -> cv.getPropertyPath() + ": " + cv.getMessage())
                .collect(Collectors.joining("; "));
        writer.write(req, resp, HttpStatus.UNPROCESSABLE_ENTITY,
                PROBLEMS + "validation-error",
                "Validation Error",
                details.isBlank() ? "Request validation failed." : details);
    }

    @ExceptionHandler({ MissingServletRequestParameterException.class, HttpMessageNotReadableException.class })
    public void handleBadRequest(@NonNull HttpServletRequest req,
                                 @NonNull HttpServletResponse resp,
                                 @NonNull Exception ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST,
                PROBLEMS + "bad-request",
                "Bad Request",
                "Malformed or missing request parameters.");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public void handleTypeMismatch(@NonNull HttpServletRequest req,
                                   @NonNull HttpServletResponse resp,
                                   @NonNull MethodArgumentTypeMismatchException ex) throws IOException {
        writer.write(req, resp, HttpStatus.BAD_REQUEST,
                PROBLEMS + "type-mismatch",
                "Type Mismatch",
                "Parameter '" + ex.getName() + "' has invalid type.");
    }

    // ---------- HTTP mapping errors (JSON, not HTML) ----------

    @ExceptionHandler({ NoHandlerFoundException.class, NoResourceFoundException.class })
    public void handleNoHandler(@NonNull HttpServletRequest req,
                                @NonNull HttpServletResponse resp,
                                @NonNull Exception ex) throws IOException {
        writer.write(req, resp, HttpStatus.NOT_FOUND,
                PROBLEMS + "not-found",
                "Not Found",
                "No handler for " + req.getRequestURI());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public void handleMethodNotAllowed(@NonNull HttpServletRequest req,
                                       @NonNull HttpServletResponse resp,
                                       @NonNull HttpRequestMethodNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.METHOD_NOT_ALLOWED,
                PROBLEMS + "method-not-allowed",
                "Method Not Allowed",
                "HTTP method not supported for this endpoint.");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public void handleUnsupportedMediaType(@NonNull HttpServletRequest req,
                                           @NonNull HttpServletResponse resp,
                                           @NonNull HttpMediaTypeNotSupportedException ex) throws IOException {
        writer.write(req, resp, HttpStatus.UNSUPPORTED_MEDIA_TYPE,
                PROBLEMS + "unsupported-media-type",
                "Unsupported Media Type",
                "Content type is not supported.");
    }

    // ---------- Data layer ----------

    @ExceptionHandler(DataIntegrityViolationException.class)
    public void handleDataIntegrity(@NonNull HttpServletRequest req,
                                    @NonNull HttpServletResponse resp,
                                    @NonNull DataIntegrityViolationException ex) throws IOException {
        log.debug("DataIntegrityViolation: {}", ex.getMostSpecificCause().getMessage());
        writer.write(req, resp, HttpStatus.CONFLICT,
                PROBLEMS + "conflict",
                "Conflict",
                "A conflicting resource already exists or violates a constraint.");
    }

    @ExceptionHandler({ DataAccessResourceFailureException.class, CannotCreateTransactionException.class })
    public void handleDataUnavailable(@NonNull HttpServletRequest req,
                                      @NonNull HttpServletResponse resp,
                                      @NonNull Exception ex) throws IOException {
        writer.write(req, resp,
                new AuthExceptions.PersistenceUnavailable("Storage is temporarily unavailable.", ex));
    }

    // ---------- Fallback 500 ----------

    @ExceptionHandler(Exception.class)
    public void handleGeneric(@NonNull HttpServletRequest req,
                              @NonNull HttpServletResponse resp,
                              @NonNull Exception ex) throws IOException {
        // Log full for ops; respond generic to the client
        log.error("Unhandled exception", ex);
        writer.write(req, resp, HttpStatus.INTERNAL_SERVER_ERROR,
                PROBLEMS + "internal-error",
                "Internal Server Error",
                "An unexpected error occurred.");
    }
}
