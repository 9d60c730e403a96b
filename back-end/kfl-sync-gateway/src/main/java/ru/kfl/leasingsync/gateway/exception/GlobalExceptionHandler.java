package ru.kfl.leasingsync.gateway.exception;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import ru.kfl.leasingsync.shared.dto.ErrorResponse;
import ru.kfl.leasingsync.shared.error.SyncErrorKind;
import ru.kfl.leasingsync.shared.error.SyncException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SyncException.class)
    public ResponseEntity<ErrorResponse> handleSyncException(SyncException ex, HttpServletRequest request) {
        SyncErrorKind kind = ex.getKind();
        if (kind == SyncErrorKind.STORE_UNAVAILABLE) {
            log.error("{} on {}: {}", kind, request.getRequestURI(), ex.getMessage());
        } else {
            log.warn("{} on {}: {}", kind, request.getRequestURI(), ex.getMessage());
        }
        return respond(kind, ex.getMessage(), kind.httpStatus(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                              HttpServletRequest request) {
        log.warn("Malformed body on {}: {}", request.getRequestURI(), ex.getMostSpecificCause().getMessage());
        SyncErrorKind kind = SyncErrorKind.VALIDATION_FAILED;
        return respond(kind, "malformed JSON body", kind.httpStatus(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                            HttpServletRequest request) {
        SyncErrorKind kind = SyncErrorKind.VALIDATION_FAILED;
        return respond(kind, ex.getName() + " has an invalid value", kind.httpStatus(), request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex,
                                                                HttpServletRequest request) {
        return respond(null, "Method not allowed", HttpStatus.METHOD_NOT_ALLOWED.value(), request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException ex,
                                                         HttpServletRequest request) {
        return respond(null, "Content-Type must be application/json",
                HttpStatus.UNSUPPORTED_MEDIA_TYPE.value(), request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex, HttpServletRequest request) {
        return respond(null, "No such endpoint", HttpStatus.NOT_FOUND.value(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("An unexpected error occurred at path {}:", request.getRequestURI(), ex);
        return respond(null, "An unexpected error occurred. Please try again later.",
                HttpStatus.INTERNAL_SERVER_ERROR.value(), request);
    }

    private static ResponseEntity<ErrorResponse> respond(SyncErrorKind kind, String detail, int status,
                                                         HttpServletRequest request) {
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(kind, detail, status, request.getRequestURI()));
    }
}
