package com.wildvision.observations.exception;

import com.wildvision.observations.dto.ObservationDto.StatusMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ObservationValidationException.class)
    public ResponseEntity<StatusMessage> handleValidation(ObservationValidationException e) {
        log.warn("Rejected observation: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<StatusMessage> handleUnauthorized(UnauthorizedException e) {
        return error(HttpStatus.UNAUTHORIZED, e.getMessage());
    }

    @ExceptionHandler(ObservationNotFoundException.class)
    public ResponseEntity<StatusMessage> handleNotFound(ObservationNotFoundException e) {
        log.debug("No observation with id {}", e.getObservationId());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(InvalidObservationIdException.class)
    public ResponseEntity<StatusMessage> handleInvalidId(InvalidObservationIdException e) {
        log.warn("Malformed observation id: {}", e.getObservationId());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    // The cause was already logged where the store call failed.
    @ExceptionHandler(ObservationStoreException.class)
    public ResponseEntity<StatusMessage> handleStore(ObservationStoreException e) {
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<StatusMessage> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid JSON payload");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<StatusMessage> handleMediaType(HttpMediaTypeNotSupportedException e) {
        return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported media type");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<StatusMessage> handleMethod(HttpRequestMethodNotSupportedException e) {
        return error(HttpStatus.METHOD_NOT_ALLOWED, "Method not allowed");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<StatusMessage> handleNoResource(NoResourceFoundException e) {
        return error(HttpStatus.NOT_FOUND, "Not found");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<StatusMessage> handleGenericException(Exception e) {
        log.error("Unhandled exception: ", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<StatusMessage> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(StatusMessage.error(message));
    }
}
