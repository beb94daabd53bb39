package ch.tictactoe.tictactoebackend.web.api.controller;

import ch.tictactoe.tictactoebackend.domain.exception.DuplicatePlayerNameException;
import ch.tictactoe.tictactoebackend.domain.exception.MoveRejectedException;
import ch.tictactoe.tictactoebackend.web.api.dto.ErrorResponseDto;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

/**
 * Maps domain and request errors to HTTP responses with an {@link ErrorResponseDto} body.
 *
 * <ul>
 *   <li>{@link MoveRejectedException}: 400, error kind from the rejection reason</li>
 *   <li>{@link DuplicatePlayerNameException}: 400 {@code DuplicateName}</li>
 *   <li>{@link EntityNotFoundException}: 404 {@code NotFound}</li>
 *   <li>invalid or unreadable request bodies and parameters: 400 {@code ValidationError}</li>
 * </ul>
 * Anything else (e.g. database failures) is left to the default 500 handling.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(MoveRejectedException.class)
    public ResponseEntity<ErrorResponseDto> moveRejected(MoveRejectedException e) {
        log.warn("Move rejected ({}): {}", e.getReason().code(), e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getReason().code(), e.getMessage());
    }

    @ExceptionHandler(DuplicatePlayerNameException.class)
    public ResponseEntity<ErrorResponseDto> duplicateName(DuplicatePlayerNameException e) {
        log.warn(e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "DuplicateName", e.getMessage());
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponseDto> notFound(EntityNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "NotFound", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> invalidBody(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, "ValidationError", detail);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponseDto> unreadableRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "ValidationError", "Malformed request");
    }

    private static ResponseEntity<ErrorResponseDto> error(HttpStatus status, String kind, String detail) {
        return ResponseEntity.status(status).body(new ErrorResponseDto(kind, detail));
    }
}
