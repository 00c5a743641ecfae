package com.groviate.feedbackrewards.controller;

import com.groviate.feedbackrewards.exception.FeedbackRewardsException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Глобальный обработчик исключений REST-контроллеров.
 * <p>
 * Доменные исключения отдаются с их кодом и статусом, ошибки валидации тела запроса - 400,
 * всё остальное - 500 без деталей.
 */
@RestControllerAdvice
@Slf4j
public class FeedbackRewardsExceptionHandler {

    static final String REQUEST_VALIDATION = "REQUEST_VALIDATION";
    static final String UNEXPECTED = "UNEXPECTED";

    @ExceptionHandler(FeedbackRewardsException.class)
    public ResponseEntity<Map<String, Object>> handleDomainException(FeedbackRewardsException ex,
                                                                     HttpServletRequest request) {
        if (ex.getStatus().is5xxServerError()) {
            log.error("Ошибка сервиса: code={}, status={}, path={}",
                    ex.getCode(), ex.getStatus(), request.getRequestURI(), ex);
        } else {
            log.warn("Запрос отклонён: code={}, status={}, path={}, message={}",
                    ex.getCode(), ex.getStatus(), request.getRequestURI(), ex.getMessage());
        }
        return ResponseEntity.status(ex.getStatus())
                .body(body(request, ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException ex,
                                                                 HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("Невалидное тело запроса: path={}, errors={}", request.getRequestURI(), message);
        return ResponseEntity.badRequest().body(body(request, REQUEST_VALIDATION, message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                                    HttpServletRequest request) {
        log.warn("Тело запроса не читается: path={}, cause={}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(request, REQUEST_VALIDATION, "Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex,
                                                                HttpServletRequest request) {
        log.error("Непредвиденная ошибка, по пути={}", request.getRequestURI(), ex);
        return ResponseEntity.internalServerError()
                .body(body(request, UNEXPECTED, "Unexpected server error"));
    }

    private Map<String, Object> body(HttpServletRequest request, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("path", request.getRequestURI());
        body.put("error", code);
        body.put("message", message);
        return body;
    }
}
