package com.len.songqueue.api.advice;

import com.len.songqueue.common.exception.BusinessException;
import com.len.songqueue.common.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusiness(BusinessException e, HttpServletRequest req) {
        ErrorCode ec = e.getErrorCode();
        if (ec == ErrorCode.STORAGE_ERROR) {
            log.error("[{}] {} {}", ec.getCode(), req.getMethod(), req.getRequestURI(), e);
        } else {
            log.warn("[{}] {} {} - {}", ec.getCode(), req.getMethod(), req.getRequestURI(), e.getMessage());
        }
        return respond(ec, e.getMessage(), req);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e, HttpServletRequest req) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .reduce((a, b) -> a + ", " + b)
                .orElse(ErrorCode.INVALID_REQUEST.getMessage());
        log.warn("[INVALID_REQUEST] {} {} - {}", req.getMethod(), req.getRequestURI(), message);
        return respond(ErrorCode.INVALID_REQUEST, message, req);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingRequestHeaderException.class
    })
    public ResponseEntity<ErrorResponse> handleBadInput(Exception e, HttpServletRequest req) {
        log.warn("[INVALID_REQUEST] {} {} - {}", req.getMethod(), req.getRequestURI(), e.getMessage());
        return respond(ErrorCode.INVALID_REQUEST, null, req);
    }

    // DB/Redis 장애. 부분 반영 없이 롤백된 상태이므로 재시도 가능
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException e, HttpServletRequest req) {
        log.error("[STORAGE_ERROR] {} {}", req.getMethod(), req.getRequestURI(), e);
        return respond(ErrorCode.STORAGE_ERROR, null, req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAny(Exception e, HttpServletRequest req) {
        log.error("[INTERNAL_ERROR] {} {}", req.getMethod(), req.getRequestURI(), e);
        return respond(ErrorCode.INTERNAL_ERROR, null, req);
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode ec, String message, HttpServletRequest req) {
        return ResponseEntity
                .status(ec.getHttpStatus())
                .body(ErrorResponse.of(ec, message, req.getRequestURI()));
    }
}
