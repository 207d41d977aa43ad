package com.tony.betCalibration.controller;

import com.tony.betCalibration.exception.*;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Traduit les exceptions métier en réponses JSON : 400 (données invalides), 404 (calibrateur absent), 500 sinon.
 */
@Slf4j
@RestControllerAdvice
public class ApiErrorHandler {

    @ExceptionHandler({
            InsufficientDataException.class,
            ShapeMismatchException.class,
            IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentNotValidException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e, HttpServletRequest req) {
        log.warn("400 sur {} : {}", path(req), e.toString());
        return build(HttpStatus.BAD_REQUEST, e, req);
    }

    @ExceptionHandler(CalibratorNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(CalibratorNotFoundException e, HttpServletRequest req) {
        log.warn("404 sur {} : {}", path(req), e.getMessage());
        return build(HttpStatus.NOT_FOUND, e, req);
    }

    @ExceptionHandler({CalibratorPersistenceException.class, CalibrationFailedException.class})
    public ResponseEntity<Map<String, Object>> handleCalibrationError(RuntimeException e, HttpServletRequest req) {
        log.error("❌ 500 sur {} : {}", path(req), e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e, req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handle(Exception e, HttpServletRequest req) {
        log.error("❌ Erreur inattendue sur {}", path(req), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e, req);
    }

    private ResponseEntity<Map<String, Object>> build(HttpStatus status, Exception e, HttpServletRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", e.getClass().getSimpleName());
        body.put("message", message(e));
        body.put("path", path(req));
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }

    private static String message(Throwable e) {
        String m = e.getMessage();
        return m != null && !m.isBlank() ? m : e.getClass().getSimpleName();
    }

    private static String path(HttpServletRequest req) {
        return req != null ? req.getRequestURI() : "/";
    }
}
