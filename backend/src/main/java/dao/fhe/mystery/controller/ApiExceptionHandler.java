package dao.fhe.mystery.controller;

import dao.fhe.mystery.exception.ProtocolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ProtocolException.class)
    public ResponseEntity<Map<String, Object>> onProtocolException(ProtocolException e) {
        log.debug("Rejected: {} {}", e.getError(), e.getMessage());
        return ResponseEntity.status(e.getError().httpStatus()).body(body(e.getError().name(), e.getMessage()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, MissingRequestHeaderException.class,
            IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> onBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(body("BAD_REQUEST", e.getMessage()));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ERROR");
        response.put("error", error);
        response.put("message", message);
        return response;
    }
}
