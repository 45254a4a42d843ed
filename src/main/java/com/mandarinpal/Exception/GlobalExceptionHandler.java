package com.mandarinpal.Exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import top.continew.starter.core.exception.BusinessException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 全局异常处理器
 * 统一返回 {"code": 状态码, "error": 错误信息}
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 单元不存在
     */
    @ExceptionHandler(UnitNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleUnitNotFoundException(UnitNotFoundException e) {
        log.warn("单元不存在: {}", e.getUnitId());
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    /**
     * 文本生成失败，不返回半成品回复
     */
    @ExceptionHandler(TextGenerationException.class)
    public ResponseEntity<Map<String, Object>> handleTextGenerationException(TextGenerationException e) {
        log.warn("文本生成异常: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<Map<String, Object>> handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * 参数校验与绑定异常 (MethodArgumentNotValidException 是 BindException 的子类)
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(BindException e) {
        String message = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("参数校验异常: {}", message);
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("系统异常: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "系统异常,请稍后重试");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("code", status.value());
        body.put("error", message);
        return ResponseEntity.status(status).body(body);
    }
}
