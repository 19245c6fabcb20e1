package com.jz.hive.exception;

import com.jz.hive.common.Result;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public Result<Void> handleValidation(ValidationException ex, HttpServletResponse resp) {
        resp.setStatus(400);
        log.debug("validation failed: {}", ex.getMessage());
        return Result.fail(400, ex.getMessage());
    }

    @ExceptionHandler(ConversationAccessException.class)
    public Result<Void> handleAccess(ConversationAccessException ex, HttpServletResponse resp) {
        resp.setStatus(ex.getCode());
        log.warn("conversation access denied: {}", ex.getMessage());
        return Result.fail(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(SendFailedException.class)
    public Result<Void> handleSendFailed(SendFailedException ex, HttpServletResponse resp) {
        resp.setStatus(503);
        log.error("send failed: {}", ex.getMessage(), ex);
        return Result.fail(503, ex.getMessage());
    }

    // 缺少会话里的 UID：没登录
    @ExceptionHandler(ServletRequestBindingException.class)
    public Result<Void> handleUnauthenticated(ServletRequestBindingException ex, HttpServletResponse resp) {
        resp.setStatus(401);
        return Result.fail(401, "User not authenticated");
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public Result<Void> handleBadRequest(Exception ex, HttpServletResponse resp) {
        resp.setStatus(400);
        return Result.fail(400, "Malformed request.");
    }

    @ExceptionHandler(Exception.class)
    public Result<Void> handleGeneric(Exception ex, HttpServletRequest req, HttpServletResponse resp) {
        resp.setStatus(500);
        log.error("An unexpected error occurred at path {}:", req.getRequestURI(), ex);
        return Result.error("An unexpected error occurred. Please try again later.");
    }
}
