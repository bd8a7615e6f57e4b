package com.liftrx.config;

import com.liftrx.common.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 全局异常处理器
 * 请求问题返回 400，动作库/训练记录读取失败与其他异常返回 500
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 请求参数校验失败（返回400）
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public Result<Object> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("处方请求校验失败: {}", message);
        return Result.error(400, message);
    }

    /**
     * 请求体无法解析（返回400）
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public Result<Object> handleNotReadableException(HttpMessageNotReadableException e) {
        log.warn("处方请求体格式错误: {}", e.getMessage());
        return Result.error(400, "请求体格式错误");
    }

    /**
     * 场地/目标/水平编码非法（返回400）
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public Result<Object> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("处方请求参数非法: {}", e.getMessage());
        return Result.error(400, e.getMessage());
    }

    /**
     * 配置或状态不允许继续（返回400）
     */
    @ExceptionHandler(IllegalStateException.class)
    public Result<Object> handleIllegalStateException(IllegalStateException e) {
        log.warn("处方生成被拒绝: {}", e.getMessage());
        return Result.error(400, e.getMessage());
    }

    /**
     * 动作库或训练记录读取失败，不重试、不返回部分结果
     */
    @ExceptionHandler(DataAccessException.class)
    public Result<Object> handleDataAccessException(DataAccessException e) {
        log.error("数据访问失败，处方未生成", e);
        return Result.error("数据访问失败，请稍后重试");
    }

    @ExceptionHandler(RuntimeException.class)
    public Result<Object> handleRuntimeException(RuntimeException e) {
        log.error("处方生成运行时异常", e);
        return Result.error(e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Result<Object> handleException(Exception e) {
        log.error("系统异常", e);
        return Result.error("系统异常，请稍后重试");
    }
}
