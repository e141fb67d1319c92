package com.fishcards.web.controller;

import com.fishcards.common.dto.ApiResponse;
import com.fishcards.common.exception.AiApiException;
import com.fishcards.common.exception.FishcardsException;
import com.fishcards.common.exception.GenerationException;
import com.fishcards.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 全局异常处理器。
 * <p>
 * 生成流水线的三类错误按 {@link GenerationException#kind()} 分派，状态码取自异常本身，
 * 调用方据此区分 429 限流、502 上游故障、500 内部配置错误和本地持久化失败。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<ApiResponse<Object>> handleGenerationException(GenerationException e) {
        Object details = switch (e.kind()) {
            case VALIDATION -> {
                log.warn("参数校验失败: {}", e.getMessage());
                yield ((ValidationException) e).getIssues();
            }
            case AI_API -> {
                log.warn("AI 调用失败: [{}] {} {}", e.getErrorCode(), e.getStatus(), e.getMessage());
                yield publicDetails((AiApiException) e);
            }
            case PERSISTENCE -> {
                log.error("持久化失败: {}", e.getMessage(), e);
                yield null;
            }
        };
        return ResponseEntity.status(e.getStatus())
                .body(ApiResponse.error(e.getErrorCode(), e.getMessage(), details));
    }

    @ExceptionHandler(UnauthorizedException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public ApiResponse<Void> handleUnauthorized(UnauthorizedException e) {
        return ApiResponse.error(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(FishcardsException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiResponse<Void> handleFishcardsException(FishcardsException e) {
        log.error("业务异常: [{}] {}", e.getErrorCode(), e.getMessage(), e);
        return ApiResponse.error(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ApiResponse<Void> handleBadRequest(Exception e) {
        log.debug("请求格式错误: {}", e.getMessage());
        return ApiResponse.error(ValidationException.CODE, "请求格式错误");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ApiResponse<Void> handleNoResourceFound(NoResourceFoundException e) {
        log.debug("资源未找到: {}", e.getResourcePath());
        return ApiResponse.error("NOT_FOUND", "资源不存在");
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ApiResponse<Void> handleGenericException(Exception e) {
        log.error("系统异常", e);
        return ApiResponse.error(AiApiException.CODE_INTERNAL_ERROR, "系统内部错误，请稍后重试");
    }

    /**
     * 上游响应体只用于排查，不返回给调用方。
     */
    static Map<String, Object> publicDetails(AiApiException e) {
        Map<String, Object> details = new LinkedHashMap<>(e.getDetails());
        details.remove("upstreamBody");
        details.remove("contentPreview");
        return details;
    }
}
