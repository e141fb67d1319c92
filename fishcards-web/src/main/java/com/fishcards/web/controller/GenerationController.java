package com.fishcards.web.controller;

import com.fishcards.ai.service.FlashcardGenerationService;
import com.fishcards.common.dto.ApiResponse;
import com.fishcards.common.dto.ErrorLogEntry;
import com.fishcards.common.dto.GenerationRecord;
import com.fishcards.common.dto.GenerationResponse;
import com.fishcards.common.dto.PageResult;
import com.fishcards.web.dto.CreateGenerationRequest;
import com.fishcards.web.service.GenerationQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 闪卡生成 REST API。
 * <p>
 * 用户身份由上游网关通过 {@code X-User-Id} 头传入，这里不做认证。
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class GenerationController {

    static final String USER_HEADER = "X-User-Id";

    private final FlashcardGenerationService generationService;
    private final GenerationQueryService queryService;

    /**
     * 根据源文本生成闪卡候选，同时记录一次生成。
     */
    @PostMapping("/generations")
    public ApiResponse<GenerationResponse> createGeneration(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestBody CreateGenerationRequest request) {
        String user = requireUser(userId);
        log.info("收到生成请求: 源文本 {} 字符",
                request.getSourceText() != null ? request.getSourceText().length() : 0);
        return ApiResponse.ok(generationService.createGeneration(user, request.getSourceText()));
    }

    @GetMapping("/generations")
    public ApiResponse<PageResult<GenerationRecord>> listGenerations(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(defaultValue = "created_at") String sort,
            @RequestParam(defaultValue = "desc") String order) {
        return ApiResponse.ok(queryService.getGenerations(requireUser(userId), page, limit, sort, order));
    }

    @GetMapping("/generations/{id}")
    public ResponseEntity<ApiResponse<GenerationRecord>> getGeneration(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @PathVariable Long id) {
        return queryService.getGeneration(requireUser(userId), id)
                .map(record -> ResponseEntity.ok(ApiResponse.ok(record)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(ApiResponse.<GenerationRecord>error("NOT_FOUND", "生成记录不存在: " + id)));
    }

    @GetMapping("/generation-error-logs")
    public ApiResponse<PageResult<ErrorLogEntry>> listErrorLogs(
            @RequestHeader(value = USER_HEADER, required = false) String userId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit) {
        return ApiResponse.ok(queryService.getErrorLogs(requireUser(userId), page, limit));
    }

    private static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new UnauthorizedException("缺少用户身份 (" + USER_HEADER + ")");
        }
        return userId.strip();
    }
}
