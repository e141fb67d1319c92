package com.fishcards.web.service;

import com.fishcards.common.dto.ErrorLogEntry;
import com.fishcards.common.dto.GenerationRecord;
import com.fishcards.common.dto.PageResult;
import com.fishcards.common.exception.ValidationException;
import com.fishcards.web.repository.GenerationErrorLogRepository;
import com.fishcards.web.repository.GenerationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 生成记录与错误日志的只读查询，按用户隔离。
 */
@Service
@RequiredArgsConstructor
public class GenerationQueryService {

    static final int MAX_LIMIT = 100;

    /** 对外排序字段 → 实体属性 */
    private static final Map<String, String> SORT_FIELDS = Map.of(
            "created_at", "createdAt",
            "updated_at", "updatedAt");

    private final GenerationRepository generationRepo;
    private final GenerationErrorLogRepository errorLogRepo;

    public PageResult<GenerationRecord> getGenerations(String userId, int page, int limit,
                                                       String sort, String order) {
        List<String> issues = pagingIssues(page, limit);
        String property = SORT_FIELDS.get(sort);
        if (property == null) {
            issues.add("sort 只能是 created_at 或 updated_at");
        }
        Sort.Direction direction = Sort.Direction.fromOptionalString(order).orElse(null);
        if (direction == null) {
            issues.add("order 只能是 asc 或 desc");
        }
        if (!issues.isEmpty()) {
            throw new ValidationException(String.join("; ", issues), issues);
        }

        PageRequest pageable = PageRequest.of(page - 1, limit, Sort.by(direction, property).and(Sort.by(direction, "id")));
        List<GenerationRecord> data = generationRepo.findByUserId(userId, pageable).stream()
                .map(JdbcGenerationStore::toRecord)
                .toList();
        return PageResult.of(data, page, limit, generationRepo.countByUserId(userId));
    }

    /**
     * 查询单条记录；不存在或属于其他用户都返回空。
     */
    public Optional<GenerationRecord> getGeneration(String userId, Long id) {
        return generationRepo.findByIdAndUserId(id, userId).map(JdbcGenerationStore::toRecord);
    }

    /**
     * 错误日志，最新的在前。
     */
    public PageResult<ErrorLogEntry> getErrorLogs(String userId, int page, int limit) {
        List<String> issues = pagingIssues(page, limit);
        if (!issues.isEmpty()) {
            throw new ValidationException(String.join("; ", issues), issues);
        }
        PageRequest pageable = PageRequest.of(page - 1, limit,
                Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "id")));
        List<ErrorLogEntry> data = errorLogRepo.findByUserId(userId, pageable).stream()
                .map(JdbcGenerationStore::toEntry)
                .toList();
        return PageResult.of(data, page, limit, errorLogRepo.countByUserId(userId));
    }

    private static List<String> pagingIssues(int page, int limit) {
        List<String> issues = new ArrayList<>();
        if (page < 1) {
            issues.add("page 必须大于等于 1");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            issues.add("limit 必须在 1 到 " + MAX_LIMIT + " 之间");
        }
        return issues;
    }
}
