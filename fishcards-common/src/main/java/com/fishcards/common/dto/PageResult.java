package com.fishcards.common.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 分页查询结果。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageResult<T> {

    private List<T> data;

    private Pagination pagination;

    public static <T> PageResult<T> of(List<T> data, int page, int limit, long total) {
        int totalPages = (int) Math.max(1, (total + limit - 1) / limit);
        return new PageResult<>(data, new Pagination(page, limit, total, totalPages));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pagination {
        private int page;
        private int limit;
        private long total;

        @JsonProperty("total_pages")
        private int totalPages;
    }
}
