package com.fishcards.common.dto;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PageResultTest {

    @Test
    void totalPagesRoundsUp() {
        PageResult<String> result = PageResult.of(List.of("a", "b"), 1, 10, 21);

        assertThat(result.getPagination().getTotalPages()).isEqualTo(3);
        assertThat(result.getPagination().getTotal()).isEqualTo(21);
    }

    @Test
    void emptyResultStillHasOnePage() {
        PageResult<String> result = PageResult.of(List.of(), 1, 10, 0);

        assertThat(result.getPagination().getTotalPages()).isEqualTo(1);
        assertThat(result.getData()).isEmpty();
    }
}
