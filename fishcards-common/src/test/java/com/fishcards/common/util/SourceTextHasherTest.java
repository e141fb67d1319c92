package com.fishcards.common.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceTextHasherTest {

    @Test
    @DisplayName("已知向量：空串与 abc")
    void knownVectors() {
        assertThat(SourceTextHasher.sha256Hex(""))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
        assertThat(SourceTextHasher.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("按 UTF-8 字节计算，非 ASCII 文本同样稳定")
    void hashesUtf8Bytes() {
        String polish = "Zażółć gęślą jaźń";
        String first = SourceTextHasher.sha256Hex(polish);

        assertThat(first).hasSize(64).matches("[0-9a-f]{64}");
        assertThat(SourceTextHasher.sha256Hex(polish)).isEqualTo(first);
    }

    @Test
    void distinctInputsProduceDistinctHashes() {
        List<String> corpus = List.of("a", "b", "ab", "ba", "a ", " a", "A", "fiszka", "fiszki", "x".repeat(1000));
        Set<String> hashes = new HashSet<>();
        corpus.forEach(s -> hashes.add(SourceTextHasher.sha256Hex(s)));

        assertThat(hashes).hasSize(corpus.size());
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> SourceTextHasher.sha256Hex(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
