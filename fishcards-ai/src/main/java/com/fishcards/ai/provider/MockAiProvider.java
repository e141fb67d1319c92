package com.fishcards.ai.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fishcards.common.exception.AiApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 离线生成器（fishcards.ai.provider=mock）。
 * <p>
 * 把源文本按约 300 字符切块，尽量在句末（. ! ?）处断开，其次在空格处；
 * 每块前 30%（最多 100 字符）作正面，其余作背面。输出与真实模型同样的 JSON，
 * 之后走同一套规整与落库流程。不需要 API Key，不发网络请求。
 */
@Slf4j
@Component
public class MockAiProvider implements AiProvider {

    static final int CHUNK_SIZE = 300;
    static final int MIN_CHUNK_SIZE = 100;
    static final int MAX_CARDS = 50;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public AiCompletion generate(AiGenerationRequest request) {
        long startNanos = System.nanoTime();
        List<String[]> cards = buildCards(request.getSourceText());

        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode flashcards = root.putArray("flashcards");
        for (String[] card : cards) {
            ObjectNode node = flashcards.addObject();
            node.put("front", card[0]);
            node.put("back", card[1]);
        }

        String content;
        try {
            content = objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new AiApiException("本地生成序列化失败", 502, Map.of(), e);
        }
        long duration = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        log.info("[mock] 本地生成 {} 张闪卡, 耗时 {}ms", cards.size(), duration);

        return AiCompletion.builder()
                .content(content)
                .durationMs(duration)
                .build();
    }

    /**
     * 切块并生成 (front, back) 对，至少一张、至多 50 张。
     */
    List<String[]> buildCards(String sourceText) {
        List<String> chunks = splitChunks(sourceText);
        List<String[]> cards = new ArrayList<>();

        for (int i = 0; i < chunks.size() && cards.size() < MAX_CARDS; i++) {
            String chunk = chunks.get(i);
            int frontLength = Math.min(MIN_CHUNK_SIZE, (int) Math.floor(chunk.length() * 0.3));
            String front = chunk.substring(0, frontLength).strip();
            String back = chunk.substring(frontLength).strip();
            cards.add(new String[]{
                    front.isEmpty() ? "Fragment " + (i + 1) : front,
                    back.isEmpty() ? chunk : back
            });
        }

        if (cards.isEmpty()) {
            String back = sourceText.length() > 500 ? sourceText.substring(0, 500) : sourceText;
            cards.add(new String[]{"Tekst źródłowy", back});
        }
        return cards;
    }

    List<String> splitChunks(String text) {
        List<String> chunks = new ArrayList<>();
        int current = 0;

        while (current < text.length()) {
            int remaining = text.length() - current;
            if (remaining <= MIN_CHUNK_SIZE) {
                String last = text.substring(current).strip();
                if (!last.isEmpty()) {
                    chunks.add(last);
                }
                break;
            }

            int chunkEnd = Math.min(current + CHUNK_SIZE, text.length());
            String chunk = text.substring(current, chunkEnd);

            if (chunkEnd < text.length()) {
                int lastBreak = Math.max(chunk.lastIndexOf('.'),
                        Math.max(chunk.lastIndexOf('!'), chunk.lastIndexOf('?')));
                if (lastBreak > MIN_CHUNK_SIZE) {
                    chunk = text.substring(current, current + lastBreak + 1);
                    current += lastBreak + 1;
                } else {
                    int lastSpace = chunk.lastIndexOf(' ');
                    if (lastSpace > MIN_CHUNK_SIZE) {
                        chunk = text.substring(current, current + lastSpace);
                        current += lastSpace + 1;
                    } else {
                        current = chunkEnd;
                    }
                }
            } else {
                current = chunkEnd;
            }

            String trimmed = chunk.strip();
            if (trimmed.length() >= MIN_CHUNK_SIZE) {
                chunks.add(trimmed);
            }
        }
        return chunks;
    }

    @Override
    public String getProviderName() {
        return "mock";
    }
}
