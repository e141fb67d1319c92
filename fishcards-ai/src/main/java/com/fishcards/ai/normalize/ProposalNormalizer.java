package com.fishcards.ai.normalize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fishcards.ai.config.GenerationProperties;
import com.fishcards.common.dto.FlashcardProposal;
import com.fishcards.common.exception.AiApiException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 把模型返回的 content 字符串规整为候选闪卡列表。
 * <p>
 * 解析顺序：
 * <ol>
 *   <li>整段直接解析</li>
 *   <li>失败则截取第一个 '{' 到最后一个 '}' 再解析（记 WARN）</li>
 *   <li>仍失败抛 502，details 只带不超过 500 字符的预览</li>
 * </ol>
 * 顶层可以是裸数组，也可以是带 {@code flashcards} 数组的对象，其余形状视为没有候选。
 * 数量或长度越界直接失败，从不截断。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProposalNormalizer {

    static final int PREVIEW_LENGTH = 500;

    private final GenerationProperties properties;

    private final ObjectMapper strictMapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    public NormalizedProposals normalize(String content) {
        if (content == null) {
            throw new AiApiException("模型返回内容为空", 502);
        }

        ParsePath path = ParsePath.DIRECT;
        JsonNode root = tryParse(content);
        if (root == null) {
            root = tryParse(extractBraces(content));
            if (root == null) {
                throw new AiApiException("无法解析模型返回的 JSON", 502,
                        Map.of("contentPreview", preview(content)));
            }
            path = ParsePath.BRACE_EXTRACTION;
            log.warn("模型输出不是纯 JSON，已通过花括号截取解析成功 (原始长度 {} 字符)", content.length());
        }

        JsonNode candidates = candidatesOf(root);
        List<FlashcardProposal> proposals = new ArrayList<>();
        int dropped = 0;
        for (JsonNode item : candidates) {
            FlashcardProposal proposal = toProposal(item);
            if (proposal == null) {
                dropped++;
            } else {
                proposals.add(proposal);
            }
        }
        if (dropped > 0) {
            log.debug("丢弃 {} 条不合格候选", dropped);
        }

        validate(proposals, path);
        return NormalizedProposals.builder()
                .proposals(List.copyOf(proposals))
                .parsePath(path)
                .droppedCount(dropped)
                .build();
    }

    private JsonNode tryParse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return strictMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.debug("JSON 解析失败: {}", e.getOriginalMessage());
            return null;
        }
    }

    /** 第一个 '{' 到最后一个 '}'，找不到时返回 null */
    static String extractBraces(String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return content.substring(start, end + 1);
    }

    private JsonNode candidatesOf(JsonNode root) {
        if (root.isArray()) {
            return root;
        }
        JsonNode flashcards = root.path("flashcards");
        if (flashcards.isArray()) {
            return flashcards;
        }
        return strictMapper.createArrayNode();
    }

    private static FlashcardProposal toProposal(JsonNode item) {
        if (!item.isObject()) {
            return null;
        }
        JsonNode front = item.get("front");
        JsonNode back = item.get("back");
        if (front == null || back == null || !front.isTextual() || !back.isTextual()) {
            return null;
        }
        String f = front.asText().strip();
        String b = back.asText().strip();
        if (f.isEmpty() || b.isEmpty()) {
            return null;
        }
        return FlashcardProposal.ai(f, b);
    }

    private void validate(List<FlashcardProposal> proposals, ParsePath path) {
        List<String> issues = new ArrayList<>();
        if (proposals.isEmpty()) {
            issues.add("没有有效的闪卡候选");
        } else if (proposals.size() > properties.getMaxProposals()) {
            issues.add("候选数量 " + proposals.size() + " 超过上限 " + properties.getMaxProposals());
        }
        for (int i = 0; i < proposals.size(); i++) {
            FlashcardProposal p = proposals.get(i);
            if (p.getFront().length() > properties.getMaxFrontLength()) {
                issues.add("第 " + (i + 1) + " 张正面超过 " + properties.getMaxFrontLength() + " 字符");
            }
            if (p.getBack().length() > properties.getMaxBackLength()) {
                issues.add("第 " + (i + 1) + " 张背面超过 " + properties.getMaxBackLength() + " 字符");
            }
        }
        if (!issues.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("issues", List.copyOf(issues));
            details.put("parsePath", path.name());
            throw new AiApiException("模型返回的闪卡未通过校验: " + issues.get(0), 502, details);
        }
    }

    static String preview(String content) {
        return content.length() > PREVIEW_LENGTH ? content.substring(0, PREVIEW_LENGTH) : content;
    }
}
