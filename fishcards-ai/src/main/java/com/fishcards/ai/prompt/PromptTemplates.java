package com.fishcards.ai.prompt;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * 闪卡生成 Prompt 模板。
 * <p>
 * 提示词从 classpath 下的 {@code prompts/*.md} 加载，修改提示词只需编辑 .md 文件并重启。
 *
 * <pre>
 * resources/prompts/
 * ├── flashcard-system.md   — 系统指令，约束输出为 {"flashcards":[{"front","back"}]}
 * └── flashcard-user.md     — 用户消息，含 {sourceText} 占位符
 * </pre>
 */
@Slf4j
@Component
public class PromptTemplates {

    private static final String PROMPT_DIR = "prompts/";
    private static final String SOURCE_TEXT_PLACEHOLDER = "{sourceText}";

    private String systemInstruction;
    private String userTemplate;

    @PostConstruct
    void loadPrompts() {
        systemInstruction = loadPrompt("flashcard-system.md").trim();
        userTemplate = loadPrompt("flashcard-user.md").trim();

        log.info("已加载 2 个 Prompt 模板 (来自 classpath:prompts/*.md)");
    }

    /** 固定的系统指令 */
    public String getSystemInstruction() {
        return systemInstruction;
    }

    /**
     * 嵌入源文本的用户消息。
     */
    public String getUserMessage(String sourceText) {
        return userTemplate.replace(SOURCE_TEXT_PLACEHOLDER, sourceText);
    }

    private String loadPrompt(String filename) {
        try {
            ClassPathResource resource = new ClassPathResource(PROMPT_DIR + filename);
            String content = resource.getContentAsString(StandardCharsets.UTF_8);
            log.debug("加载 Prompt: {} ({} 字符)", filename, content.length());
            return content;
        } catch (IOException e) {
            log.error("加载 Prompt 失败: {}", filename, e);
            throw new IllegalStateException("无法加载 Prompt 文件: " + PROMPT_DIR + filename, e);
        }
    }
}
