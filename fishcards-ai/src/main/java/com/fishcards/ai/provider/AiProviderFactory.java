package com.fishcards.ai.provider;

import com.fishcards.ai.config.AiProperties;
import com.fishcards.common.exception.AiApiException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * AI 提供商工厂，根据配置选择对应的 Provider。
 */
@Component
@RequiredArgsConstructor
public class AiProviderFactory {

    private final List<AiProvider> providers;
    private final AiProperties properties;

    /**
     * 获取当前配置的 AI 提供商。
     */
    public AiProvider getProvider() {
        return getProvider(properties.getProvider());
    }

    /**
     * 根据名称获取指定的提供商。找不到属于内部配置错误（500）。
     */
    public AiProvider getProvider(String providerName) {
        return providers.stream()
                .filter(p -> p.getProviderName().equalsIgnoreCase(providerName))
                .findFirst()
                .orElseThrow(() -> new AiApiException(
                        "未找到 AI 提供商: " + providerName + "，可选: " + availableNames(), 500));
    }

    private String availableNames() {
        return providers.stream().map(AiProvider::getProviderName).collect(Collectors.joining(", "));
    }
}
