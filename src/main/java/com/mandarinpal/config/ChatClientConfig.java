package com.mandarinpal.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ChatClientConfig {

    private final OpenAiChatModel openAiChatModel;
    private final RoleplayProperties roleplayProperties;

    /**
     * 角色扮演使用的 ChatClient
     * 不挂载记忆顾问: 每次请求都带上完整对话记录
     */
    @Bean("roleplayChatClient")
    public ChatClient roleplayChatClient() {
        RoleplayProperties.GenerationProfile turn = roleplayProperties.getGeneration().getTurn();
        log.info("初始化角色扮演 ChatClient，temperature={}, maxTokens={}", turn.getTemperature(), turn.getMaxTokens());

        return ChatClient.builder(openAiChatModel)
            .defaultOptions(OpenAiChatOptions.builder()
                .temperature(turn.getTemperature())
                .maxTokens(turn.getMaxTokens())
                .build())
            .build();
    }
}
