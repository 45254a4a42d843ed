package com.mandarinpal.service.impl;

import cn.hutool.core.util.StrUtil;
import com.mandarinpal.Exception.TextGenerationException;
import com.mandarinpal.config.RoleplayProperties;
import com.mandarinpal.engine.model.Transcript;
import com.mandarinpal.engine.model.Turn;
import com.mandarinpal.service.TextGenerationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Spring AI ChatClient 的文本生成实现
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TextGenerationServiceImpl implements TextGenerationService {

    @Qualifier("roleplayChatClient")
    private final ChatClient roleplayChatClient;

    @Override
    public String generate(List<String> systemContext, Transcript transcript, RoleplayProperties.GenerationProfile profile) {
        List<Message> messages = new ArrayList<>();
        for (String context : systemContext) {
            messages.add(new SystemMessage(context));
        }
        for (Turn turn : transcript.getTurns()) {
            messages.add(turn.isStudent() ? new UserMessage(turn.getText()) : new AssistantMessage(turn.getText()));
        }

        long start = System.currentTimeMillis();
        String content;
        try {
            content = roleplayChatClient.prompt()
                .messages(messages)
                .options(OpenAiChatOptions.builder()
                    .temperature(profile.getTemperature())
                    .maxTokens(profile.getMaxTokens())
                    .build())
                .call()
                .content();
        } catch (RuntimeException e) {
            log.error("文本生成失败: messages={}, elapsedMs={}", messages.size(), System.currentTimeMillis() - start, e);
            throw new TextGenerationException("文本生成服务暂时不可用,请稍后重试", e);
        }

        if (StrUtil.isBlank(content)) {
            log.warn("文本生成返回空内容: messages={}", messages.size());
            throw new TextGenerationException("文本生成服务返回空内容");
        }
        log.debug("文本生成完成: messages={}, elapsedMs={}, length={}",
            messages.size(), System.currentTimeMillis() - start, content.length());
        return content.strip();
    }
}
