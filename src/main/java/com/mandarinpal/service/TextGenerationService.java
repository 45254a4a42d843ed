package com.mandarinpal.service;

import com.mandarinpal.config.RoleplayProperties;
import com.mandarinpal.engine.model.Transcript;

import java.util.List;

/**
 * 文本生成服务
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
public interface TextGenerationService {

    /**
     * 生成对话伙伴的一段文本
     *
     * @param systemContext 系统消息，按顺序放在对话之前
     * @param transcript    对话记录，学生发言作为用户消息，伙伴发言作为助手消息
     * @param profile       温度与最大 Token 数
     * @return 生成的文本
     * @throws com.mandarinpal.Exception.TextGenerationException 调用失败或超时，不重试
     */
    String generate(List<String> systemContext, Transcript transcript, RoleplayProperties.GenerationProfile profile);
}
