package com.mandarinpal.Exception;

import top.continew.starter.core.exception.BusinessException;

/**
 * 文本生成服务暂时不可用
 *
 * <p>只对当前这一轮对话生效，不自动重试。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
public class TextGenerationException extends BusinessException {

    public TextGenerationException(String message) {
        super(message);
    }

    public TextGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
