package com.mandarinpal.engine.model;

import lombok.Value;

import java.util.List;

/**
 * 目标问题
 *
 * <p>{@code keywords} 中任意一个出现在对话中，即认为该问题已被覆盖。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Value
public class Question {

    String text;

    List<String> keywords;

    public Question(String text, List<String> keywords) {
        this.text = text;
        this.keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public boolean mentions(String term) {
        return text.contains(term);
    }
}
