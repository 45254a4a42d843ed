package com.mandarinpal.engine;

import com.mandarinpal.engine.model.FactKey;
import com.mandarinpal.engine.model.FactState;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * 事实规则: 文本匹配 {@code pattern} 时，{@code key} 取值为 {@code result}
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Value
public class FactRule {

    Pattern pattern;

    FactKey key;

    FactState result;

    public FactRule(Pattern pattern, FactKey key, FactState result) {
        if (result == null || !result.isAsserted()) {
            throw new IllegalArgumentException("规则结果必须是 ASSERTED_PRESENT 或 ASSERTED_ABSENT: " + pattern);
        }
        this.pattern = pattern;
        this.key = key;
        this.result = result;
    }

    public static FactRule negation(String regex, FactKey key) {
        return new FactRule(Pattern.compile(regex), key, FactState.ASSERTED_ABSENT);
    }

    public static FactRule affirmation(String regex, FactKey key) {
        return new FactRule(Pattern.compile(regex), key, FactState.ASSERTED_PRESENT);
    }

    public boolean isNegation() {
        return result == FactState.ASSERTED_ABSENT;
    }

    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
