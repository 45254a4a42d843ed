package com.mandarinpal.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * 引擎追踪的事实键
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
public enum FactKey {

    HAS_OLDER_BROTHER("has_older_brother", true),

    HAS_YOUNGER_BROTHER("has_younger_brother", true),

    HAS_OLDER_SISTER("has_older_sister", true),

    HAS_YOUNGER_SISTER("has_younger_sister", true),

    HAS_PET("has_pet", false);

    private static final List<FactKey> SIBLINGS = Arrays.stream(values())
        .filter(FactKey::isSibling)
        .toList();

    private final String key;

    private final boolean sibling;

    FactKey(String key, boolean sibling) {
        this.key = key;
        this.sibling = sibling;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public boolean isSibling() {
        return sibling;
    }

    /**
     * 四类兄弟姐妹，按声明顺序
     */
    public static List<FactKey> siblings() {
        return SIBLINGS;
    }
}
