package com.mandarinpal.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 学生自述事实的三态取值
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
public enum FactState {

    ASSERTED_PRESENT("asserted_present"),

    ASSERTED_ABSENT("asserted_absent"),

    UNKNOWN("unknown");

    private final String wireName;

    FactState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * 是否已由规则明确判定（存在或不存在）
     */
    public boolean isAsserted() {
        return this != UNKNOWN;
    }
}
