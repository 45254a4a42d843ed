package com.mandarinpal.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 对话角色
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
public enum TurnRole {

    /**
     * 学习者，前端历史中也记作 user
     */
    STUDENT("student", "user"),

    /**
     * 对话伙伴（李爱），前端历史中也记作 assistant
     */
    PARTNER("partner", "assistant");

    private final String wireName;

    private final String chatAlias;

    TurnRole(String wireName, String chatAlias) {
        this.wireName = wireName;
        this.chatAlias = chatAlias;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getChatAlias() {
        return chatAlias;
    }

    /**
     * 解析前端传入的角色名，无法识别时返回 null
     */
    public static TurnRole fromWire(String role) {
        if (role == null) {
            return null;
        }
        String normalized = role.trim().toLowerCase(Locale.ROOT);
        for (TurnRole value : values()) {
            if (value.wireName.equals(normalized) || value.chatAlias.equals(normalized)) {
                return value;
            }
        }
        return null;
    }
}
