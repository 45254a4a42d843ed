package com.mandarinpal.engine.model;

import cn.hutool.core.util.StrUtil;
import lombok.Value;

/**
 * 单条对话记录
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Value
public class Turn {

    TurnRole role;

    String text;

    public static Turn student(String text) {
        return new Turn(TurnRole.STUDENT, text);
    }

    public static Turn partner(String text) {
        return new Turn(TurnRole.PARTNER, text);
    }

    /**
     * 缺少角色或文本的记录视为格式错误，构建 {@link Transcript} 时跳过
     */
    public boolean isWellFormed() {
        return role != null && StrUtil.isNotBlank(text);
    }

    public boolean isStudent() {
        return role == TurnRole.STUDENT;
    }
}
