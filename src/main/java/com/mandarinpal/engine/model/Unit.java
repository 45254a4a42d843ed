package com.mandarinpal.engine.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * 课程单元
 *
 * <p>启动时从配置加载，进程生命周期内只读。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Value
@Builder
public class Unit {

    String id;

    String title;

    @Singular
    List<String> objectives;

    /**
     * 按固定顺序排列的目标问题
     */
    @Singular
    List<Question> questions;

    /**
     * 单元专属的角色扮演指引，拼入系统提示词
     */
    String roleplayPrompt;

    /**
     * 开场问题，为空时使用第一个目标问题
     */
    String openingQuestion;

    public Question questionAt(int index) {
        return questions.get(index);
    }
}
