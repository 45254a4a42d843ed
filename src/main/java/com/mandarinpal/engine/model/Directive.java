package com.mandarinpal.engine.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 交给文本生成服务的指令上下文
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Value
@Builder
public class Directive {

    /**
     * 单元ID
     */
    String unitId;

    /**
     * 允许继续提问的剩余问题，保持目录顺序
     */
    List<String> remaining;

    /**
     * 下一个待覆盖问题在目录中的下标
     */
    int nextIndex;

    /**
     * 下一个待覆盖的问题
     */
    String nextQuestion;

    /**
     * 已覆盖问题下标
     */
    List<Integer> coveredIndices;

    /**
     * 禁止提及的对象
     */
    List<String> prohibited;

    /**
     * 推断出的学生自述事实
     */
    FactTable facts;
}
