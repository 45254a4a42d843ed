package com.mandarinpal.engine.model;

import lombok.Value;

import java.util.List;

/**
 * 目标问题覆盖情况
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Value
public class CoverageState {

    /**
     * 已覆盖的问题下标，升序
     */
    List<Integer> coveredIndices;

    /**
     * 第一个未覆盖的下标；全部覆盖时为最后一个下标
     */
    int nextIndex;

    /**
     * 未覆盖的问题，保持目录顺序
     */
    List<Question> remaining;

    public CoverageState(List<Integer> coveredIndices, int nextIndex, List<Question> remaining) {
        this.coveredIndices = List.copyOf(coveredIndices);
        this.nextIndex = nextIndex;
        this.remaining = List.copyOf(remaining);
    }
}
