package com.mandarinpal.engine;

import com.mandarinpal.engine.model.CoverageState;
import com.mandarinpal.engine.model.Question;
import com.mandarinpal.engine.model.Transcript;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 目标问题覆盖追踪
 *
 * <p>问题的任一关键词以子串形式出现在对话（双方）中即视为已覆盖。
 * 关键词在问题之间可能重叠，结果只作为进度提示。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
public class CoverageTracker {

    public CoverageState computeCoverage(List<Question> catalog, Transcript transcript) {
        String joined = transcript.joinedText();
        List<Integer> covered = new ArrayList<>();
        List<Question> remaining = new ArrayList<>();
        int nextIndex = -1;

        for (int i = 0; i < catalog.size(); i++) {
            Question question = catalog.get(i);
            if (isCovered(question, joined)) {
                covered.add(i);
            } else {
                remaining.add(question);
                if (nextIndex < 0) {
                    nextIndex = i;
                }
            }
        }
        if (nextIndex < 0) {
            nextIndex = Math.max(catalog.size() - 1, 0);
        }

        log.debug("覆盖计算完成: covered={}, nextIndex={}, remaining={}", covered, nextIndex, remaining.size());
        return new CoverageState(covered, nextIndex, remaining);
    }

    private boolean isCovered(Question question, String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (String keyword : question.getKeywords()) {
            if (!keyword.isEmpty() && text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
