package com.mandarinpal.engine;

import com.mandarinpal.engine.model.FactKey;
import com.mandarinpal.engine.model.FactTable;
import com.mandarinpal.engine.model.Question;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 问题约束过滤
 *
 * <p>排除提及“学生已说明不存在的对象”的问题。过滤后为空时退回未过滤的列表，
 * 避免对话停滞。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
@RequiredArgsConstructor
public class ConstraintFilter {

    private final FamilyLexicon lexicon;

    public List<Question> filterQuestions(List<Question> questions, FactTable facts) {
        List<String> prohibited = prohibitedEntities(facts);
        if (prohibited.isEmpty()) {
            return List.copyOf(questions);
        }

        List<Question> allowed = new ArrayList<>();
        for (Question question : questions) {
            if (prohibited.stream().noneMatch(question::mentions)) {
                allowed.add(question);
            }
        }
        if (allowed.isEmpty()) {
            log.debug("过滤后没有可用问题，退回未过滤列表: candidates={}", questions.size());
            return List.copyOf(questions);
        }
        return List.copyOf(allowed);
    }

    /**
     * 不允许再提及的对象指代词
     */
    public List<String> prohibitedEntities(FactTable facts) {
        List<String> terms = new ArrayList<>();
        for (FactKey key : facts.absentKeys()) {
            String term = lexicon.termOf(key);
            if (term != null) {
                terms.add(term);
            }
        }
        if (facts.allSiblingsAbsent() && lexicon.getSiblingCollectiveTerm() != null) {
            terms.add(lexicon.getSiblingCollectiveTerm());
        }
        return terms;
    }
}
