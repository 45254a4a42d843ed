package com.mandarinpal.engine;

import com.mandarinpal.engine.model.CoverageState;
import com.mandarinpal.engine.model.Directive;
import com.mandarinpal.engine.model.FactTable;
import com.mandarinpal.engine.model.Question;
import com.mandarinpal.engine.model.Transcript;
import com.mandarinpal.engine.model.Unit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 回合编排: (单元, 完整对话) → 指令
 *
 * <p>纯函数，每次调用都从对话记录重新推导全部状态，不缓存、不持久化。
 * 相同输入总是得到相等的结果。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
@RequiredArgsConstructor
public class TurnOrchestrator {

    private final QuestionCatalog catalog;

    private final CoverageTracker coverageTracker;

    private final FactExtractor factExtractor;

    private final FamilyCompositionResolver compositionResolver;

    private final ConstraintFilter constraintFilter;

    /**
     * 计算当前回合的指令
     *
     * @param unitId     单元ID
     * @param transcript 完整对话记录
     * @return 指令
     * @throws com.mandarinpal.Exception.UnitNotFoundException 单元不存在
     */
    public Directive buildDirective(String unitId, Transcript transcript) {
        Unit unit = catalog.getUnit(unitId);
        CoverageState coverage = coverageTracker.computeCoverage(unit.getQuestions(), transcript);
        FactTable facts = compositionResolver.resolveComposition(factExtractor.extractFacts(transcript), transcript);
        List<Question> allowed = constraintFilter.filterQuestions(coverage.getRemaining(), facts);

        Directive directive = Directive.builder()
            .unitId(unit.getId())
            .remaining(allowed.stream().map(Question::getText).toList())
            .nextIndex(coverage.getNextIndex())
            .nextQuestion(unit.questionAt(coverage.getNextIndex()).getText())
            .coveredIndices(coverage.getCoveredIndices())
            .prohibited(constraintFilter.prohibitedEntities(facts))
            .facts(facts)
            .build();
        log.debug("指令构建完成: unitId={}, turns={}, nextIndex={}, remaining={}, prohibited={}",
            unitId, transcript.size(), directive.getNextIndex(), allowed.size(), directive.getProhibited());
        return directive;
    }
}
