package com.mandarinpal.config;

import com.mandarinpal.engine.ConstraintFilter;
import com.mandarinpal.engine.CoverageTracker;
import com.mandarinpal.engine.FactExtractor;
import com.mandarinpal.engine.FactRuleTable;
import com.mandarinpal.engine.FamilyCompositionResolver;
import com.mandarinpal.engine.FamilyLexicon;
import com.mandarinpal.engine.QuestionCatalog;
import com.mandarinpal.engine.TurnOrchestrator;
import com.mandarinpal.engine.model.Question;
import com.mandarinpal.engine.model.Unit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 覆盖与约束引擎配置
 *
 * <p>引擎组件都是不可变对象，规则表与词表在这里注入。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class EngineConfig {

    private final RoleplayProperties roleplayProperties;

    @Bean
    public QuestionCatalog questionCatalog() {
        return new QuestionCatalog(toUnits(roleplayProperties.getUnits()));
    }

    @Bean
    public FactRuleTable factRuleTable() {
        return FactRuleTable.mandarinDefaults();
    }

    @Bean
    public FamilyLexicon familyLexicon() {
        return FamilyLexicon.mandarinDefaults();
    }

    @Bean
    public CoverageTracker coverageTracker() {
        return new CoverageTracker();
    }

    @Bean
    public FactExtractor factExtractor(FactRuleTable factRuleTable) {
        log.info("初始化事实提取器: rules={}", factRuleTable.getRules().size());
        return new FactExtractor(factRuleTable);
    }

    @Bean
    public FamilyCompositionResolver familyCompositionResolver(FamilyLexicon familyLexicon) {
        return new FamilyCompositionResolver(familyLexicon);
    }

    @Bean
    public ConstraintFilter constraintFilter(FamilyLexicon familyLexicon) {
        return new ConstraintFilter(familyLexicon);
    }

    @Bean
    public TurnOrchestrator turnOrchestrator(QuestionCatalog questionCatalog,
                                             CoverageTracker coverageTracker,
                                             FactExtractor factExtractor,
                                             FamilyCompositionResolver familyCompositionResolver,
                                             ConstraintFilter constraintFilter) {
        return new TurnOrchestrator(questionCatalog, coverageTracker, factExtractor,
            familyCompositionResolver, constraintFilter);
    }

    static List<Unit> toUnits(List<RoleplayProperties.UnitDefinition> definitions) {
        return definitions.stream()
            .map(definition -> Unit.builder()
                .id(definition.getId())
                .title(definition.getTitle())
                .objectives(definition.getObjectives())
                .questions(definition.getQuestions().stream()
                    .map(q -> new Question(q.getText(), q.getKeywords()))
                    .toList())
                .roleplayPrompt(definition.getRoleplayPrompt())
                .openingQuestion(definition.getOpeningQuestion())
                .build())
            .toList();
    }
}
