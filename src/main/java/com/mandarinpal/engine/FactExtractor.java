package com.mandarinpal.engine;

import com.mandarinpal.engine.model.FactKey;
import com.mandarinpal.engine.model.FactTable;
import com.mandarinpal.engine.model.Transcript;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.Set;

/**
 * 从学生发言中提取家庭成员与宠物事实
 *
 * <p>只检查学生发言，对话伙伴的发言不代表学生的真实情况。
 * 规则按 {@link FactRuleTable} 的优先级顺序求值，每个事实键由第一条命中的规则决定。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
@RequiredArgsConstructor
public class FactExtractor {

    private final FactRuleTable ruleTable;

    public FactTable extractFacts(Transcript transcript) {
        FactTable facts = FactTable.unknown();
        String text = transcript.normalizedStudentText();
        if (text.isEmpty()) {
            return facts;
        }

        Set<FactKey> decided = EnumSet.noneOf(FactKey.class);
        for (FactRule rule : ruleTable.getRules()) {
            if (decided.contains(rule.getKey()) || !rule.matches(text)) {
                continue;
            }
            facts = facts.with(rule.getKey(), rule.getResult());
            decided.add(rule.getKey());
            log.debug("事实规则命中: key={}, result={}, pattern={}",
                rule.getKey().getKey(), rule.getResult().getWireName(), rule.getPattern().pattern());
        }
        return facts;
    }
}
