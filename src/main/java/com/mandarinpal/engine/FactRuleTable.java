package com.mandarinpal.engine;

import com.mandarinpal.engine.model.FactKey;
import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 有序事实规则表
 *
 * <p>规则按优先级保存: 所有否定规则排在肯定规则之前，同类规则保持声明顺序。
 * 对每个事实键，表中第一条命中的规则决定结果，因此只要出现否定说法，
 * 无论是否同时出现肯定说法，结果都是 ASSERTED_ABSENT。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Value
public class FactRuleTable {

    List<FactRule> rules;

    public FactRuleTable(List<FactRule> rules) {
        List<FactRule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparing(rule -> !rule.isNegation()));
        this.rules = List.copyOf(ordered);
    }

    /**
     * 家庭单元使用的中文规则
     */
    public static FactRuleTable mandarinDefaults() {
        return new FactRuleTable(List.of(
            FactRule.negation("我\\s*没有\\s*哥哥", FactKey.HAS_OLDER_BROTHER),
            FactRule.negation("没有\\s*哥哥", FactKey.HAS_OLDER_BROTHER),
            FactRule.negation("我\\s*没有\\s*弟弟", FactKey.HAS_YOUNGER_BROTHER),
            FactRule.negation("没有\\s*弟弟", FactKey.HAS_YOUNGER_BROTHER),
            FactRule.negation("我\\s*没有\\s*姐姐", FactKey.HAS_OLDER_SISTER),
            FactRule.negation("没有\\s*姐姐", FactKey.HAS_OLDER_SISTER),
            FactRule.negation("我\\s*没有\\s*妹妹", FactKey.HAS_YOUNGER_SISTER),
            FactRule.negation("没有\\s*妹妹", FactKey.HAS_YOUNGER_SISTER),
            FactRule.negation("没\\s*有\\s*宠物|我\\s*没有\\s*宠物", FactKey.HAS_PET),

            FactRule.affirmation("我\\s*有\\s*哥哥", FactKey.HAS_OLDER_BROTHER),
            FactRule.affirmation("有\\s*哥哥", FactKey.HAS_OLDER_BROTHER),
            FactRule.affirmation("我\\s*有\\s*弟弟", FactKey.HAS_YOUNGER_BROTHER),
            FactRule.affirmation("有\\s*弟弟", FactKey.HAS_YOUNGER_BROTHER),
            FactRule.affirmation("我\\s*有\\s*姐姐", FactKey.HAS_OLDER_SISTER),
            FactRule.affirmation("有\\s*姐姐", FactKey.HAS_OLDER_SISTER),
            FactRule.affirmation("我\\s*有\\s*妹妹", FactKey.HAS_YOUNGER_SISTER),
            FactRule.affirmation("有\\s*妹妹", FactKey.HAS_YOUNGER_SISTER),
            FactRule.affirmation("我\\s*有\\s*宠物|有\\s*宠物", FactKey.HAS_PET)
        ));
    }
}
