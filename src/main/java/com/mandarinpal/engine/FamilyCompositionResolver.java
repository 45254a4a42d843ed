package com.mandarinpal.engine;

import cn.hutool.core.util.StrUtil;
import com.mandarinpal.engine.model.FactKey;
import com.mandarinpal.engine.model.FactState;
import com.mandarinpal.engine.model.FactTable;
import com.mandarinpal.engine.model.Transcript;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 家庭构成解析
 *
 * <p>学生常在一句话里同时说出人数和成员，例如“我家有四口人爸爸妈妈姐姐和我”，
 * 而不会逐一否认没有的兄弟姐妹。本组件在人数与列举完全吻合时，
 * 把未被提到的兄弟姐妹类别判定为不存在。</p>
 *
 * <p>可识别的构成是封闭集合: 父母 + 自己 + 0~3 类兄弟姐妹，人数 = 3 + 类别数。
 * 人数与列举对不上、出现多个人数说法或缺少父母与自己时，不做任何推断。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
public class FamilyCompositionResolver {

    private static final int MAX_NAMED_SIBLINGS = 3;

    private final FamilyLexicon lexicon;

    private final List<CompositionPattern> patterns;

    public FamilyCompositionResolver(FamilyLexicon lexicon) {
        this.lexicon = lexicon;
        this.patterns = enumeratePatterns(lexicon);
    }

    public List<CompositionPattern> getPatterns() {
        return patterns;
    }

    /**
     * 在提取结果的基础上细化兄弟姐妹事实，返回新的事实表
     *
     * @param facts      事实提取结果
     * @param transcript 对话记录
     * @return 细化后的事实表
     */
    public FactTable resolveComposition(FactTable facts, Transcript transcript) {
        String text = transcript.normalizedStudentText();
        if (text.isEmpty()) {
            return facts;
        }

        if (StrUtil.containsAny(text, lexicon.getNoSiblingPhrases().toArray(new String[0]))) {
            log.debug("学生声明没有兄弟姐妹");
            FactTable resolved = facts;
            for (FactKey key : FactKey.siblings()) {
                resolved = resolved.with(key, FactState.ASSERTED_ABSENT);
            }
            return resolved;
        }

        Integer statedSize = statedHouseholdSize(text);
        if (statedSize == null || !mentionsParentsAndSelf(text)) {
            return facts;
        }

        Set<FactKey> named = namedSiblings(text);
        CompositionPattern match = patterns.stream()
            .filter(pattern -> pattern.matches(statedSize, named))
            .findFirst()
            .orElse(null);
        if (match == null) {
            log.debug("家庭构成无法确定: statedSize={}, named={}", statedSize, named);
            return facts;
        }

        FactTable resolved = facts;
        for (FactKey key : FactKey.siblings()) {
            if (!match.getSiblings().contains(key)) {
                resolved = resolved.with(key, FactState.ASSERTED_ABSENT);
            } else if (!facts.isAbsent(key)) {
                resolved = resolved.with(key, FactState.ASSERTED_PRESENT);
            }
        }
        log.debug("家庭构成解析完成: householdSize={}, siblings={}", match.getHouseholdSize(), match.getSiblings());
        return resolved;
    }

    /**
     * 唯一出现的人数；没有或出现多个时返回 null
     */
    private Integer statedHouseholdSize(String text) {
        Integer stated = null;
        for (Map.Entry<Integer, List<String>> entry : lexicon.sortedHouseholdSizePhrases().entrySet()) {
            if (!StrUtil.containsAny(text, entry.getValue().toArray(new String[0]))) {
                continue;
            }
            if (stated != null) {
                log.debug("出现多个家庭人数说法: {} / {}", stated, entry.getKey());
                return null;
            }
            stated = entry.getKey();
        }
        return stated;
    }

    private boolean mentionsParentsAndSelf(String text) {
        return lexicon.getParentTerms().stream().allMatch(text::contains) && text.contains(lexicon.getSelfTerm());
    }

    private Set<FactKey> namedSiblings(String text) {
        Set<FactKey> named = EnumSet.noneOf(FactKey.class);
        for (FactKey key : FactKey.siblings()) {
            if (text.contains(lexicon.termOf(key))) {
                named.add(key);
            }
        }
        return named;
    }

    /**
     * 枚举所有可识别的构成，只保留词表中配置了人数说法的
     */
    private static List<CompositionPattern> enumeratePatterns(FamilyLexicon lexicon) {
        List<FactKey> siblings = FactKey.siblings();
        List<CompositionPattern> result = new ArrayList<>();
        for (int mask = 0; mask < (1 << siblings.size()); mask++) {
            if (Integer.bitCount(mask) > MAX_NAMED_SIBLINGS) {
                continue;
            }
            Set<FactKey> subset = EnumSet.noneOf(FactKey.class);
            for (int i = 0; i < siblings.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    subset.add(siblings.get(i));
                }
            }
            CompositionPattern pattern = new CompositionPattern(subset);
            if (lexicon.getHouseholdSizePhrases().containsKey(pattern.getHouseholdSize())) {
                result.add(pattern);
            }
        }
        return Collections.unmodifiableList(result);
    }
}
