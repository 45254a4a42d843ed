package com.mandarinpal.engine;

import com.mandarinpal.engine.model.FactKey;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 家庭成员词表
 *
 * <p>供家庭构成解析与问题过滤使用的不可变词汇配置。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Value
@Builder
public class FamilyLexicon {

    /**
     * 家庭人数 → 表达该人数的短语，如 4 → 四口人
     */
    @Singular
    Map<Integer, List<String>> householdSizePhrases;

    /**
     * 必须同时出现的父母称谓
     */
    @Singular
    List<String> parentTerms;

    /**
     * 自称
     */
    String selfTerm;

    /**
     * 每个事实键在问题文本中的指代词
     */
    @Singular
    Map<FactKey, String> entityTerms;

    /**
     * 直接声明没有兄弟姐妹的说法
     */
    @Singular
    List<String> noSiblingPhrases;

    /**
     * 兄弟姐妹的统称
     */
    String siblingCollectiveTerm;

    public String termOf(FactKey key) {
        return entityTerms.get(key);
    }

    /**
     * 按人数升序排列的人数短语
     */
    public Map<Integer, List<String>> sortedHouseholdSizePhrases() {
        return new TreeMap<>(householdSizePhrases);
    }

    public static FamilyLexicon mandarinDefaults() {
        Map<FactKey, String> terms = new EnumMap<>(FactKey.class);
        terms.put(FactKey.HAS_OLDER_BROTHER, "哥哥");
        terms.put(FactKey.HAS_YOUNGER_BROTHER, "弟弟");
        terms.put(FactKey.HAS_OLDER_SISTER, "姐姐");
        terms.put(FactKey.HAS_YOUNGER_SISTER, "妹妹");
        terms.put(FactKey.HAS_PET, "宠物");
        return FamilyLexicon.builder()
            .householdSizePhrase(3, List.of("三口人", "三个人", "3口人", "3个人"))
            .householdSizePhrase(4, List.of("四口人", "四个人", "4口人", "4个人"))
            .householdSizePhrase(5, List.of("五口人", "五个人", "5口人", "5个人"))
            .householdSizePhrase(6, List.of("六口人", "六个人", "6口人", "6个人"))
            .parentTerm("爸爸")
            .parentTerm("妈妈")
            .selfTerm("我")
            .entityTerms(terms)
            .noSiblingPhrase("没有兄弟姐妹")
            .noSiblingPhrase("没兄弟姐妹")
            .noSiblingPhrase("独生子女")
            .noSiblingPhrase("独生子")
            .noSiblingPhrase("独生女")
            .siblingCollectiveTerm("兄弟姐妹")
            .build();
    }
}
