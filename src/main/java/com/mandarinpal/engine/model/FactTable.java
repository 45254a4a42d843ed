package com.mandarinpal.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 事实表
 *
 * <p>每个追踪的事实对应一个具名三态字段，默认 {@link FactState#UNKNOWN}。
 * 实例不可变，修改通过 {@link #with(FactKey, FactState)} 返回新实例。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Value
@Builder(toBuilder = true)
public class FactTable {

    @Builder.Default
    @JsonProperty("has_older_brother")
    FactState hasOlderBrother = FactState.UNKNOWN;

    @Builder.Default
    @JsonProperty("has_younger_brother")
    FactState hasYoungerBrother = FactState.UNKNOWN;

    @Builder.Default
    @JsonProperty("has_older_sister")
    FactState hasOlderSister = FactState.UNKNOWN;

    @Builder.Default
    @JsonProperty("has_younger_sister")
    FactState hasYoungerSister = FactState.UNKNOWN;

    @Builder.Default
    @JsonProperty("has_pet")
    FactState hasPet = FactState.UNKNOWN;

    /**
     * 全部为 UNKNOWN 的事实表
     */
    public static FactTable unknown() {
        return FactTable.builder().build();
    }

    public FactState get(FactKey key) {
        return switch (key) {
            case HAS_OLDER_BROTHER -> hasOlderBrother;
            case HAS_YOUNGER_BROTHER -> hasYoungerBrother;
            case HAS_OLDER_SISTER -> hasOlderSister;
            case HAS_YOUNGER_SISTER -> hasYoungerSister;
            case HAS_PET -> hasPet;
        };
    }

    public FactTable with(FactKey key, FactState state) {
        FactTableBuilder builder = toBuilder();
        switch (key) {
            case HAS_OLDER_BROTHER -> builder.hasOlderBrother(state);
            case HAS_YOUNGER_BROTHER -> builder.hasYoungerBrother(state);
            case HAS_OLDER_SISTER -> builder.hasOlderSister(state);
            case HAS_YOUNGER_SISTER -> builder.hasYoungerSister(state);
            case HAS_PET -> builder.hasPet(state);
        }
        return builder.build();
    }

    public boolean isAbsent(FactKey key) {
        return get(key) == FactState.ASSERTED_ABSENT;
    }

    /**
     * 被判定为不存在的事实键，按 {@link FactKey} 声明顺序
     */
    public List<FactKey> absentKeys() {
        List<FactKey> keys = new ArrayList<>();
        for (FactKey key : FactKey.values()) {
            if (isAbsent(key)) {
                keys.add(key);
            }
        }
        return keys;
    }

    public boolean allSiblingsAbsent() {
        return FactKey.siblings().stream().allMatch(this::isAbsent);
    }
}
