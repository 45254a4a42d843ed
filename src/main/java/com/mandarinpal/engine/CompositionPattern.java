package com.mandarinpal.engine;

import com.mandarinpal.engine.model.FactKey;
import lombok.Value;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 一种可识别的家庭构成: 父母 + 自己 + 指定的兄弟姐妹类别
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Value
public class CompositionPattern {

    private static final int PARENTS_AND_SELF = 3;

    int householdSize;

    Set<FactKey> siblings;

    public CompositionPattern(Set<FactKey> siblings) {
        this.siblings = siblings.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(siblings));
        this.householdSize = PARENTS_AND_SELF + siblings.size();
    }

    public boolean matches(int statedSize, Set<FactKey> namedSiblings) {
        return householdSize == statedSize && siblings.equals(namedSiblings);
    }
}
