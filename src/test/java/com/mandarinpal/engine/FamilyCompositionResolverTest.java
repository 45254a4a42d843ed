package com.mandarinpal.engine;

import com.mandarinpal.engine.model.FactKey;
import com.mandarinpal.engine.model.FactState;
import com.mandarinpal.engine.model.FactTable;
import com.mandarinpal.engine.model.Transcript;
import com.mandarinpal.engine.model.Turn;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FamilyCompositionResolverTest {

    private final FamilyCompositionResolver resolver = new FamilyCompositionResolver(FamilyLexicon.mandarinDefaults());

    private final FactExtractor factExtractor = new FactExtractor(FactRuleTable.mandarinDefaults());

    private FactTable resolve(String studentText) {
        Transcript transcript = Transcript.of(Turn.student(studentText));
        return resolver.resolveComposition(factExtractor.extractFacts(transcript), transcript);
    }

    @Test
    void testPatterns_ClosedEnumeration() {
        // 0 个 + 1 个 + 2 个 + 3 个兄弟姐妹类别: 1 + 4 + 6 + 4
        assertEquals(15, resolver.getPatterns().size());
        assertTrue(resolver.getPatterns().stream().allMatch(p -> p.getHouseholdSize() >= 3 && p.getHouseholdSize() <= 6));
    }

    @Test
    void testResolveComposition_ThreePeopleNoSiblings() {
        // When
        FactTable facts = resolve("我家有三口人爸爸妈妈和我");

        // Then
        assertEquals(FactState.ASSERTED_ABSENT, facts.getHasOlderBrother());
        assertEquals(FactState.ASSERTED_ABSENT, facts.getHasYoungerBrother());
        assertEquals(FactState.ASSERTED_ABSENT, facts.getHasOlderSister());
        assertEquals(FactState.ASSERTED_ABSENT, facts.getHasYoungerSister());
        assertEquals(FactState.UNKNOWN, facts.getHasPet());
    }

    @Test
    void testResolveComposition_FourPeopleWithOlderSister() {
        // When
        FactTable facts = resolve("我家有四口人爸爸妈妈姐姐和我");

        // Then
        assertEquals(FactState.ASSERTED_PRESENT, facts.getHasOlderSister());
        assertEquals(FactState.ASSERTED_ABSENT, facts.getHasOlderBrother());
        assertEquals(FactState.ASSERTED_ABSENT, facts.getHasYoungerBrother());
        assertEquals(FactState.ASSERTED_ABSENT, facts.getHasYoungerSister());
    }

    @Test
    void testResolveComposition_FivePeopleTwoSiblings() {
        // When
        FactTable facts = resolve("我家有五个人，爸爸、妈妈、哥哥、妹妹和我。");

        // Then
        assertEquals(FactState.ASSERTED_PRESENT, facts.getHasOlderBrother());
        assertEquals(FactState.ASSERTED_PRESENT, facts.getHasYoungerSister());
        assertEquals(FactState.ASSERTED_ABSENT, facts.getHasYoungerBrother());
        assertEquals(FactState.ASSERTED_ABSENT, facts.getHasOlderSister());
    }

    @Test
    void testResolveComposition_SizeMismatchLeftUnresolved() {
        // When
        FactTable facts = resolve("我家有五口人爸爸妈妈姐姐和我");

        // Then
        assertEquals(FactTable.unknown(), facts);
    }

    @Test
    void testResolveComposition_MultipleSizesLeftUnresolved() {
        // When
        FactTable facts = resolve("我家有三口人，不对，四口人，爸爸妈妈姐姐和我");

        // Then
        assertEquals(FactTable.unknown(), facts);
    }

    @Test
    void testResolveComposition_MissingParentsLeftUnresolved() {
        assertEquals(FactTable.unknown(), resolve("我家有四口人，妈妈姐姐和我"));
    }

    @Test
    void testResolveComposition_ExtractorNegationWins() {
        // Given
        Transcript transcript = Transcript.of(Turn.student("我家有四口人爸爸妈妈姐姐和我"));
        FactTable extracted = FactTable.unknown().with(FactKey.HAS_OLDER_SISTER, FactState.ASSERTED_ABSENT);

        // When
        FactTable facts = resolver.resolveComposition(extracted, transcript);

        // Then
        assertEquals(FactState.ASSERTED_ABSENT, facts.getHasOlderSister());
        assertTrue(facts.allSiblingsAbsent());
    }

    @Test
    void testResolveComposition_OnlyChild() {
        // Given
        FactTable extracted = FactTable.unknown().with(FactKey.HAS_PET, FactState.ASSERTED_PRESENT);
        Transcript transcript = Transcript.of(Turn.student("我是独生女。"));

        // When
        FactTable facts = resolver.resolveComposition(extracted, transcript);

        // Then
        assertTrue(facts.allSiblingsAbsent());
        assertEquals(FactState.ASSERTED_PRESENT, facts.getHasPet());
    }

    @Test
    void testResolveComposition_NoSiblingsOverridesEnumeration() {
        assertTrue(resolve("我家有四口人爸爸妈妈姐姐和我。我没有兄弟姐妹。").allSiblingsAbsent());
    }

    @Test
    void testResolveComposition_PartnerTextIgnored() {
        // Given
        Transcript transcript = Transcript.of(Turn.partner("我家有三口人爸爸妈妈和我"));

        // When
        FactTable facts = resolver.resolveComposition(FactTable.unknown(), transcript);

        // Then
        assertEquals(FactTable.unknown(), facts);
    }

    @Test
    void testCompositionPattern_Matches() {
        // Given
        CompositionPattern pattern = new CompositionPattern(EnumSet.of(FactKey.HAS_OLDER_SISTER));

        // Then
        assertEquals(4, pattern.getHouseholdSize());
        assertTrue(pattern.matches(4, Set.of(FactKey.HAS_OLDER_SISTER)));
        assertFalse(pattern.matches(5, Set.of(FactKey.HAS_OLDER_SISTER)));
        assertFalse(pattern.matches(4, Set.of(FactKey.HAS_OLDER_BROTHER)));
    }
}
