package com.mandarinpal.engine;

import com.mandarinpal.Exception.UnitNotFoundException;
import com.mandarinpal.engine.model.Question;
import com.mandarinpal.engine.model.Unit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuestionCatalogTest {

    @Test
    void testGetQuestions_KeepsConfiguredOrder() {
        // Given
        QuestionCatalog catalog = UnitFixtures.catalog();

        // When
        List<Question> questions = catalog.getQuestions("unit2");

        // Then
        assertEquals(12, questions.size());
        assertEquals("你是哪国人？你是哪里人？", questions.get(0).getText());
        assertEquals("她的妹妹几年级？", questions.get(11).getText());
    }

    @Test
    void testGetQuestions_UnknownUnit() {
        QuestionCatalog catalog = UnitFixtures.catalog();

        UnitNotFoundException e = assertThrows(UnitNotFoundException.class, () -> catalog.getQuestions("unit9"));
        assertEquals("unit9", e.getUnitId());
        assertThrows(UnitNotFoundException.class, () -> catalog.getQuestions(null));
    }

    @Test
    void testListUnits_ConfigurationOrder() {
        QuestionCatalog catalog = UnitFixtures.catalog();

        List<Unit> units = catalog.listUnits();

        assertEquals(List.of("unit1", "unit2"), units.stream().map(Unit::getId).toList());
    }

    @Test
    void testConstructor_DuplicateUnitId() {
        // Given
        Unit first = UnitFixtures.familyUnit();
        Unit second = UnitFixtures.familyUnit();

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> new QuestionCatalog(List.of(first, second)));
    }

    @Test
    void testConstructor_UnitWithoutQuestions() {
        Unit empty = Unit.builder().id("unit0").title("empty").build();

        assertThrows(IllegalArgumentException.class, () -> new QuestionCatalog(List.of(empty)));
    }
}
