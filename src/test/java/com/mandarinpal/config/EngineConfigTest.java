package com.mandarinpal.config;

import com.mandarinpal.engine.model.Unit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void testToUnits_MapsDefinitions() {
        // Given
        RoleplayProperties.QuestionDefinition question = new RoleplayProperties.QuestionDefinition();
        question.setText("你今天几点起床？");
        question.setKeywords(List.of("几点", "起床"));

        RoleplayProperties.UnitDefinition definition = new RoleplayProperties.UnitDefinition();
        definition.setId("unit3");
        definition.setTitle("Unit 3: Daily Schedule");
        definition.setObjectives(List.of("Talk about times"));
        definition.setOpeningQuestion("你今天上什么课？");
        definition.setQuestions(List.of(question));

        // When
        List<Unit> units = EngineConfig.toUnits(List.of(definition));

        // Then
        assertEquals(1, units.size());
        Unit unit = units.get(0);
        assertEquals("unit3", unit.getId());
        assertEquals("你今天上什么课？", unit.getOpeningQuestion());
        assertEquals("你今天几点起床？", unit.questionAt(0).getText());
        assertEquals(List.of("几点", "起床"), unit.questionAt(0).getKeywords());
        assertEquals(1, unit.getQuestions().size());
    }

    @Test
    void testGenerationDefaults() {
        RoleplayProperties properties = new RoleplayProperties();

        assertEquals(0.6, properties.getGeneration().getTurn().getTemperature());
        assertEquals(300, properties.getGeneration().getTurn().getMaxTokens());
        assertEquals(80, properties.getGeneration().getTranslate().getMaxTokens());
        assertEquals(400, properties.getGeneration().getFeedback().getMaxTokens());
        assertEquals(600, properties.getMaxTurnChars());
    }
}
