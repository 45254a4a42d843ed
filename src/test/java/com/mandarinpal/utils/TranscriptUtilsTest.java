package com.mandarinpal.utils;

import com.mandarinpal.engine.model.Transcript;
import com.mandarinpal.engine.model.Turn;
import com.mandarinpal.model.dto.TurnDTO;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TranscriptUtilsTest {

    @Test
    void testToTranscript_MapsRolesAndSkipsMalformed() {
        // Given
        List<TurnDTO> history = Arrays.asList(
            new TurnDTO("assistant", "你好！"),
            new TurnDTO("user", "你是哪国人？"),
            new TurnDTO("system", "ignored"),
            new TurnDTO("user", ""),
            null,
            new TurnDTO("partner", "我是中国人。"));

        // When
        Transcript transcript = TranscriptUtils.toTranscript(history);

        // Then
        assertEquals(List.of(Turn.partner("你好！"), Turn.student("你是哪国人？"), Turn.partner("我是中国人。")),
            transcript.getTurns());
    }

    @Test
    void testToTranscript_NullHistory() {
        assertEquals(0, TranscriptUtils.toTranscript(null).size());
    }

    @Test
    void testFormat() {
        Transcript transcript = Transcript.of(Turn.partner("你好！"), Turn.student(" 你好 "));

        assertEquals("assistant: 你好！\nuser: 你好", TranscriptUtils.format(transcript));
    }
}
