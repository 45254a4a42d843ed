package com.mandarinpal.service.impl;

import com.mandarinpal.Exception.TextGenerationException;
import com.mandarinpal.config.RoleplayProperties;
import com.mandarinpal.engine.model.Transcript;
import com.mandarinpal.engine.model.Turn;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TextGenerationServiceImplTest {

    @Mock
    private ChatClient chatClient;

    @Mock
    private ChatClient.ChatClientRequestSpec requestSpec;

    @Mock
    private ChatClient.CallResponseSpec callResponseSpec;

    @Captor
    private ArgumentCaptor<List<Message>> messagesCaptor;

    private final RoleplayProperties.GenerationProfile profile = new RoleplayProperties.GenerationProfile(0.6, 300);

    private final Transcript transcript = Transcript.of(
        Turn.partner("你好！(Nǐ hǎo!)"),
        Turn.student("你叫什么名字？"));

    private TextGenerationServiceImpl textGenerationService;

    @BeforeEach
    void setUp() {
        textGenerationService = new TextGenerationServiceImpl(chatClient);
        when(chatClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.messages(anyList())).thenReturn(requestSpec);
        when(requestSpec.options(any())).thenReturn(requestSpec);
    }

    @Test
    void testGenerate_MessageOrder() {
        // Given
        when(requestSpec.call()).thenReturn(callResponseSpec);
        when(callResponseSpec.content()).thenReturn("  我叫李爱。(Wǒ jiào Lǐ Ài.)  ");

        // When
        String result = textGenerationService.generate(List.of("PRIORITY", "PERSONA"), transcript, profile);

        // Then
        assertEquals("我叫李爱。(Wǒ jiào Lǐ Ài.)", result);
        verify(requestSpec).messages(messagesCaptor.capture());
        List<Message> messages = messagesCaptor.getValue();
        assertEquals(4, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertEquals("PRIORITY", messages.get(0).getText());
        assertInstanceOf(SystemMessage.class, messages.get(1));
        assertEquals("PERSONA", messages.get(1).getText());
        assertInstanceOf(AssistantMessage.class, messages.get(2));
        assertEquals("你好！(Nǐ hǎo!)", messages.get(2).getText());
        assertInstanceOf(UserMessage.class, messages.get(3));
        assertEquals("你叫什么名字？", messages.get(3).getText());
    }

    @Test
    void testGenerate_FailureSurfacesOnceWithoutRetry() {
        // Given
        ResourceAccessException timeout = new ResourceAccessException("Read timed out");
        when(requestSpec.call()).thenThrow(timeout);

        // When
        TextGenerationException e = assertThrows(TextGenerationException.class,
            () -> textGenerationService.generate(List.of("PRIORITY"), transcript, profile));

        // Then
        assertSame(timeout, e.getCause());
        verify(chatClient, times(1)).prompt();
        verify(requestSpec, times(1)).call();
    }

    @Test
    void testGenerate_BlankContent() {
        // Given
        when(requestSpec.call()).thenReturn(callResponseSpec);
        when(callResponseSpec.content()).thenReturn("   ");

        // When & Then
        assertThrows(TextGenerationException.class,
            () -> textGenerationService.generate(List.of("PRIORITY"), transcript, profile));
        verify(requestSpec, times(1)).call();
    }

    @Test
    void testGenerate_NullContent() {
        // Given
        when(requestSpec.call()).thenReturn(callResponseSpec);
        when(callResponseSpec.content()).thenReturn(null);

        // When & Then
        assertThrows(TextGenerationException.class,
            () -> textGenerationService.generate(List.of(), transcript, profile));
    }
}
