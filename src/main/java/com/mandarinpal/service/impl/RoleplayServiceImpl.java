package com.mandarinpal.service.impl;

import cn.hutool.core.util.RandomUtil;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mandarinpal.config.RoleplayProperties;
import com.mandarinpal.engine.QuestionCatalog;
import com.mandarinpal.engine.TurnOrchestrator;
import com.mandarinpal.engine.model.Directive;
import com.mandarinpal.engine.model.Transcript;
import com.mandarinpal.engine.model.Turn;
import com.mandarinpal.engine.model.Unit;
import com.mandarinpal.model.dto.ChatDTO;
import com.mandarinpal.model.dto.DirectiveQueryDTO;
import com.mandarinpal.model.dto.RoleplayFeedbackDTO;
import com.mandarinpal.model.dto.RoleplayStartDTO;
import com.mandarinpal.model.dto.RoleplayTurnDTO;
import com.mandarinpal.model.dto.TranslateDTO;
import com.mandarinpal.model.vo.ChatVO;
import com.mandarinpal.model.vo.RoleplayFeedbackVO;
import com.mandarinpal.model.vo.RoleplayReplyVO;
import com.mandarinpal.model.vo.RoleplayStartVO;
import com.mandarinpal.model.vo.TranslateVO;
import com.mandarinpal.service.RoleplayService;
import com.mandarinpal.service.TextGenerationService;
import com.mandarinpal.utils.ReplyTextUtils;
import com.mandarinpal.utils.TranscriptUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 角色扮演服务实现
 *
 * <p>服务端不保存任何会话状态，每一轮都由前端带上完整历史，
 * 由 {@link TurnOrchestrator} 重新计算指令后交给文本生成服务。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoleplayServiceImpl implements RoleplayService {

    private final QuestionCatalog questionCatalog;
    private final TurnOrchestrator turnOrchestrator;
    private final TextGenerationService textGenerationService;
    private final RoleplayProperties roleplayProperties;
    private final ObjectMapper objectMapper;

    @Qualifier("partnerPriorityPrompt")
    private final String partnerPriorityPrompt;
    @Qualifier("partnerPersonaPromptTemplate")
    private final String partnerPersonaPromptTemplate;
    @Qualifier("directiveControlPromptTemplate")
    private final String directiveControlPromptTemplate;
    @Qualifier("translatePrompt")
    private final String translatePrompt;
    @Qualifier("feedbackPromptTemplate")
    private final String feedbackPromptTemplate;
    @Qualifier("chatPrompt")
    private final String chatPrompt;

    @Override
    public RoleplayStartVO start(RoleplayStartDTO request) {
        Unit unit = questionCatalog.getUnit(request.getUnitId());

        List<String> greetings = roleplayProperties.getGreetings();
        String greeting = greetings == null || greetings.isEmpty() ? "" : RandomUtil.randomEle(greetings);
        String firstQuestion = firstQuestionOf(unit);
        String opening = StrUtil.isBlank(greeting) ? firstQuestion : greeting + "\n" + firstQuestion;

        log.info("开始角色扮演: unitId={}, firstQuestion={}", unit.getId(), firstQuestion);
        return RoleplayStartVO.builder()
            .unitId(unit.getId())
            .greeting(greeting)
            .firstQuestion(firstQuestion)
            .opening(opening)
            .build();
    }

    @Override
    public Directive directive(DirectiveQueryDTO request) {
        return turnOrchestrator.buildDirective(request.getUnitId(), TranscriptUtils.toTranscript(request.getHistory()));
    }

    @Override
    public RoleplayReplyVO turn(RoleplayTurnDTO request) {
        String message = StrUtil.trim(request.getMessage());
        log.info("角色扮演回合: unitId={}, messageLength={}, historySize={}, hasStudentName={}",
            request.getUnitId(), StrUtil.length(message),
            request.getHistory() == null ? 0 : request.getHistory().size(),
            StrUtil.isNotBlank(request.getStudentName()));

        if (StrUtil.isBlank(message)) {
            throw new BusinessException("消息内容不能为空");
        }
        if (message.length() > roleplayProperties.getMaxTurnChars()) {
            throw new BusinessException("消息过长(最多 " + roleplayProperties.getMaxTurnChars() + " 个字符)");
        }
        Unit unit = questionCatalog.getUnit(request.getUnitId());

        if (ReplyTextUtils.containsAnyToken(message, roleplayProperties.getGoodbyeTokens())) {
            log.info("学生道别，结束对话: unitId={}", unit.getId());
            return RoleplayReplyVO.builder()
                .unitId(unit.getId())
                .reply(roleplayProperties.getFarewellReply())
                .farewell(true)
                .timestamp(LocalDateTime.now())
                .build();
        }

        Transcript transcript = TranscriptUtils.toTranscript(request.getHistory()).append(Turn.student(message));
        Directive directive = turnOrchestrator.buildDirective(unit.getId(), transcript);

        String reply = textGenerationService.generate(
            buildTurnContext(unit, directive, request.getStudentName()),
            transcript,
            roleplayProperties.getGeneration().getTurn());
        reply = ReplyTextUtils.normalizeApologies(reply);

        log.info("角色扮演回合完成: unitId={}, nextIndex={}, prohibited={}, replyLength={}",
            unit.getId(), directive.getNextIndex(), directive.getProhibited(), reply.length());
        return RoleplayReplyVO.builder()
            .unitId(unit.getId())
            .reply(reply)
            .farewell(false)
            .directive(directive)
            .timestamp(LocalDateTime.now())
            .build();
    }

    @Override
    public TranslateVO translate(TranslateDTO request) {
        String text = StrUtil.trim(request.getText());
        if (StrUtil.isBlank(text)) {
            throw new BusinessException("待翻译文本不能为空");
        }
        log.info("英文释义: textLength={}", text.length());

        String english = textGenerationService.generate(
            List.of(translatePrompt),
            Transcript.of(Turn.student(text)),
            roleplayProperties.getGeneration().getTranslate());
        return new TranslateVO(english);
    }

    @Override
    public RoleplayFeedbackVO feedback(RoleplayFeedbackDTO request) {
        Unit unit = questionCatalog.getUnit(request.getUnitId());
        Transcript transcript = TranscriptUtils.toTranscript(request.getHistory())
            .lastTurns(roleplayProperties.getFeedbackTranscriptTurns());
        log.info("生成总结反馈: unitId={}, turns={}", unit.getId(), transcript.size());

        String systemPrompt = feedbackPromptTemplate
            .replace("{unitTitle}", StrUtil.nullToEmpty(unit.getTitle()))
            .replace("{objectives}", String.join(", ", unit.getObjectives()));
        String userContent = "Unit: " + StrUtil.nullToEmpty(unit.getTitle()) + "\n"
            + "Here is the transcript of our role play. Please give brief, encouraging feedback as specified.\n\n"
            + TranscriptUtils.format(transcript);

        String feedback = textGenerationService.generate(
            List.of(systemPrompt),
            Transcript.of(Turn.student(userContent)),
            roleplayProperties.getGeneration().getFeedback());
        return new RoleplayFeedbackVO(unit.getId(), feedback);
    }

    @Override
    public ChatVO chat(ChatDTO request) {
        String message = StrUtil.trim(request.getMessage());
        if (StrUtil.isBlank(message)) {
            throw new BusinessException("消息内容不能为空");
        }
        Transcript transcript = TranscriptUtils.toTranscript(request.getConversation()).append(Turn.student(message));
        log.info("自由对话: messageLength={}, turns={}", message.length(), transcript.size());

        String response = textGenerationService.generate(
            List.of(chatPrompt),
            transcript,
            roleplayProperties.getGeneration().getChat());
        return new ChatVO(response);
    }

    /**
     * 单元配置的开场问题，其次是第一个目标问题
     */
    private String firstQuestionOf(Unit unit) {
        if (StrUtil.isNotBlank(unit.getOpeningQuestion())) {
            return unit.getOpeningQuestion();
        }
        if (!unit.getQuestions().isEmpty()) {
            return unit.questionAt(0).getText();
        }
        return roleplayProperties.getFallbackOpeningQuestion();
    }

    /**
     * 组装本轮系统消息: 优先级规则 → 人设与单元指引 → 严格顺序控制
     */
    List<String> buildTurnContext(Unit unit, Directive directive, String studentName) {
        List<String> context = new ArrayList<>();
        context.add(partnerPriorityPrompt);
        context.add(partnerPersonaPromptTemplate.replace("{unitGuidance}", StrUtil.nullToEmpty(unit.getRoleplayPrompt())));
        if (StrUtil.isNotBlank(studentName)) {
            context.add("The student's name is " + studentName.strip() + ".");
        }

        String questions = unit.getQuestions().stream()
            .map(question -> "- " + question.getText())
            .collect(Collectors.joining("\n"));
        context.add(directiveControlPromptTemplate
            .replace("{questions}", questions)
            .replace("{coveredIndices}", String.valueOf(directive.getCoveredIndices()))
            .replace("{nextIndex}", String.valueOf(directive.getNextIndex()))
            .replace("{nextQuestion}", directive.getNextQuestion())
            .replace("{remainingCount}", String.valueOf(directive.getRemaining().size()))
            .replace("{directive}", toJson(directive)));
        return context;
    }

    private String toJson(Directive directive) {
        try {
            return objectMapper.writeValueAsString(directive);
        } catch (JsonProcessingException e) {
            log.error("指令序列化失败: unitId={}", directive.getUnitId(), e);
            throw new BusinessException("指令序列化失败");
        }
    }
}
