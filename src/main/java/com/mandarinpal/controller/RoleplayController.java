package com.mandarinpal.controller;

import com.mandarinpal.engine.model.Directive;
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
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

/**
 * 角色扮演控制器
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Tag(name = "角色扮演", description = "中文口语角色扮演对话、指令计算、翻译与总结反馈")
@RestController
@RequestMapping("/api/roleplay")
@RequiredArgsConstructor
public class RoleplayController {

    private final RoleplayService roleplayService;

    /**
     * 开场白
     */
    @Operation(summary = "开始角色扮演", description = "返回问候语与本单元第一个问题")
    @PostMapping("/start")
    public RoleplayStartVO start(@RequestBody @Valid RoleplayStartDTO request) {
        return roleplayService.start(request);
    }

    /**
     * 仅计算指令，不调用模型
     */
    @Operation(summary = "计算对话指令", description = "根据对话记录计算覆盖情况、已知家庭事实和禁止话题")
    @PostMapping("/directive")
    public Directive directive(@RequestBody @Valid DirectiveQueryDTO request) {
        return roleplayService.directive(request);
    }

    @Operation(summary = "对话回合", description = "提交学生消息，返回对话伙伴的回复与本轮指令")
    @PostMapping("/turn")
    public RoleplayReplyVO turn(@RequestBody @Valid RoleplayTurnDTO request) {
        return roleplayService.turn(request);
    }

    @Operation(summary = "英文释义", description = "将对话伙伴的中文回复翻译为简短英文")
    @PostMapping("/translate")
    public TranslateVO translate(@RequestBody @Valid TranslateDTO request) {
        return roleplayService.translate(request);
    }

    @Operation(summary = "总结反馈", description = "根据最近的对话记录生成鼓励性的学习反馈")
    @PostMapping("/feedback")
    public RoleplayFeedbackVO feedback(@RequestBody @Valid RoleplayFeedbackDTO request) {
        return roleplayService.feedback(request);
    }

    @Operation(summary = "自由对话", description = "不绑定单元，与李爱进行简短的中文对话")
    @PostMapping("/chat")
    public ChatVO chat(@RequestBody @Valid ChatDTO request) {
        return roleplayService.chat(request);
    }
}
