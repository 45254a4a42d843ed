package com.mandarinpal.service;

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

/**
 * 角色扮演服务接口
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
public interface RoleplayService {

    /**
     * 开场问候与第一个问题
     *
     * @param request 开始请求
     * @return 开场内容
     */
    RoleplayStartVO start(RoleplayStartDTO request);

    /**
     * 根据完整对话历史计算当前指令
     *
     * @param request 单元与对话历史
     * @return 指令
     */
    Directive directive(DirectiveQueryDTO request);

    /**
     * 生成对话伙伴的一轮回复
     *
     * @param request 本轮消息与完整历史
     * @return 回复
     */
    RoleplayReplyVO turn(RoleplayTurnDTO request);

    /**
     * 英文释义
     *
     * @param request 待翻译文本
     * @return 英文释义
     */
    TranslateVO translate(TranslateDTO request);

    /**
     * 对话结束后的总结反馈
     *
     * @param request 单元与对话历史
     * @return 反馈
     */
    RoleplayFeedbackVO feedback(RoleplayFeedbackDTO request);

    /**
     * 单元之外的自由对话
     *
     * @param request 本轮消息与之前的对话
     * @return 回复
     */
    ChatVO chat(ChatDTO request);
}
