package com.mandarinpal.utils;

import com.mandarinpal.engine.model.Transcript;
import com.mandarinpal.engine.model.Turn;
import com.mandarinpal.engine.model.TurnRole;
import com.mandarinpal.model.dto.TurnDTO;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 对话记录转换工具类
 *
 * @author MandarinPal
 */
public class TranscriptUtils {

    private TranscriptUtils() {
    }

    /**
     * 前端历史 → 对话记录
     * 角色无法识别或内容为空的记录会被跳过
     *
     * @param history 前端传入的历史
     * @return 对话记录
     */
    public static Transcript toTranscript(List<TurnDTO> history) {
        if (history == null || history.isEmpty()) {
            return Transcript.empty();
        }
        return Transcript.of(history.stream()
            .filter(Objects::nonNull)
            .map(dto -> new Turn(TurnRole.fromWire(dto.getRole()), dto.getContent()))
            .toList());
    }

    /**
     * 格式化为 "user: ..." / "assistant: ..." 的逐行文本
     */
    public static String format(Transcript transcript) {
        return transcript.getTurns().stream()
            .map(turn -> turn.getRole().getChatAlias() + ": " + turn.getText().strip())
            .collect(Collectors.joining("\n"));
    }
}
