package com.mandarinpal.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 自由对话请求
 */
@Data
@Schema(description = "自由对话请求")
public class ChatDTO {

    @Schema(description = "本轮消息", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "消息内容不能为空")
    private String message;

    @Schema(description = "本轮之前的对话历史")
    private List<TurnDTO> conversation = new ArrayList<>();
}
