package com.mandarinpal.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 角色扮演回合请求
 *
 * <p>服务端不保存会话，每次都需要带上完整的对话历史。</p>
 */
@Data
@Schema(description = "角色扮演回合请求")
public class RoleplayTurnDTO {

    @Schema(description = "单元ID", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "单元ID不能为空")
    private String unitId;

    @Schema(description = "学生本轮消息", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "消息内容不能为空")
    private String message;

    @Schema(description = "学生姓名(可选)")
    private String studentName;

    @Schema(description = "本轮之前的完整对话历史")
    private List<TurnDTO> history = new ArrayList<>();
}
