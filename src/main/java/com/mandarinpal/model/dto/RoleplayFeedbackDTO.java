package com.mandarinpal.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 总结反馈请求
 */
@Data
@Schema(description = "总结反馈请求")
public class RoleplayFeedbackDTO {

    @Schema(description = "单元ID", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "单元ID不能为空")
    private String unitId;

    @Schema(description = "完整对话历史")
    private List<TurnDTO> history = new ArrayList<>();
}
