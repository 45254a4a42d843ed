package com.mandarinpal.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对话历史中的一条记录
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "对话记录")
public class TurnDTO {

    @Schema(description = "角色: student/user 或 partner/assistant")
    private String role;

    @Schema(description = "文本内容")
    private String content;
}
