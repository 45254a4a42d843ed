package com.mandarinpal.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 总结反馈
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "总结反馈")
public class RoleplayFeedbackVO {

    @Schema(description = "单元ID")
    private String unitId;

    @Schema(description = "反馈内容")
    private String feedback;
}
