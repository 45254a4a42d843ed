package com.mandarinpal.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 角色扮演开场
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "角色扮演开场")
public class RoleplayStartVO {

    @Schema(description = "单元ID")
    private String unitId;

    @Schema(description = "问候语")
    private String greeting;

    @Schema(description = "第一个问题")
    private String firstQuestion;

    @Schema(description = "问候语 + 第一个问题")
    private String opening;
}
