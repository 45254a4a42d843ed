package com.mandarinpal.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 开始角色扮演请求
 */
@Data
@Schema(description = "开始角色扮演请求")
public class RoleplayStartDTO {

    @Schema(description = "单元ID", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "单元ID不能为空")
    private String unitId;
}
