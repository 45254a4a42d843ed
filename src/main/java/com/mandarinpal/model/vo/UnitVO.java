package com.mandarinpal.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 单元概要
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "单元概要")
public class UnitVO {

    @Schema(description = "单元ID")
    private String id;

    @Schema(description = "单元标题")
    private String title;

    @Schema(description = "学习目标")
    private List<String> objectives;
}
