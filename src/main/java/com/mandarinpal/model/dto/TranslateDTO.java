package com.mandarinpal.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 英文释义请求
 */
@Data
@Schema(description = "英文释义请求")
public class TranslateDTO {

    @Schema(description = "对话伙伴的一句话(中文+拼音)", requiredMode = Schema.RequiredMode.REQUIRED)
    @NotBlank(message = "待翻译文本不能为空")
    private String text;
}
