package com.mandarinpal.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 自由对话回复
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "自由对话回复")
public class ChatVO {

    @Schema(description = "李爱的回复")
    private String response;
}
