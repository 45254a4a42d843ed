package com.mandarinpal.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 英文释义
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "英文释义")
public class TranslateVO {

    @Schema(description = "英文释义")
    private String english;
}
