package com.mandarinpal.model.vo;

import com.mandarinpal.engine.model.Directive;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 角色扮演回复
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "角色扮演回复")
public class RoleplayReplyVO {

    @Schema(description = "单元ID")
    private String unitId;

    @Schema(description = "对话伙伴回复")
    private String reply;

    @Schema(description = "是否为道别回复")
    private Boolean farewell;

    @Schema(description = "本轮使用的指令，道别时为空")
    private Directive directive;

    @Schema(description = "响应时间")
    private LocalDateTime timestamp;
}
