package com.mandarinpal.controller;

import com.mandarinpal.config.RoleplayProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 健康检查与版本
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Tag(name = "系统", description = "健康检查与版本信息")
@RestController
@RequiredArgsConstructor
public class SystemController {

    private final RoleplayProperties roleplayProperties;

    @Operation(summary = "健康检查")
    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "ok");
        status.put("time", LocalDateTime.now().toString());
        return status;
    }

    @Operation(summary = "版本信息")
    @GetMapping("/version")
    public Map<String, String> version() {
        return Map.of("version", roleplayProperties.getVersion());
    }
}
