package com.mandarinpal.controller;

import com.mandarinpal.model.vo.UnitVO;
import com.mandarinpal.service.UnitService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 单元与问题目录
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Tag(name = "单元目录", description = "查询课程单元及其目标问题")
@RestController
@RequestMapping("/api/units")
@RequiredArgsConstructor
public class UnitController {

    private final UnitService unitService;

    @Operation(summary = "单元列表")
    @GetMapping
    public List<UnitVO> listUnits() {
        return unitService.listUnits();
    }

    @Operation(summary = "单元目标问题", description = "按顺序返回单元的目标问题")
    @GetMapping("/{unitId}/questions")
    public List<String> getQuestions(@Parameter(description = "单元ID") @PathVariable String unitId) {
        return unitService.getQuestions(unitId);
    }
}
