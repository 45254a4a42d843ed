package com.mandarinpal.service.impl;

import com.mandarinpal.engine.QuestionCatalog;
import com.mandarinpal.engine.model.Question;
import com.mandarinpal.model.vo.UnitVO;
import com.mandarinpal.service.UnitService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 单元服务实现
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Service
@RequiredArgsConstructor
public class UnitServiceImpl implements UnitService {

    private final QuestionCatalog questionCatalog;

    @Override
    public List<UnitVO> listUnits() {
        return questionCatalog.listUnits().stream()
            .map(unit -> UnitVO.builder()
                .id(unit.getId())
                .title(unit.getTitle())
                .objectives(unit.getObjectives())
                .build())
            .toList();
    }

    @Override
    public List<String> getQuestions(String unitId) {
        return questionCatalog.getQuestions(unitId).stream()
            .map(Question::getText)
            .toList();
    }
}
