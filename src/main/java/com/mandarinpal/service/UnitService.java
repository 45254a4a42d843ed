package com.mandarinpal.service;

import com.mandarinpal.model.vo.UnitVO;

import java.util.List;

/**
 * 单元服务
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
public interface UnitService {

    /**
     * 列出所有单元
     *
     * @return 单元概要列表
     */
    List<UnitVO> listUnits();

    /**
     * 获取单元的目标问题
     *
     * @param unitId 单元ID
     * @return 按顺序排列的目标问题
     */
    List<String> getQuestions(String unitId);
}
