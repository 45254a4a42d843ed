package com.mandarinpal.Exception;

import lombok.Getter;
import top.continew.starter.core.exception.BusinessException;

/**
 * 单元不存在
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Getter
public class UnitNotFoundException extends BusinessException {

    private final String unitId;

    public UnitNotFoundException(String unitId) {
        super("单元不存在: " + unitId);
        this.unitId = unitId;
    }
}
