package com.mandarinpal.engine;

import com.mandarinpal.Exception.UnitNotFoundException;
import com.mandarinpal.engine.model.Question;
import com.mandarinpal.engine.model.Unit;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 单元问题目录
 *
 * <p>启动时构建一次，之后只读，可被任意多个请求并发读取。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
public class QuestionCatalog {

    private final Map<String, Unit> units;

    private final List<Unit> order;

    public QuestionCatalog(Collection<Unit> units) {
        Map<String, Unit> byId = new LinkedHashMap<>();
        for (Unit unit : units) {
            if (unit.getId() == null || unit.getId().isBlank()) {
                throw new IllegalArgumentException("单元ID不能为空");
            }
            if (unit.getQuestions().isEmpty()) {
                throw new IllegalArgumentException("单元没有配置目标问题: " + unit.getId());
            }
            if (byId.put(unit.getId(), unit) != null) {
                throw new IllegalArgumentException("单元ID重复: " + unit.getId());
            }
        }
        this.units = Map.copyOf(byId);
        this.order = List.copyOf(byId.values());
        log.info("问题目录加载完成: units={}", byId.keySet());
    }

    /**
     * 获取单元的目标问题，保持配置顺序
     *
     * @param unitId 单元ID
     * @return 目标问题
     * @throws UnitNotFoundException 单元不存在
     */
    public List<Question> getQuestions(String unitId) {
        return getUnit(unitId).getQuestions();
    }

    public Unit getUnit(String unitId) {
        Unit unit = unitId == null ? null : units.get(unitId);
        if (unit == null) {
            throw new UnitNotFoundException(unitId);
        }
        return unit;
    }

    public List<Unit> listUnits() {
        return order;
    }
}
