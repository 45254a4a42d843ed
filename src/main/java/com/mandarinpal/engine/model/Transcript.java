package com.mandarinpal.engine.model;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 完整对话记录
 *
 * <p>每次调用都由调用方整体传入，引擎从不持有或增量更新它。
 * 构建时跳过缺少角色或文本的记录。</p>
 *
 * @author MandarinPal
 * @since 2025-03-02
 */
@Slf4j
@ToString
@EqualsAndHashCode
public final class Transcript {

    private static final Transcript EMPTY = new Transcript(List.of());

    private final List<Turn> turns;

    private Transcript(List<Turn> turns) {
        this.turns = List.copyOf(turns);
    }

    public static Transcript empty() {
        return EMPTY;
    }

    public static Transcript of(Turn... turns) {
        return of(List.of(turns));
    }

    public static Transcript of(Collection<Turn> turns) {
        if (turns == null || turns.isEmpty()) {
            return EMPTY;
        }
        List<Turn> accepted = new ArrayList<>(turns.size());
        int skipped = 0;
        for (Turn turn : turns) {
            if (turn != null && turn.isWellFormed()) {
                accepted.add(turn);
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("跳过格式错误的对话记录: skipped={}, accepted={}", skipped, accepted.size());
        }
        return new Transcript(accepted);
    }

    public List<Turn> getTurns() {
        return turns;
    }

    public int size() {
        return turns.size();
    }

    /**
     * 追加一条记录，返回新的对话记录
     */
    public Transcript append(Turn turn) {
        List<Turn> copy = new ArrayList<>(turns);
        copy.add(turn);
        return of(copy);
    }

    /**
     * 最近 n 条记录
     */
    public Transcript lastTurns(int n) {
        if (n >= turns.size()) {
            return this;
        }
        return new Transcript(turns.subList(turns.size() - Math.max(n, 0), turns.size()));
    }

    /**
     * 双方全部文本，逐行拼接
     */
    public String joinedText() {
        return turns.stream()
            .map(turn -> turn.getText().strip())
            .collect(Collectors.joining("\n"));
    }

    /**
     * 仅学生文本，全角空格归一化后逐行拼接
     */
    public String normalizedStudentText() {
        String text = turns.stream()
            .filter(Turn::isStudent)
            .map(turn -> turn.getText().strip())
            .collect(Collectors.joining("\n"));
        return normalize(text);
    }

    static String normalize(String text) {
        return text.replace('\u3000', ' ').strip();
    }
}
