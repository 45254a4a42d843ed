package com.mandarinpal.utils;

import cn.hutool.core.util.StrUtil;

import java.util.Collection;

/**
 * 回复文本处理工具类
 *
 * @author MandarinPal
 */
public class ReplyTextUtils {

    private ReplyTextUtils() {
    }

    /**
     * 道歉统一用“对不起”，替换“抱歉”及“很抱歉”“真抱歉”等变体
     */
    public static String normalizeApologies(String text) {
        if (StrUtil.isEmpty(text)) {
            return text;
        }
        return text.replace("抱歉", "对不起");
    }

    /**
     * 文本中是否包含任意一个标记词
     */
    public static boolean containsAnyToken(String text, Collection<String> tokens) {
        if (StrUtil.isEmpty(text) || tokens == null || tokens.isEmpty()) {
            return false;
        }
        return StrUtil.containsAny(text, tokens.toArray(new String[0]));
    }
}
