package org.ledavis.exchange.model;

/**
 * 实例 id 的文本形式：接受 {@code 12} 或 {@code #12}。
 */
public final class EntityIds {

    private EntityIds() {
    }

    public static long parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("实例 id 不能为空");
        }
        String digits = text.trim();
        if (digits.startsWith("#")) {
            digits = digits.substring(1);
        }
        if (digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new IllegalArgumentException("无效的实例 id：" + text);
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("实例 id 超出范围：" + text, e);
        }
    }
}
