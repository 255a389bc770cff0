package org.ledavis.exchange.parser;

/**
 * 词法分析前的预处理。
 * <ul>
 *   <li>去掉 <code>/&#42; ... &#42;/</code> 块注释，但注释里的换行原样保留，保证后续报错的行号不变</li>
 *   <li>字符串字面量（{@code '...'}）之外，去掉除换行以外的所有空白</li>
 *   <li>字符串内部一律不动（字符串对空白敏感）</li>
 * </ul>
 * 不做任何其他语义转换：未闭合的注释/字符串原样保留，交给词法/语法分析报错。
 * <p>
 * 由于去空白会改变列号，这里同时记录每个输出字符在原文中的偏移（见 {@link NormalizedText}），
 * 词法分析据此把 token 位置换算回原文的行/列。
 */
public final class Preprocessor {

    private Preprocessor() {
    }

    public static NormalizedText normalize(String source) {
        String text = (source == null) ? "" : source;
        int len = text.length();
        StringBuilder out = new StringBuilder(len);
        int[] offsets = new int[len + 1];
        int n = 0;

        int i = 0;
        while (i < len) {
            char c = text.charAt(i);

            if (c == '/' && i + 1 < len && text.charAt(i + 1) == '*') {
                int close = text.indexOf("*/", i + 2);
                if (close >= 0) {
                    for (int k = i; k < close + 2; k++) {
                        if (text.charAt(k) == '\n') {
                            out.append('\n');
                            offsets[n++] = k;
                        }
                    }
                    i = close + 2;
                    continue;
                }
            }

            if (c == '\'') {
                // 字符串：原样复制到闭合引号为止；'' 转义会被视为“闭合 + 立即重新打开”，结果相同
                int stop = stringEnd(text, i);
                for (int k = i; k < stop; k++) {
                    out.append(text.charAt(k));
                    offsets[n++] = k;
                }
                i = stop;
                continue;
            }

            if (c != '\n' && isInsignificantWhitespace(c)) {
                i++;
                continue;
            }

            out.append(c);
            offsets[n++] = i;
            i++;
        }
        offsets[n] = len;

        int[] trimmed = new int[n + 1];
        System.arraycopy(offsets, 0, trimmed, 0, n + 1);
        return new NormalizedText(out.toString(), trimmed);
    }

    /**
     * 返回从 {@code start} 处引号开始的字符串之后的位置；未闭合时返回文本长度。
     * {@code \\} 与 {@code \S\} 后紧跟的字符（可以是引号）与词法分析一样整体跳过。
     */
    static int stringEnd(String text, int start) {
        int len = text.length();
        int k = start + 1;
        while (k < len) {
            char c = text.charAt(k);
            if (c == '\'') {
                return k + 1;
            }
            if (text.startsWith("\\\\", k)) {
                k += 2;
            } else if (text.startsWith("\\S\\", k) && k + 3 < len) {
                k += 4;
            } else {
                k++;
            }
        }
        return len;
    }

    private static boolean isInsignificantWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B';
    }
}
