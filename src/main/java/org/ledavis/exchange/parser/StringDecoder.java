package org.ledavis.exchange.parser;

import java.nio.charset.Charset;

/**
 * Part 21 字符串字面量解码：把转义与控制指令还原为真实字符。
 * <p>
 * 支持的形式：
 * <ul>
 *   <li>{@code ''} -> {@code '}；{@code \\} -> {@code \}</li>
 *   <li>{@code \S\c}：当前代码页（默认 ISO 8859-1）中码位 {@code c + 128} 的字符</li>
 *   <li>{@code \PA\} .. {@code \PI\}：切换 {@code \S\} 使用的代码页为 ISO 8859-1 .. ISO 8859-9</li>
 *   <li>{@code \X\hh}：单字节十六进制（ISO 8859-1）</li>
 *   <li>{@code \X2\....\X0\}：UCS-2（每 4 位十六进制一个 16-bit 单元）</li>
 *   <li>{@code \X4\........\X0\}：UCS-4（每 8 位十六进制一个码点）</li>
 * </ul>
 * 示例：{@code '\X2\4E2D6587\X0\'} -> "中文"。
 * <p>
 * 字符串中的换行属于排版，不是内容，解码时丢弃。不构成已知指令的反斜杠按原样保留。
 */
public final class StringDecoder {

    private StringDecoder() {
    }

    /**
     * @param raw 去掉首尾引号之后的字符串原文
     */
    public static String decode(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        if (raw.indexOf('\\') < 0 && raw.indexOf('\'') < 0 && raw.indexOf('\n') < 0 && raw.indexOf('\r') < 0) {
            return raw;
        }

        StringBuilder out = new StringBuilder(raw.length());
        Charset page = pageCharset('A');
        int len = raw.length();
        int i = 0;
        while (i < len) {
            char c = raw.charAt(i);
            if (c == '\n' || c == '\r') {
                i++;
                continue;
            }
            if (c == '\'') {
                out.append('\'');
                // '' 中的第二个引号
                i += (i + 1 < len && raw.charAt(i + 1) == '\'') ? 2 : 1;
                continue;
            }
            if (c != '\\') {
                out.append(c);
                i++;
                continue;
            }

            if (raw.startsWith("\\\\", i)) {
                out.append('\\');
                i += 2;
                continue;
            }
            if (raw.startsWith("\\S\\", i) && i + 3 < len) {
                char base = raw.charAt(i + 3);
                if (base < 128) {
                    byte[] single = {(byte) (base + 128)};
                    out.append(new String(single, page));
                } else {
                    out.append(base);
                }
                i += 4;
                continue;
            }
            if (raw.startsWith("\\P", i) && i + 3 < len && raw.charAt(i + 3) == '\\'
                    && raw.charAt(i + 2) >= 'A' && raw.charAt(i + 2) <= 'I') {
                page = pageCharset(raw.charAt(i + 2));
                i += 4;
                continue;
            }
            if ((raw.startsWith("\\X2\\", i) || raw.startsWith("\\X4\\", i))) {
                int seqStart = i + 4;
                int endMarker = raw.indexOf("\\X0\\", seqStart);
                if (endMarker > 0) {
                    String decoded = decodeHexSequence(raw.substring(seqStart, endMarker), raw.charAt(i + 2));
                    if (decoded != null) {
                        out.append(decoded);
                        i = endMarker + 4;
                        continue;
                    }
                }
            }
            if (raw.startsWith("\\X\\", i) && i + 4 < len) {
                int b = hexByte(raw.charAt(i + 3), raw.charAt(i + 4));
                if (b >= 0) {
                    out.append((char) b);
                    i += 5;
                    continue;
                }
            }

            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static Charset pageCharset(char page) {
        return Charset.forName("ISO-8859-" + (page - 'A' + 1));
    }

    private static String decodeHexSequence(String hex, char mode) {
        int group = (mode == '4') ? 8 : 4;
        if (hex.length() % group != 0) {
            return null;
        }
        StringBuilder out = new StringBuilder(hex.length() / group);
        for (int i = 0; i < hex.length(); i += group) {
            int codePoint;
            try {
                codePoint = Integer.parseUnsignedInt(hex.substring(i, i + group), 16);
            } catch (NumberFormatException e) {
                return null;
            }
            if (mode == '4') {
                if (!Character.isValidCodePoint(codePoint)) {
                    return null;
                }
                out.appendCodePoint(codePoint);
            } else {
                out.append((char) codePoint);
            }
        }
        return out.toString();
    }

    private static int hexByte(char hi, char lo) {
        int a = Character.digit(hi, 16);
        int b = Character.digit(lo, 16);
        if (a < 0 || b < 0) {
            return -1;
        }
        return (a << 4) | b;
    }
}
