package org.ledavis.exchange.files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 整文件读取交换文件并解码。
 * <p>
 * 交换文件在中文环境里可能是 UTF-8，也可能是 GBK/GB18030：
 * <ul>
 *   <li>UTF-8 合法：直接按 UTF-8 解码</li>
 *   <li>否则按 GB18030 解码（非法字节替换为替换字符），并给出告警</li>
 * </ul>
 * 文件不存在、不是普通文件或超过大小上限属于环境错误，抛出 {@link IllegalArgumentException}；
 * 读取失败抛出 {@link IllegalStateException}。
 */
public final class ExchangeFileReader {

    private static final Logger log = LoggerFactory.getLogger(ExchangeFileReader.class);

    static final Charset FALLBACK_CHARSET = Charset.forName("GB18030");

    private final long maxBytes;

    public ExchangeFileReader(long maxBytes) {
        if (maxBytes < 1) {
            throw new IllegalArgumentException("maxBytes 必须大于 0：" + maxBytes);
        }
        this.maxBytes = maxBytes;
    }

    /**
     * 解码结果。
     *
     * @param text        解码后的全文
     * @param decodedWith 使用的字符集名称
     * @param warnings    非致命告警（例如回退到 GB18030）
     */
    public record DecodedText(String text, String decodedWith, List<String> warnings) {
    }

    public DecodedText read(Path file) {
        if (!Files.exists(file)) {
            throw new IllegalArgumentException("文件不存在：" + file);
        }
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("不是普通文件：" + file);
        }
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new IllegalStateException("读取文件大小失败：" + file, e);
        }
        if (size > maxBytes) {
            throw new IllegalArgumentException("文件过大（" + size + " 字节，上限 " + maxBytes + " 字节）：" + file);
        }

        byte[] bytes;
        try (InputStream in = Files.newInputStream(file)) {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + file, e);
        }
        DecodedText decoded = decode(bytes);
        log.debug("读取 {}：{} 字节，按 {} 解码", file, bytes.length, decoded.decodedWith());
        return decoded;
    }

    static DecodedText decode(byte[] bytes) {
        List<String> warnings = new ArrayList<>();
        if (bytes.length == 0) {
            return new DecodedText("", StandardCharsets.UTF_8.name(), warnings);
        }
        var strict = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return new DecodedText(strict.decode(ByteBuffer.wrap(bytes)).toString(), StandardCharsets.UTF_8.name(), warnings);
        } catch (CharacterCodingException e) {
            log.debug("不是有效 UTF-8，改用 {} 解码", FALLBACK_CHARSET.name());
        }

        var lenient = FALLBACK_CHARSET.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        String text;
        try {
            text = lenient.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            // REPLACE 模式下不会走到这里
            throw new IllegalStateException("按 " + FALLBACK_CHARSET.name() + " 解码失败", e);
        }
        warnings.add("文件不是有效 UTF-8，已使用 " + FALLBACK_CHARSET.name() + " 解码。");
        return new DecodedText(text, FALLBACK_CHARSET.name(), warnings);
    }
}
