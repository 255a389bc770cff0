package org.ledavis.exchange;

import org.ledavis.exchange.diagnostics.ValidationException;
import org.ledavis.exchange.index.EntityIndexer;
import org.ledavis.exchange.model.CanonicalFile;
import org.ledavis.exchange.model.EntityInstance;
import org.ledavis.exchange.model.ExchangeModel;
import org.ledavis.exchange.parser.Canonicalizer;
import org.ledavis.exchange.parser.Lexer;
import org.ledavis.exchange.parser.NormalizedText;
import org.ledavis.exchange.parser.Part21Parser;
import org.ledavis.exchange.parser.Preprocessor;
import org.ledavis.exchange.parser.SourceLines;
import org.ledavis.exchange.parser.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * 交换文件读取入口：预处理 -> 词法/语法分析 -> 规范化 -> 建索引。
 * <p>
 * 单线程、整文件、一次性完成；每一步都消费上一步的完整输出。任一步骤出现校验错误即终止，
 * 不返回部分模型。
 * <ul>
 *   <li>{@link #parse(String)}：出错时抛出 {@link ValidationException}</li>
 *   <li>{@link #read(String)}：出错时返回 {@link ReadResult#invalid(ValidationException)}，由调用方显式分支</li>
 * </ul>
 */
public final class Part21Reader {

    private static final Logger log = LoggerFactory.getLogger(Part21Reader.class);

    private Part21Reader() {
    }

    public enum Stage {
        PREPROCESS,
        PARSE,
        CANONICALIZE,
        INDEX
    }

    /**
     * 阶段完成回调（CLI 的 {@code --progress} 使用）。
     */
    @FunctionalInterface
    public interface ProgressListener {

        ProgressListener NONE = (stage, elapsed) -> {
        };

        void stageCompleted(Stage stage, Duration elapsed);
    }

    public static ReadResult read(String text) {
        return read(text, ProgressListener.NONE);
    }

    public static ReadResult read(String text, ProgressListener progress) {
        try {
            return ReadResult.valid(parse(text, progress));
        } catch (ValidationException e) {
            return ReadResult.invalid(e);
        }
    }

    public static ExchangeModel parse(String text) {
        return parse(text, ProgressListener.NONE);
    }

    public static ExchangeModel parse(String text, ProgressListener progress) {
        ProgressListener listener = (progress == null) ? ProgressListener.NONE : progress;
        SourceLines lines = new SourceLines(text);

        long started = System.nanoTime();
        NormalizedText normalized = Preprocessor.normalize(lines.text());
        started = completed(listener, Stage.PREPROCESS, started);

        SyntaxNode tree;
        try {
            tree = new Part21Parser(new Lexer(normalized, lines), lines).parseFile();
        } catch (ValidationException e) {
            log.info("语法错误（第 {} 行）：{}", e.lineNumber(), reason(e.getMessage()));
            throw e;
        }
        started = completed(listener, Stage.PARSE, started);

        CanonicalFile canonical = Canonicalizer.canonicalize(tree);
        started = completed(listener, Stage.CANONICALIZE, started);

        Map<Long, EntityInstance> index;
        try {
            index = EntityIndexer.index(canonical.entities(), lines);
        } catch (ValidationException e) {
            log.info("实例重名（第 {} 行）：{}", e.lineNumber(), reason(e.getMessage()));
            throw e;
        }
        completed(listener, Stage.INDEX, started);

        log.debug("解析完成：{} 行，HEADER {} 条，DATA 实例 {} 个", lines.lineCount(), canonical.header().size(), index.size());
        return new ExchangeModel(canonical.header(), index);
    }

    private static long completed(ProgressListener listener, Stage stage, long started) {
        long now = System.nanoTime();
        Duration elapsed = Duration.ofNanos(now - started);
        log.debug("{} 完成，用时 {} ms", stage, elapsed.toMillis());
        listener.stageCompleted(stage, elapsed);
        return now;
    }

    // 报错文本的第二行是原因（第一行是位置）
    private static String reason(String message) {
        String[] parts = message.split("\n", 3);
        return (parts.length > 1) ? parts[1] : message;
    }
}
