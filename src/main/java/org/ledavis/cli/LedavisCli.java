package org.ledavis.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.ledavis.exchange.Part21Reader;
import org.ledavis.exchange.diagnostics.ValidationException;
import org.ledavis.exchange.files.ExchangeFileReader;
import org.ledavis.exchange.graph.EntityGraph;
import org.ledavis.exchange.graph.GraphBuilder;
import org.ledavis.exchange.graph.NodeStyler;
import org.ledavis.exchange.model.EntityIds;
import org.ledavis.exchange.model.ExchangeModel;
import org.ledavis.exchange.render.GraphRenderer;
import org.ledavis.exchange.render.VisNetworkHtmlRenderer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * 命令行入口：读取交换文件并把引用图渲染为 HTML。
 * <p>
 * 退出码：0 成功；1 校验错误或输入文件不可用；2 命令行用法错误。
 * {@code --json} 模式下标准输出只包含诊断记录，其余输出都走标准错误。
 */
@Command(
        name = "ledavis",
        mixinStandardHelpOptions = true,
        version = "ledavis 0.1.0",
        description = "Parses an ISO 10303-21 exchange file and renders its entity reference graph as HTML."
)
public class LedavisCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "INPUT", description = "Exchange file (.stp, .step, .p21, .ifc).")
    Path input;

    @Parameters(index = "1", paramLabel = "OUTPUT", description = "HTML file to write.")
    Path output;

    @Parameters(index = "2", arity = "0..1", paramLabel = "ENTITY",
            description = "Entity id (12 or #12); renders only the graph reachable from it.")
    String entity;

    @Option(names = "--json", description = "Report validation errors as a JSON record on stdout.")
    boolean json;

    @Option(names = "--progress", description = "Print the completion time of each stage to stderr.")
    boolean progress;

    @Option(names = "--max-bytes", defaultValue = "67108864", description = "Largest input file accepted (default: ${DEFAULT-VALUE}).")
    long maxBytes;

    @Option(names = "--title-width", defaultValue = "100", description = "Soft-wrap width of node titles (default: ${DEFAULT-VALUE}).")
    int titleWidth;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public static void main(String[] args) {
        // 必须在任何 Logger 创建之前设置，CLI 的日志只写 stderr
        if (System.getProperty("logback.configurationFile") == null) {
            System.setProperty("logback.configurationFile", "logback-cli.xml");
        }
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new LedavisCli());
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        long started = System.nanoTime();
        int exitCode = run(out, err);
        err.println();
        err.println("Elapsed time: " + formatDuration(Duration.ofNanos(System.nanoTime() - started)));
        err.flush();
        out.flush();
        return exitCode;
    }

    private int run(PrintWriter out, PrintWriter err) {
        if (!Files.isRegularFile(input)) {
            err.println("Error: No such file " + input);
            return EXIT_INVALID;
        }
        Long root;
        try {
            root = (entity == null) ? null : EntityIds.parse(entity);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID;
        }

        ExchangeModel model;
        try {
            ExchangeFileReader.DecodedText decoded = new ExchangeFileReader(maxBytes).read(input);
            decoded.warnings().forEach(w -> err.println("Warning: " + w));
            Part21Reader.ProgressListener listener = progress
                    ? (stage, elapsed) -> err.println(stage.name().toLowerCase(Locale.ROOT) + " done in " + formatDuration(elapsed))
                    : Part21Reader.ProgressListener.NONE;
            model = Part21Reader.parse(decoded.text(), listener);
        } catch (ValidationException e) {
            report(e, out, err);
            return EXIT_INVALID;
        } catch (IllegalArgumentException | IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID;
        }

        GraphBuilder builder = new GraphBuilder(new NodeStyler(titleWidth));
        EntityGraph graph = (root == null) ? builder.complete(model) : builder.rooted(model, root);
        GraphRenderer renderer = new VisNetworkHtmlRenderer(objectMapper);
        try {
            renderer.render(graph, output);
        } catch (IOException e) {
            err.println("Error: cannot write " + output + ": " + e.getMessage());
            return EXIT_INVALID;
        }
        if (progress) {
            err.println("render done: " + graph.nodeCount() + " nodes, " + graph.edgeCount() + " edges");
        }
        return EXIT_OK;
    }

    private void report(ValidationException e, PrintWriter out, PrintWriter err) {
        if (!json) {
            err.println(e.getMessage());
            return;
        }
        try {
            out.print(objectMapper.writeValueAsString(e.toDiagnostic()));
        } catch (IOException ioe) {
            throw new IllegalStateException("无法序列化诊断记录", ioe);
        }
    }

    static String formatDuration(Duration duration) {
        long millis = duration.toMillis();
        return String.format(Locale.ROOT, "%d.%03ds", millis / 1000, millis % 1000);
    }
}
