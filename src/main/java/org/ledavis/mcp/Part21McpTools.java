package org.ledavis.mcp;

import org.ledavis.exchange.Part21Reader;
import org.ledavis.exchange.ReadResult;
import org.ledavis.exchange.dto.AllowedRootsResult;
import org.ledavis.exchange.dto.EntityListResult;
import org.ledavis.exchange.dto.GraphEdgeItem;
import org.ledavis.exchange.dto.GraphNodeItem;
import org.ledavis.exchange.dto.GraphResult;
import org.ledavis.exchange.dto.ModelInfoResult;
import org.ledavis.exchange.dto.RenderResult;
import org.ledavis.exchange.dto.ValidationResult;
import org.ledavis.exchange.files.ExchangeFileProperties;
import org.ledavis.exchange.files.ExchangeFileReader;
import org.ledavis.exchange.files.SecurePathResolver;
import org.ledavis.exchange.graph.EntityGraph;
import org.ledavis.exchange.graph.GraphBuilder;
import org.ledavis.exchange.graph.GraphEdge;
import org.ledavis.exchange.graph.GraphNode;
import org.ledavis.exchange.inspect.HeaderSummary;
import org.ledavis.exchange.inspect.ModelStatistics;
import org.ledavis.exchange.model.EntityIds;
import org.ledavis.exchange.model.ExchangeModel;
import org.ledavis.exchange.render.GraphRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 交换文件（ISO 10303-21）MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出根目录白名单（{@code p21_list_roots}）</li>
 *   <li>语法与重名校验（{@code p21_validate}）</li>
 *   <li>HEADER 信息与实体类型统计（{@code p21_read_model_info}）</li>
 *   <li>实体分页列表（{@code p21_list_entities}）</li>
 *   <li>引用图：内联返回（{@code p21_build_graph}）或渲染为 HTML（{@code p21_render_graph}）</li>
 * </ul>
 * 每次调用都完整解析文件；模型不跨调用缓存。
 */
@Component
public class Part21McpTools {

    private static final Logger log = LoggerFactory.getLogger(Part21McpTools.class);

    private static final List<String> EXCHANGE_EXTENSIONS = List.of(".stp", ".step", ".p21", ".ifc");
    private static final int MAX_PRODUCT_NAMES = 50;

    private final ExchangeFileProperties properties;
    private final SecurePathResolver pathResolver;
    private final ExchangeFileReader fileReader;
    private final GraphBuilder graphBuilder;
    private final GraphRenderer renderer;

    public Part21McpTools(
            ExchangeFileProperties properties,
            SecurePathResolver pathResolver,
            ExchangeFileReader fileReader,
            GraphBuilder graphBuilder,
            GraphRenderer renderer
    ) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.fileReader = fileReader;
        this.graphBuilder = graphBuilder;
        this.renderer = renderer;
    }

    @Tool(
            name = "p21_list_roots",
            description = "列出 MCP Server 允许访问的根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "p21_validate",
            description = "校验 ISO 10303-21 交换文件（.stp/.step/.p21/.ifc）的语法与实例重名；失败时返回结构化诊断（行号、列号、期望的终结符、格式化文本）。"
    )
    public ValidationResult validate(
            @ToolParam(required = false, description = "rootId（可从 p21_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "交换文件路径（相对 rootId 或绝对路径）") String path
    ) {
        Loaded loaded = load(rootId, path);
        ReadResult result = loaded.result();
        if (!result.isValid()) {
            return new ValidationResult(
                    loaded.resolved().rootId(),
                    loaded.resolved().displayPath(),
                    loaded.decoded().decodedWith(),
                    false,
                    null,
                    null,
                    result.diagnostic(),
                    warningsOrNull(loaded.warnings())
            );
        }
        ExchangeModel model = result.model();
        return new ValidationResult(
                loaded.resolved().rootId(),
                loaded.resolved().displayPath(),
                loaded.decoded().decodedWith(),
                true,
                model.header().size(),
                model.size(),
                null,
                warningsOrNull(loaded.warnings())
        );
    }

    @Tool(
            name = "p21_read_model_info",
            description = "读取交换文件的 HEADER 信息（FILE_DESCRIPTION/FILE_NAME/FILE_SCHEMA）与 DATA 段实体类型统计。文件无效时返回诊断文本。"
    )
    public ModelInfoResult readModelInfo(
            @ToolParam(required = false, description = "rootId（可从 p21_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "交换文件路径（相对 rootId 或绝对路径）") String path
    ) {
        Loaded loaded = load(rootId, path);
        ExchangeModel model = requireValid(loaded);

        List<String> warnings = new ArrayList<>(loaded.warnings());
        HeaderSummary header = HeaderSummary.of(model);
        if (header.warnings() != null) {
            warnings.addAll(header.warnings());
        }
        int dangling = ModelStatistics.danglingReferences(model).size();
        if (dangling > 0) {
            warnings.add("存在 " + dangling + " 个悬空引用（被引用但未定义的实例）。");
        }
        return new ModelInfoResult(
                loaded.resolved().rootId(),
                loaded.resolved().displayPath(),
                loaded.decoded().decodedWith(),
                header.fileDescriptions(),
                header.implementationLevel(),
                header.fileName(),
                header.timeStamp(),
                header.authors(),
                header.organizations(),
                header.preprocessorVersion(),
                header.originatingSystem(),
                header.authorization(),
                header.schemas(),
                ModelStatistics.productNames(model, MAX_PRODUCT_NAMES),
                model.size(),
                dangling,
                ModelStatistics.typeCounts(model),
                warningsOrNull(warnings)
        );
    }

    @Tool(
            name = "p21_list_entities",
            description = "分页列出交换文件 DATA 段实例（可按实体关键字过滤）；每项包含 id、关键字、行号区间、引用列表与 Part 21 文本。"
    )
    public EntityListResult listEntities(
            @ToolParam(required = false, description = "rootId（可从 p21_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "交换文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "实体关键字过滤（大小写不敏感的包含匹配，例如 CARTESIAN_POINT / B_SPLINE / IFCWALL）") String typeContains,
            @ToolParam(required = false, description = "匹配偏移（0-based；默认 0）") Integer offset,
            @ToolParam(required = false, description = "返回条数（默认 50；上限 500）") Integer limit
    ) {
        Loaded loaded = load(rootId, path);
        ExchangeModel model = requireValid(loaded);

        int resolvedOffset = (offset == null) ? 0 : Math.max(0, offset);
        int resolvedLimit = (limit == null)
                ? properties.getListDefaultLimit()
                : Math.max(1, Math.min(properties.getListMaxLimit(), limit));
        ModelStatistics.EntityPage page = ModelStatistics.listEntities(model, typeContains, resolvedOffset, resolvedLimit);
        return new EntityListResult(
                loaded.resolved().rootId(),
                loaded.resolved().displayPath(),
                loaded.decoded().decodedWith(),
                model.size(),
                page.matched(),
                page.offset(),
                page.limit(),
                page.hasMore(),
                page.nextOffset(),
                page.entities(),
                warningsOrNull(loaded.warnings())
        );
    }

    @Tool(
            name = "p21_build_graph",
            description = "构建实例引用图并内联返回节点与边：不传 entityId 为完整图，传入 entityId（如 12 或 #12）为从该实例出发的可达子图。悬空引用以 failure 节点表示。"
    )
    public GraphResult buildGraph(
            @ToolParam(required = false, description = "rootId（可从 p21_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "交换文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "起点实例 id（12 或 #12）；为空时构建完整图") String entityId
    ) {
        Loaded loaded = load(rootId, path);
        ExchangeModel model = requireValid(loaded);
        Long root = (entityId == null || entityId.isBlank()) ? null : EntityIds.parse(entityId);
        EntityGraph graph = build(model, root);

        List<String> warnings = new ArrayList<>(loaded.warnings());
        int maxNodes = properties.getGraphMaxNodes();
        List<GraphNodeItem> nodes = new ArrayList<>(Math.min(graph.nodeCount(), maxNodes));
        Set<Long> returned = new HashSet<>();
        for (GraphNode node : graph.nodes()) {
            if (nodes.size() >= maxNodes) {
                break;
            }
            nodes.add(new GraphNodeItem(
                    node.id(),
                    node.label(),
                    node.title(),
                    node.color() == null ? null : node.color().name().toLowerCase(Locale.ROOT)
            ));
            returned.add(node.id());
        }
        boolean truncated = graph.nodeCount() > nodes.size();
        List<GraphEdgeItem> edges = new ArrayList<>();
        for (GraphEdge edge : graph.edges()) {
            if (returned.contains(edge.from()) && returned.contains(edge.to())) {
                edges.add(new GraphEdgeItem(edge.from(), edge.to()));
            }
        }
        if (truncated) {
            warnings.add("节点数超过上限（graphMaxNodes=" + maxNodes + "），只返回前 " + nodes.size()
                    + " 个节点；完整结果请使用 p21_render_graph。");
        }
        return new GraphResult(
                loaded.resolved().rootId(),
                loaded.resolved().displayPath(),
                mode(root),
                root,
                graph.nodeCount(),
                graph.edgeCount(),
                truncated,
                nodes,
                edges,
                warningsOrNull(warnings)
        );
    }

    @Tool(
            name = "p21_render_graph",
            description = "把实例引用图渲染为自包含 HTML（vis-network），写入允许访问的根目录内。不传 entityId 为完整图，传入则为可达子图。"
    )
    public RenderResult renderGraph(
            @ToolParam(required = false, description = "rootId（可从 p21_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "交换文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(description = "输出 HTML 路径（相对 rootId 或绝对路径；父目录必须存在）") String outputPath,
            @ToolParam(required = false, description = "起点实例 id（12 或 #12）；为空时渲染完整图") String entityId,
            @ToolParam(required = false, description = "输出文件已存在时是否覆盖（默认 false）") Boolean overwrite
    ) {
        SecurePathResolver.ResolvedPath output = pathResolver.resolveForWrite(rootId, outputPath);
        Path target = output.absolutePath();
        String expected = "." + renderer.extension();
        if (!target.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(expected)) {
            throw new IllegalArgumentException("输出文件扩展名必须是 " + expected + "：" + output.displayPath());
        }
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS) && !Boolean.TRUE.equals(overwrite)) {
            throw new IllegalArgumentException("输出文件已存在（如需覆盖请传 overwrite=true）：" + output.displayPath());
        }

        Loaded loaded = load(rootId, path);
        ExchangeModel model = requireValid(loaded);
        Long root = (entityId == null || entityId.isBlank()) ? null : EntityIds.parse(entityId);
        EntityGraph graph = build(model, root);

        long bytes;
        try {
            renderer.render(graph, target);
            bytes = Files.size(target);
        } catch (IOException e) {
            throw new IllegalStateException("写入输出文件失败：" + output.displayPath(), e);
        }
        log.info("已渲染 {} -> {}（{} 个节点，{} 条边）",
                loaded.resolved().displayPath(), output.displayPath(), graph.nodeCount(), graph.edgeCount());
        return new RenderResult(
                loaded.resolved().rootId(),
                loaded.resolved().displayPath(),
                output.displayPath(),
                mode(root),
                graph.nodeCount(),
                graph.edgeCount(),
                bytes,
                warningsOrNull(loaded.warnings())
        );
    }

    private EntityGraph build(ExchangeModel model, Long root) {
        return (root == null) ? graphBuilder.complete(model) : graphBuilder.rooted(model, root);
    }

    private Loaded load(String rootId, String path) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolveExisting(rootId, path);
        Path file = resolved.absolutePath();
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不是普通文件：" + resolved.displayPath());
        }
        String lower = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (EXCHANGE_EXTENSIONS.stream().noneMatch(lower::endsWith)) {
            throw new IllegalArgumentException("不是交换文件（仅支持 .stp/.step/.p21/.ifc）：" + resolved.displayPath());
        }
        ExchangeFileReader.DecodedText decoded = fileReader.read(file);
        ReadResult result = Part21Reader.read(decoded.text());
        return new Loaded(resolved, decoded, result, decoded.warnings());
    }

    private static ExchangeModel requireValid(Loaded loaded) {
        ReadResult result = loaded.result();
        if (!result.isValid()) {
            throw new IllegalArgumentException(
                    "交换文件无效：" + loaded.resolved().displayPath() + "\n" + result.error().getMessage());
        }
        return result.model();
    }

    private static String mode(Long root) {
        return (root == null) ? "complete" : "rooted";
    }

    private static List<String> warningsOrNull(List<String> warnings) {
        return (warnings == null || warnings.isEmpty()) ? null : List.copyOf(warnings);
    }

    private record Loaded(
            SecurePathResolver.ResolvedPath resolved,
            ExchangeFileReader.DecodedText decoded,
            ReadResult result,
            List<String> warnings
    ) {
    }
}
