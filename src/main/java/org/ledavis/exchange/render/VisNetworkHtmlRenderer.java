package org.ledavis.exchange.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.ledavis.exchange.graph.EntityGraph;
import org.ledavis.exchange.graph.GraphEdge;
import org.ledavis.exchange.graph.GraphNode;
import org.ledavis.exchange.graph.NodeStyler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 生成自包含的 HTML 页面（通过 CDN 加载 vis-network），节点与有向边以 JSON 内嵌。
 * <p>
 * 标题按 {@link NodeStyler#LINE_BREAK} 拆行、还原 {@code &lt;}/{@code &amp;} 后由脚本以文本节点构造 DOM，实体文本不会被当作 HTML 解析。
 */
public final class VisNetworkHtmlRenderer implements GraphRenderer {

    static final String VIS_NETWORK_URL =
            "https://unpkg.com/vis-network@9.1.9/standalone/umd/vis-network.min.js";

    private static final String NODES_PLACEHOLDER = "__NODES__";
    private static final String EDGES_PLACEHOLDER = "__EDGES__";

    private static final String TEMPLATE = """
            <!DOCTYPE html>
            <html>
            <head>
            <meta charset="utf-8">
            <title>ledavis</title>
            <script src="%s"></script>
            <style>
            #graph { width: 100%%; height: 800px; border: 1px solid lightgray; }
            </style>
            </head>
            <body>
            <div id="graph"></div>
            <script>
            const breakMarker = "<br>";
            function unescapeMarkup(line) {
              return line.replace(/&(lt|amp);/g, function (entity) {
                return entity === "&lt;" ? "<" : "&";
              });
            }
            function toTitle(text) {
              const element = document.createElement("div");
              text.split(breakMarker).forEach(function (line, index) {
                if (index > 0) {
                  element.appendChild(document.createElement("br"));
                }
                element.appendChild(document.createTextNode(unescapeMarkup(line)));
              });
              return element;
            }
            const rawNodes = __NODES__;
            const rawEdges = __EDGES__;
            const nodes = new vis.DataSet(rawNodes.map(function (node) {
              const item = { id: node.id, label: node.label, title: toTitle(node.title) };
              if (node.color) {
                item.color = node.color;
              }
              return item;
            }));
            const edges = new vis.DataSet(rawEdges.map(function (edge) {
              return { from: edge.from, to: edge.to, arrows: "to" };
            }));
            new vis.Network(document.getElementById("graph"), { nodes: nodes, edges: edges }, {
              physics: { stabilization: { iterations: 200 } }
            });
            </script>
            </body>
            </html>
            """.formatted(VIS_NETWORK_URL);

    private final ObjectWriter writer;

    public VisNetworkHtmlRenderer(ObjectMapper objectMapper) {
        this.writer = objectMapper.writer().with(new HtmlSafeEscapes());
    }

    @Override
    public String extension() {
        return "html";
    }

    @Override
    public void render(EntityGraph graph, Path output) throws IOException {
        Files.writeString(output, toHtml(graph), StandardCharsets.UTF_8);
    }

    String toHtml(EntityGraph graph) throws JsonProcessingException {
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (GraphNode node : graph.nodes()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", node.id());
            item.put("label", node.label());
            item.put("title", node.title());
            item.put("color", node.color() == null ? null : node.color().cssColor());
            nodes.add(item);
        }
        List<Map<String, Object>> edges = new ArrayList<>();
        for (GraphEdge edge : graph.edges()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("from", edge.from());
            item.put("to", edge.to());
            edges.add(item);
        }
        // 先填边再填节点：节点标题来自实体文本，插入后不再被扫描
        return TEMPLATE
                .replace(EDGES_PLACEHOLDER, writer.writeValueAsString(edges))
                .replace(NODES_PLACEHOLDER, writer.writeValueAsString(nodes));
    }

    /**
     * 内嵌到 script 中的 JSON 需要转义 {@code <}、{@code >} 和 {@code &}，避免提前结束脚本块。
     */
    static final class HtmlSafeEscapes extends CharacterEscapes {

        private final int[] escapes;

        HtmlSafeEscapes() {
            escapes = CharacterEscapes.standardAsciiEscapesForJSON();
            escapes['<'] = CharacterEscapes.ESCAPE_STANDARD;
            escapes['>'] = CharacterEscapes.ESCAPE_STANDARD;
            escapes['&'] = CharacterEscapes.ESCAPE_STANDARD;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return escapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return null;
        }
    }
}
