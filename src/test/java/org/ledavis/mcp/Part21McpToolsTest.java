package org.ledavis.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.ledavis.exchange.dto.EntityListResult;
import org.ledavis.exchange.dto.GraphResult;
import org.ledavis.exchange.dto.ModelInfoResult;
import org.ledavis.exchange.dto.RenderResult;
import org.ledavis.exchange.dto.ValidationResult;
import org.ledavis.exchange.files.ExchangeFileProperties;
import org.ledavis.exchange.files.ExchangeFileReader;
import org.ledavis.exchange.files.SecurePathResolver;
import org.ledavis.exchange.graph.GraphBuilder;
import org.ledavis.exchange.graph.NodeStyler;
import org.ledavis.exchange.render.VisNetworkHtmlRenderer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.ledavis.exchange.Part21Samples.file;

class Part21McpToolsTest {

    @TempDir
    Path root;

    private ExchangeFileProperties properties;
    private Part21McpTools tools;

    @BeforeEach
    void setUp() throws Exception {
        properties = new ExchangeFileProperties();
        properties.setRoots(List.of(root.toString()));
        tools = new Part21McpTools(
                properties,
                new SecurePathResolver(properties),
                new ExchangeFileReader(properties.getReadMaxBytes().toBytes()),
                new GraphBuilder(new NodeStyler()),
                new VisNetworkHtmlRenderer(new ObjectMapper())
        );
        Files.writeString(root.resolve("part.stp"), file(
                "#1=PRODUCT('P1','Bracket','',());",
                "#2=CARTESIAN_POINT('',(0.,0.,0.));",
                "#3=LINE('',#2,#4);",
                "#4=VECTOR('',#5,1.);"
        ), StandardCharsets.UTF_8);
        Files.writeString(root.resolve("broken.stp"), file("#1=FOO(;"), StandardCharsets.UTF_8);
    }

    @Test
    void listRoots_returnsConfiguredRoot() {
        assertThat(tools.listRoots().roots()).singleElement()
                .satisfies(r -> assertThat(r.id()).isEqualTo("root0"));
    }

    @Test
    void validate_reportsCounts() {
        ValidationResult result = tools.validate(null, "part.stp");

        assertThat(result.valid()).isTrue();
        assertThat(result.headerRecords()).isEqualTo(3);
        assertThat(result.entityCount()).isEqualTo(4);
        assertThat(result.diagnostic()).isNull();
        assertThat(result.decodedWith()).isEqualTo("UTF-8");
    }

    @Test
    void validate_returnsDiagnosticForSyntaxError() {
        ValidationResult result = tools.validate(null, "broken.stp");

        assertThat(result.valid()).isFalse();
        assertThat(result.entityCount()).isNull();
        assertThat(result.diagnostic().lineno()).isEqualTo(8);
        assertThat(result.diagnostic().column()).isEqualTo(8);
        assertThat(result.diagnostic().foundValue()).isEqualTo(";");
    }

    @Test
    void validate_rejectsOtherExtensions() throws Exception {
        Files.writeString(root.resolve("notes.txt"), "x");

        assertThatThrownBy(() -> tools.validate(null, "notes.txt"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void readModelInfo_summarizesHeaderAndTypes() {
        ModelInfoResult info = tools.readModelInfo(null, "part.stp");

        assertThat(info.fileName()).isEqualTo("demo.stp");
        assertThat(info.schemas()).containsExactly("AUTOMOTIVE_DESIGN");
        assertThat(info.productNames()).containsExactly("Bracket");
        assertThat(info.entityCount()).isEqualTo(4);
        assertThat(info.danglingReferences()).isEqualTo(1);
        assertThat(info.entityTypes()).hasSize(4);
        assertThat(info.warnings()).singleElement().asString().contains("悬空引用");
    }

    @Test
    void readModelInfo_invalidFileFailsWithMessage() {
        assertThatThrownBy(() -> tools.readModelInfo(null, "broken.stp"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("交换文件无效")
                .hasMessageContaining("line 8");
    }

    @Test
    void listEntities_clampsLimit() {
        properties.setListMaxLimit(2);

        EntityListResult result = tools.listEntities(null, "part.stp", null, null, 99);

        assertThat(result.totalEntities()).isEqualTo(4);
        assertThat(result.limit()).isEqualTo(2);
        assertThat(result.entities()).hasSize(2);
        assertThat(result.hasMore()).isTrue();
        assertThat(result.nextOffset()).isEqualTo(2);
    }

    @Test
    void buildGraph_rootedFromEntityId() {
        GraphResult graph = tools.buildGraph(null, "part.stp", "#3");

        assertThat(graph.mode()).isEqualTo("rooted");
        assertThat(graph.entityId()).isEqualTo(3L);
        assertThat(graph.nodes()).extracting(n -> n.id()).containsExactly(3L, 2L, 4L, 5L);
        assertThat(graph.nodes().get(0).color()).isEqualTo("entry");
        assertThat(graph.nodes().get(3).color()).isEqualTo("failure");
        assertThat(graph.truncated()).isFalse();
        assertThat(graph.warnings()).isNull();
    }

    @Test
    void buildGraph_truncatesAtConfiguredLimit() {
        properties.setGraphMaxNodes(2);

        GraphResult graph = tools.buildGraph(null, "part.stp", null);

        assertThat(graph.mode()).isEqualTo("complete");
        assertThat(graph.totalNodes()).isEqualTo(5);
        assertThat(graph.nodes()).hasSize(2);
        assertThat(graph.edges()).isEmpty();
        assertThat(graph.truncated()).isTrue();
        assertThat(graph.warnings()).isNotEmpty();
    }

    @Test
    void renderGraph_writesHtmlAndRefusesOverwrite() {
        RenderResult result = tools.renderGraph(null, "part.stp", "part.html", null, null);

        assertThat(result.outputPath()).isEqualTo("part.html");
        assertThat(result.nodes()).isEqualTo(5);
        assertThat(result.edges()).isEqualTo(3);
        assertThat(result.bytes()).isPositive();
        assertThat(root.resolve("part.html")).exists();

        assertThatThrownBy(() -> tools.renderGraph(null, "part.stp", "part.html", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("overwrite");
        assertThat(tools.renderGraph(null, "part.stp", "part.html", "2", true).mode()).isEqualTo("rooted");
    }

    @Test
    void renderGraph_rejectsWrongExtension() {
        assertThatThrownBy(() -> tools.renderGraph(null, "part.stp", "part.txt", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(".html");
    }
}
