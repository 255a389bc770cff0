package org.ledavis.exchange.render;

import org.ledavis.exchange.graph.EntityGraph;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 把引用图写成可视化产物。渲染器只负责布局与持久化，不改变节点/边的内容。
 */
public interface GraphRenderer {

    /**
     * 产物的文件扩展名（不含点），例如 {@code html}。
     */
    String extension();

    void render(EntityGraph graph, Path output) throws IOException;
}
