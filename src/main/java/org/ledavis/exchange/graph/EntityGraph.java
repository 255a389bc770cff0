package org.ledavis.exchange.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 建图结果：按插入顺序排列的节点与边。构造完成后不可变。
 * <p>
 * 渲染器依次插入 {@link #nodes()}、再插入 {@link #edges()} 即可还原标题、颜色与全部有向边。
 */
public final class EntityGraph {

    private final Map<Long, GraphNode> nodes;
    private final List<GraphEdge> edges;

    private EntityGraph(Map<Long, GraphNode> nodes, List<GraphEdge> edges) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableList(edges);
    }

    public List<GraphNode> nodes() {
        return List.copyOf(nodes.values());
    }

    public List<GraphEdge> edges() {
        return edges;
    }

    public GraphNode node(long id) {
        return nodes.get(id);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * 建图阶段使用的可变构造器；{@link #build()} 之后不再使用。
     */
    static final class Builder {

        private final Map<Long, GraphNode> nodes = new LinkedHashMap<>();
        private final List<GraphEdge> edges = new ArrayList<>();

        boolean isEmpty() {
            return nodes.isEmpty();
        }

        boolean contains(long id) {
            return nodes.containsKey(id);
        }

        /**
         * 同一 id 只保留第一次插入的节点。
         */
        void addNode(GraphNode node) {
            nodes.putIfAbsent(node.id(), node);
        }

        void addEdge(long from, long to) {
            edges.add(new GraphEdge(from, to));
        }

        EntityGraph build() {
            return new EntityGraph(new LinkedHashMap<>(nodes), new ArrayList<>(edges));
        }
    }
}
