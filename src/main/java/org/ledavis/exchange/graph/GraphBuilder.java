package org.ledavis.exchange.graph;

import org.ledavis.exchange.model.EntityInstance;
import org.ledavis.exchange.model.ExchangeModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 从 {@link ExchangeModel} 构建引用图。两种模式都是模型的纯函数，不修改模型。
 */
public final class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final NodeStyler styler;

    public GraphBuilder(NodeStyler styler) {
        this.styler = styler;
    }

    /**
     * 完整图：每个实例一个节点，每次引用一条边（重复引用产生重复边）。
     * 被引用但不存在的 id 作为 {@link NodeColor#FAILURE} 节点加入。第一个插入的节点标记为 {@link NodeColor#ENTRY}。
     */
    public EntityGraph complete(ExchangeModel model) {
        EntityGraph.Builder graph = EntityGraph.builder();
        for (EntityInstance instance : model.entities()) {
            addInstance(graph, instance);
        }
        for (EntityInstance instance : model.entities()) {
            for (Long ref : instance.refs()) {
                if (!model.contains(ref)) {
                    graph.addNode(styler.danglingNode(ref));
                }
                graph.addEdge(instance.id(), ref);
            }
        }
        EntityGraph result = graph.build();
        log.debug("完整图：{} 个节点，{} 条边", result.nodeCount(), result.edgeCount());
        return result;
    }

    /**
     * 可达子图：从 {@code rootId} 出发沿引用关系广度优先遍历，已访问节点不再展开。
     * 悬空 id 作为叶子节点加入；每个源节点的出边按目标去重。
     * 根 id 不存在时返回只含一个 {@link NodeColor#FAILURE} 节点的图。
     */
    public EntityGraph rooted(ExchangeModel model, long rootId) {
        EntityGraph.Builder graph = EntityGraph.builder();
        EntityInstance root = model.get(rootId);
        if (root == null) {
            graph.addNode(styler.danglingNode(rootId));
            log.debug("根实例 #{} 不存在", rootId);
            return graph.build();
        }

        Set<Long> visited = new HashSet<>();
        Deque<EntityInstance> queue = new ArrayDeque<>();
        addInstance(graph, root);
        visited.add(rootId);
        queue.add(root);
        while (!queue.isEmpty()) {
            EntityInstance current = queue.poll();
            for (Long ref : new LinkedHashSet<>(current.refs())) {
                EntityInstance target = model.get(ref);
                if (target == null) {
                    graph.addNode(styler.danglingNode(ref));
                } else {
                    addInstance(graph, target);
                }
                graph.addEdge(current.id(), ref);
                if (target != null && visited.add(ref)) {
                    queue.add(target);
                }
            }
        }
        EntityGraph result = graph.build();
        log.debug("以 #{} 为根的可达图：{} 个节点，{} 条边", rootId, result.nodeCount(), result.edgeCount());
        return result;
    }

    private void addInstance(EntityGraph.Builder graph, EntityInstance instance) {
        if (graph.contains(instance.id())) {
            return;
        }
        NodeColor override = graph.isEmpty() ? NodeColor.ENTRY : null;
        graph.addNode(styler.node(instance, override));
    }
}
