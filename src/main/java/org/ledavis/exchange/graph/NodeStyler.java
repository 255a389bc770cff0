package org.ledavis.exchange.graph;

import org.ledavis.exchange.model.EntityInstance;
import org.ledavis.exchange.model.Value;
import org.ledavis.exchange.model.ValueFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 节点标题与颜色的计算规则（完整图与可达子图共用）。
 * <ul>
 *   <li>标题：{@code KEYWORD(p1, p2, ...)}，按 {@code titleWidth} 软换行；复合实例每条成员记录单独成行；
 *       行内的 {@code &} 与 {@code <} 转义为 {@code &amp;}、{@code &lt;}，行之间用 {@link #LINE_BREAK} 连接</li>
 *   <li>颜色：调用方显式指定的颜色优先，其次按成员记录关键字查类型颜色表，否则不设置</li>
 * </ul>
 */
public final class NodeStyler {

    /**
     * 多行标题的换行标记。
     */
    public static final String LINE_BREAK = "<br>";

    public static final int DEFAULT_TITLE_WIDTH = 100;

    private static final Map<String, NodeColor> TYPE_COLORS = Map.of(
            "CARTESIAN_POINT", NodeColor.POINT,
            "PCURVE", NodeColor.CURVE,
            "B_SPLINE_CURVE_WITH_KNOTS", NodeColor.SPLINE_CURVE,
            "B_SPLINE_SURFACE_WITH_KNOTS", NodeColor.SURFACE,
            "IFCCARTESIANPOINT", NodeColor.POINT,
            "IFCPOLYLINE", NodeColor.CURVE,
            "IFCSHAPEREPRESENTATION", NodeColor.SURFACE
    );

    private final int titleWidth;

    public NodeStyler() {
        this(DEFAULT_TITLE_WIDTH);
    }

    public NodeStyler(int titleWidth) {
        if (titleWidth < 1) {
            throw new IllegalArgumentException("titleWidth 必须大于 0：" + titleWidth);
        }
        this.titleWidth = titleWidth;
    }

    public GraphNode node(EntityInstance instance, NodeColor override) {
        NodeColor color = (override != null) ? override : typeColor(instance);
        return new GraphNode(instance.id(), instance.name(), title(instance), color);
    }

    /**
     * 悬空引用节点：没有记录可渲染，标题只说明缺失。
     */
    public GraphNode danglingNode(long id) {
        return new GraphNode(id, "#" + id, "#" + id + " unresolved reference", NodeColor.FAILURE);
    }

    public String title(EntityInstance instance) {
        List<String> lines = new ArrayList<>();
        for (Value.SimpleRecord record : instance.records()) {
            for (String line : TitleWrapper.wrap(recordText(record), titleWidth)) {
                lines.add(escapeMarkup(line));
            }
        }
        return String.join(LINE_BREAK, lines);
    }

    // 实体文本中的 & 和 < 转成实体，标题里唯一的原始标记就是 LINE_BREAK
    static String escapeMarkup(String line) {
        return line.replace("&", "&amp;").replace("<", "&lt;");
    }

    /**
     * 未换行的单条记录文本。
     */
    public static String recordText(Value.SimpleRecord record) {
        return record.keyword() + ValueFormatter.formatParameters(record.parameters());
    }

    static NodeColor typeColor(EntityInstance instance) {
        for (Value.SimpleRecord record : instance.records()) {
            NodeColor color = TYPE_COLORS.get(record.keyword());
            if (color != null) {
                return color;
            }
        }
        return null;
    }
}
