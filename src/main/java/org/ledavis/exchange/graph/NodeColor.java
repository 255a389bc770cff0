package org.ledavis.exchange.graph;

/**
 * 节点颜色的语义标签；{@link #cssColor()} 为渲染器使用的默认配色。
 * <p>
 * 节点颜色为 null 表示“未设置”，由渲染器使用默认颜色。
 */
public enum NodeColor {
    /**
     * 入口节点（图中第一个插入的节点）。
     */
    ENTRY("indigo"),
    /**
     * 悬空引用：被引用但在 DATA 段中不存在的实例。
     */
    FAILURE("red"),
    POINT("lightgrey"),
    CURVE("orange"),
    SPLINE_CURVE("palegreen"),
    SURFACE("darkkhaki");

    private final String cssColor;

    NodeColor(String cssColor) {
        this.cssColor = cssColor;
    }

    public String cssColor() {
        return cssColor;
    }
}
