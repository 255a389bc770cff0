package org.ledavis.exchange.files;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * 交换文件 MCP 服务的业务配置（{@code app.p21.*}）。
 * <ul>
 *   <li>{@link #roots}：允许读写的根目录白名单</li>
 *   <li>{@link #readMaxBytes}：整文件解析，超过上限的文件直接拒绝</li>
 *   <li>{@link #graphMaxNodes}：只限制工具内联返回的节点数，渲染产物不受限制</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.p21")
public class ExchangeFileProperties {

    /**
     * 允许访问的根目录白名单；每个 root 自动分配 {@code rootId}（root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许访问符号链接路径（默认不允许，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    /**
     * 单个交换文件允许的最大字节数。
     */
    @NotNull
    private DataSize readMaxBytes = DataSize.ofMegabytes(64);

    /**
     * 节点标题软换行宽度（字符数）。
     */
    @Min(20)
    @Max(10_000)
    private int titleWidth = 100;

    /**
     * {@code p21_list_entities} 默认返回条数。
     */
    @Min(1)
    @Max(100_000)
    private int listDefaultLimit = 50;

    /**
     * {@code p21_list_entities} 允许的最大返回条数。
     */
    @Min(1)
    @Max(100_000)
    private int listMaxLimit = 500;

    /**
     * {@code p21_build_graph} 内联返回的最大节点数。
     */
    @Min(1)
    @Max(10_000_000)
    private int graphMaxNodes = 20_000;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public DataSize getReadMaxBytes() {
        return readMaxBytes;
    }

    public void setReadMaxBytes(DataSize readMaxBytes) {
        this.readMaxBytes = readMaxBytes;
    }

    public int getTitleWidth() {
        return titleWidth;
    }

    public void setTitleWidth(int titleWidth) {
        this.titleWidth = titleWidth;
    }

    public int getListDefaultLimit() {
        return listDefaultLimit;
    }

    public void setListDefaultLimit(int listDefaultLimit) {
        this.listDefaultLimit = listDefaultLimit;
    }

    public int getListMaxLimit() {
        return listMaxLimit;
    }

    public void setListMaxLimit(int listMaxLimit) {
        this.listMaxLimit = listMaxLimit;
    }

    public int getGraphMaxNodes() {
        return graphMaxNodes;
    }

    public void setGraphMaxNodes(int graphMaxNodes) {
        this.graphMaxNodes = graphMaxNodes;
    }
}
