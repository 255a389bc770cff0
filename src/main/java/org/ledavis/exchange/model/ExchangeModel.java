package org.ledavis.exchange.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次解析得到的完整模型：HEADER 记录 + {@code id -> 实体实例} 索引。
 * <p>
 * 构造完成后不可变，可被多个建图/渲染请求并发读取。索引保持文件中的出现顺序。
 */
public final class ExchangeModel {

    private final List<HeaderEntity> header;
    private final Map<Long, EntityInstance> instances;

    public ExchangeModel(List<HeaderEntity> header, Map<Long, EntityInstance> instances) {
        this.header = List.copyOf(header);
        this.instances = Collections.unmodifiableMap(new LinkedHashMap<>(instances));
    }

    public List<HeaderEntity> header() {
        return header;
    }

    public Map<Long, EntityInstance> instances() {
        return instances;
    }

    /**
     * 按文件顺序返回全部实例。
     */
    public Collection<EntityInstance> entities() {
        return instances.values();
    }

    public EntityInstance get(long id) {
        return instances.get(id);
    }

    public boolean contains(long id) {
        return instances.containsKey(id);
    }

    public int size() {
        return instances.size();
    }

    /**
     * 查找 HEADER 中第一条指定关键字的记录（例如 {@code FILE_NAME}）；不存在时返回 null。
     */
    public HeaderEntity headerEntity(String keyword) {
        for (HeaderEntity entity : header) {
            if (entity.keyword().equals(keyword)) {
                return entity;
            }
        }
        return null;
    }
}
