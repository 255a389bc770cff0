package org.ledavis.exchange.inspect;

import org.ledavis.exchange.dto.EntitySnippet;
import org.ledavis.exchange.dto.EntityTypeCount;
import org.ledavis.exchange.model.EntityInstance;
import org.ledavis.exchange.model.ExchangeModel;
import org.ledavis.exchange.model.Value;
import org.ledavis.exchange.model.ValueFormatter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * DATA 段统计与分页列表。所有方法只读模型。
 */
public final class ModelStatistics {

    private ModelStatistics() {
    }

    /**
     * 分页结果。
     *
     * @param matched    满足过滤条件的实例数
     * @param offset     实际使用的偏移
     * @param limit      实际使用的上限
     * @param hasMore    是否还有更多匹配项
     * @param nextOffset hasMore=true 时的下一页偏移
     * @param entities   本页实例
     */
    public record EntityPage(
            int matched,
            int offset,
            int limit,
            boolean hasMore,
            Integer nextOffset,
            List<EntitySnippet> entities
    ) {
    }

    /**
     * 按关键字计数，数量降序、名称升序。复合实例按每个成员关键字各计一次。
     */
    public static List<EntityTypeCount> typeCounts(ExchangeModel model) {
        Map<String, Integer> counts = new HashMap<>();
        for (EntityInstance instance : model.entities()) {
            for (Value.SimpleRecord record : instance.records()) {
                counts.merge(record.keyword(), 1, Integer::sum);
            }
        }
        List<EntityTypeCount> out = new ArrayList<>(counts.size());
        counts.forEach((type, count) -> out.add(new EntityTypeCount(type, count)));
        out.sort(Comparator.comparingInt(EntityTypeCount::count).reversed()
                .thenComparing(EntityTypeCount::type));
        return out;
    }

    /**
     * 被引用但不存在的 id（按首次出现顺序去重）。
     */
    public static Set<Long> danglingReferences(ExchangeModel model) {
        Set<Long> dangling = new LinkedHashSet<>();
        for (EntityInstance instance : model.entities()) {
            for (Long ref : instance.refs()) {
                if (!model.contains(ref)) {
                    dangling.add(ref);
                }
            }
        }
        return dangling;
    }

    /**
     * {@code PRODUCT(id, name, ...)} 的 name，按文件顺序去重，最多 {@code max} 个。
     */
    public static List<String> productNames(ExchangeModel model, int max) {
        Set<String> names = new LinkedHashSet<>();
        for (EntityInstance instance : model.entities()) {
            if (names.size() >= max) {
                break;
            }
            for (Value.SimpleRecord record : instance.records()) {
                if (!"PRODUCT".equals(record.keyword()) || record.parameters().size() < 2) {
                    continue;
                }
                if (record.parameters().get(1) instanceof Value.Str name && !name.text().isBlank()) {
                    names.add(name.text());
                }
            }
        }
        return List.copyOf(names);
    }

    /**
     * 分页列出实例；{@code typeContains} 对成员关键字做不区分大小写的包含匹配，为空时不过滤。
     */
    public static EntityPage listEntities(ExchangeModel model, String typeContains, int offset, int limit) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset 不能为负数：" + offset);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit 必须大于 0：" + limit);
        }
        String filter = (typeContains == null || typeContains.isBlank())
                ? null
                : typeContains.trim().toUpperCase(Locale.ROOT);

        List<EntitySnippet> page = new ArrayList<>(Math.min(limit, 200));
        int matched = 0;
        for (EntityInstance instance : model.entities()) {
            if (filter != null && !matches(instance, filter)) {
                continue;
            }
            if (matched >= offset && page.size() < limit) {
                page.add(snippet(instance));
            }
            matched++;
        }
        boolean hasMore = matched > offset + page.size();
        Integer nextOffset = hasMore ? offset + page.size() : null;
        return new EntityPage(matched, offset, limit, hasMore, nextOffset, page);
    }

    static EntitySnippet snippet(EntityInstance instance) {
        List<String> keywords = new ArrayList<>();
        for (Value.SimpleRecord record : instance.records()) {
            keywords.add(record.keyword());
        }
        return new EntitySnippet(
                instance.id(),
                keywords,
                instance.span().firstLine(),
                instance.span().lastLine(),
                instance.refs(),
                ValueFormatter.format(instance.body())
        );
    }

    private static boolean matches(EntityInstance instance, String filter) {
        for (Value.SimpleRecord record : instance.records()) {
            if (record.keyword().toUpperCase(Locale.ROOT).contains(filter)) {
                return true;
            }
        }
        return false;
    }
}
