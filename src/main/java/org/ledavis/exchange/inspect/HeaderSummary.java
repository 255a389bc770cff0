package org.ledavis.exchange.inspect;

import org.ledavis.exchange.model.ExchangeModel;
import org.ledavis.exchange.model.HeaderEntity;
import org.ledavis.exchange.model.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * HEADER 段三条必备记录的摘要：
 * <ul>
 *   <li>{@code FILE_DESCRIPTION(description, implementation_level)}</li>
 *   <li>{@code FILE_NAME(name, time_stamp, author, organization, preprocessor_version, originating_system, authorization)}</li>
 *   <li>{@code FILE_SCHEMA(schema_identifiers)}</li>
 * </ul>
 * 字段直接取自规范化后的参数值，字符串已完成转义解码。缺失的记录或类型不符的参数对应字段为 null，并给出告警。
 */
public record HeaderSummary(
        List<String> fileDescriptions,
        String implementationLevel,
        String fileName,
        String timeStamp,
        List<String> authors,
        List<String> organizations,
        String preprocessorVersion,
        String originatingSystem,
        String authorization,
        List<String> schemas,
        List<String> warnings
) {

    public static HeaderSummary of(ExchangeModel model) {
        List<String> warnings = new ArrayList<>();

        List<String> fileDescriptions = null;
        String implementationLevel = null;
        HeaderEntity description = required(model, "FILE_DESCRIPTION", warnings);
        if (description != null) {
            fileDescriptions = strings(description, 0, warnings);
            implementationLevel = string(description, 1, warnings);
        }

        String fileName = null;
        String timeStamp = null;
        List<String> authors = null;
        List<String> organizations = null;
        String preprocessorVersion = null;
        String originatingSystem = null;
        String authorization = null;
        HeaderEntity name = required(model, "FILE_NAME", warnings);
        if (name != null) {
            fileName = string(name, 0, warnings);
            timeStamp = string(name, 1, warnings);
            authors = strings(name, 2, warnings);
            organizations = strings(name, 3, warnings);
            preprocessorVersion = string(name, 4, warnings);
            originatingSystem = string(name, 5, warnings);
            authorization = string(name, 6, warnings);
        }

        List<String> schemas = null;
        HeaderEntity schema = required(model, "FILE_SCHEMA", warnings);
        if (schema != null) {
            schemas = strings(schema, 0, warnings);
        }

        return new HeaderSummary(
                fileDescriptions,
                implementationLevel,
                fileName,
                timeStamp,
                authors,
                organizations,
                preprocessorVersion,
                originatingSystem,
                authorization,
                schemas,
                warnings.isEmpty() ? null : List.copyOf(warnings)
        );
    }

    private static HeaderEntity required(ExchangeModel model, String keyword, List<String> warnings) {
        HeaderEntity entity = model.headerEntity(keyword);
        if (entity == null) {
            warnings.add("HEADER 段缺少 " + keyword + "。");
        }
        return entity;
    }

    private static String string(HeaderEntity entity, int index, List<String> warnings) {
        Value value = parameter(entity, index, warnings);
        if (value == null || value instanceof Value.None || value instanceof Value.Omitted) {
            return null;
        }
        if (value instanceof Value.Str str) {
            return str.text();
        }
        warnings.add(entity.keyword() + " 第 " + (index + 1) + " 个参数不是字符串。");
        return null;
    }

    private static List<String> strings(HeaderEntity entity, int index, List<String> warnings) {
        Value value = parameter(entity, index, warnings);
        if (value == null || value instanceof Value.None || value instanceof Value.Omitted) {
            return null;
        }
        // 空列表 () 在规范化时变为空字符串
        if (value instanceof Value.Str str) {
            return str.text().isEmpty() ? List.of() : List.of(str.text());
        }
        if (!(value instanceof Value.Aggregate aggregate)) {
            warnings.add(entity.keyword() + " 第 " + (index + 1) + " 个参数不是字符串列表。");
            return null;
        }
        List<String> out = new ArrayList<>();
        for (Value item : aggregate.items()) {
            if (item instanceof Value.Str str) {
                out.add(str.text());
            } else {
                warnings.add(entity.keyword() + " 第 " + (index + 1) + " 个参数包含非字符串元素。");
            }
        }
        return out;
    }

    private static Value parameter(HeaderEntity entity, int index, List<String> warnings) {
        if (index >= entity.parameters().size()) {
            warnings.add(entity.keyword() + " 缺少第 " + (index + 1) + " 个参数。");
            return null;
        }
        return entity.parameters().get(index);
    }
}
