package org.ledavis.exchange.model;

import java.util.List;
import java.util.Objects;

/**
 * HEADER 段中的一条记录，例如 {@code FILE_NAME(...)}。
 */
public record HeaderEntity(String keyword, List<Value> parameters, SourceSpan span) {

    public HeaderEntity {
        Objects.requireNonNull(keyword, "keyword");
        parameters = List.copyOf(parameters);
    }
}
