package org.ledavis.exchange.parser;

/**
 * 原始语法树的非终结符。
 */
public enum Rule {
    FILE,
    HEADER,
    HEADER_ENTITY,
    DATA_SECTION,
    ENTITY_INSTANCE,
    SIMPLE_RECORD,
    SUBSUPER_RECORD,
    PARAMETER,
    TYPED_PARAMETER,
    UNTYPED_PARAMETER,
    OMITTED_PARAMETER,
    LIST
}
