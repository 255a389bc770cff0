package org.ledavis.exchange.parser;

import org.ledavis.exchange.model.CanonicalEntity;
import org.ledavis.exchange.model.CanonicalFile;
import org.ledavis.exchange.model.HeaderEntity;
import org.ledavis.exchange.model.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 把原始语法树改写为统一的 {@link Value} 模型。
 * <ul>
 *   <li>数字字面量解码为 long/double，字符串解码转义与控制指令（见 {@link StringDecoder}）</li>
 *   <li>{@code parameter}/{@code untyped_parameter}/{@code typed_parameter} 等单子节点包装层被折叠</li>
 *   <li>参数位置上的空括号 {@code ()} 规范化为空字符串，而不是 {@code $}</li>
 *   <li>列表、参数列表、复杂实例成员的顺序保持不变</li>
 * </ul>
 * 这一步是“全函数”：语法分析成功的树上每个节点都恰好映射为一个值，不做任何校验
 * （重名检查在建索引时进行）。
 */
public final class Canonicalizer {

    private Canonicalizer() {
    }

    public static CanonicalFile canonicalize(SyntaxNode file) {
        requireRule(file, Rule.FILE);
        SyntaxNode header = file.nodes(Rule.HEADER).get(0);
        SyntaxNode data = file.nodes(Rule.DATA_SECTION).get(0);

        List<HeaderEntity> headerEntities = new ArrayList<>();
        for (SyntaxNode entity : header.nodes(Rule.HEADER_ENTITY)) {
            headerEntities.add(new HeaderEntity(
                    entity.token(TokenType.KEYWORD).text(),
                    parameters(entity),
                    entity.span()
            ));
        }

        List<CanonicalEntity> entities = new ArrayList<>();
        for (SyntaxNode instance : data.nodes(Rule.ENTITY_INSTANCE)) {
            entities.add(canonicalizeInstance(instance));
        }
        return new CanonicalFile(headerEntities, entities);
    }

    static CanonicalEntity canonicalizeInstance(SyntaxNode instance) {
        requireRule(instance, Rule.ENTITY_INSTANCE);
        long id = Long.parseLong(instance.token(TokenType.ID).text().substring(1));
        Value body;
        List<SyntaxNode> simple = instance.nodes(Rule.SIMPLE_RECORD);
        if (!simple.isEmpty()) {
            body = simpleRecord(simple.get(0));
        } else {
            SyntaxNode subsuper = instance.nodes(Rule.SUBSUPER_RECORD).get(0);
            List<Value.SimpleRecord> records = new ArrayList<>();
            for (SyntaxNode record : subsuper.nodes(Rule.SIMPLE_RECORD)) {
                records.add(simpleRecord(record));
            }
            body = new Value.ComplexRecord(records);
        }
        return new CanonicalEntity(id, body, instance.span());
    }

    private static Value.SimpleRecord simpleRecord(SyntaxNode record) {
        return new Value.SimpleRecord(record.token(TokenType.KEYWORD).text(), parameters(record));
    }

    private static List<Value> parameters(SyntaxNode owner) {
        List<Value> out = new ArrayList<>();
        for (SyntaxNode parameter : owner.nodes(Rule.PARAMETER)) {
            out.add(parameter(parameter));
        }
        return out;
    }

    private static Value parameter(SyntaxNode node) {
        SyntaxNode inner = (SyntaxNode) node.children().get(0);
        return switch (inner.rule()) {
            case TYPED_PARAMETER -> {
                Token keyword = inner.token(TokenType.KEYWORD);
                if (keyword == null) {
                    yield new Value.Str("");
                }
                yield new Value.Typed(keyword.text(), parameter(inner.nodes(Rule.PARAMETER).get(0)));
            }
            case OMITTED_PARAMETER -> Value.OMITTED;
            case UNTYPED_PARAMETER -> {
                SyntaxElement child = inner.children().get(0);
                if (child instanceof SyntaxNode list) {
                    requireRule(list, Rule.LIST);
                    yield new Value.Aggregate(parameters(list));
                }
                yield literal((Token) child);
            }
            default -> throw new IllegalStateException("参数节点下出现了意外的规则：" + inner.rule());
        };
    }

    static Value literal(Token token) {
        String text = token.text();
        return switch (token.type()) {
            case STRING -> new Value.Str(StringDecoder.decode(text.substring(1, text.length() - 1)));
            case INT -> new Value.Int(Long.parseLong(text));
            case REAL -> new Value.Real(Double.parseDouble(text));
            case DOLLAR -> Value.NONE;
            case ENUMERATION -> new Value.Enumeration(text.substring(1, text.length() - 1));
            case ID -> new Value.Ref(Long.parseLong(text.substring(1)));
            case BINARY -> new Value.Binary(text.charAt(1) - '0', text.substring(2, text.length() - 1).toUpperCase(Locale.ROOT));
            default -> throw new IllegalStateException("不是字面量 token：" + token);
        };
    }

    private static void requireRule(SyntaxNode node, Rule rule) {
        if (node.rule() != rule) {
            throw new IllegalStateException("期望 " + rule + " 节点，实际为 " + node.rule());
        }
    }
}
