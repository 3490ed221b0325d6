package com.ftsquery.codec;

import com.ftsquery.ast.FilterMode;
import com.ftsquery.ast.QueryNode;
import com.ftsquery.ast.QueryTokens;
import com.ftsquery.ast.QueryValidationException;
import com.ftsquery.config.Constants;
import com.ftsquery.config.QueryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AST 与通用嵌套 Map/集合/字符串表示之间的转换。
 *
 * <p>Map 以 {@code @} 键标识节点类型，其余键与节点字段同名；序列化时省略默认值。
 * 反序列化时在需要 PHRASE 的位置接受简写：字符串为单个短语，集合为 PHRASES，
 * {@link QueryTokens} 为预分词短语。字符串始终按原文处理；只有
 * {@link #decodingTokenStrings()} 得到的实例才把带保留前缀的字符串解码为预分词短语，
 * 供 JSON 这类只能以字符串承载 token 的来源使用。
 */
public class QueryDictCodec {
    private static final Logger logger = LoggerFactory.getLogger(QueryDictCodec.class);

    private static final String TYPE = Constants.DICT_TYPE_KEY;

    private final QueryConfig config;
    private final boolean tokenStrings;

    public QueryDictCodec() {
        this(QueryConfig.defaults());
    }

    public QueryDictCodec(QueryConfig config) {
        this(config, false);
    }

    private QueryDictCodec(QueryConfig config, boolean tokenStrings) {
        this.config = config;
        this.tokenStrings = tokenStrings;
    }

    /**
     * 返回同配置、但把带保留前缀的字符串解码为 {@link QueryTokens} 的实例。
     */
    public QueryDictCodec decodingTokenStrings() {
        return tokenStrings ? this : new QueryDictCodec(config, true);
    }

    /**
     * 转换为以 {@code @} 开头、仅含非默认字段的可修改 Map。
     */
    public Map<String, Object> toDict(QueryNode query) {
        if (query == null) {
            throw new QueryValidationException("查询节点不能为 null");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(TYPE, query.typeName());

        if (query instanceof QueryNode.Phrase phrase) {
            result.put("text", phrase.hasTokens() ? phrase.tokens() : phrase.text());
            if (phrase.initial()) {
                result.put("initial", true);
            }
            if (phrase.prefix()) {
                result.put("prefix", true);
            }
            if (phrase.sequence()) {
                result.put("sequence", true);
            }
        } else if (query instanceof QueryNode.Phrases phrases) {
            result.put("phrases", phraseDicts(phrases));
        } else if (query instanceof QueryNode.Near near) {
            result.put("phrases", phraseDicts(near.phrases()));
            if (near.distance() != QueryNode.Near.DEFAULT_DISTANCE) {
                result.put("distance", near.distance());
            }
        } else if (query instanceof QueryNode.ColumnFilter columnFilter) {
            result.put("columns", new ArrayList<>(columnFilter.columns()));
            result.put("filter", columnFilter.filter().wireName());
            result.put("query", toDict(columnFilter.query()));
        } else if (query instanceof QueryNode.And and) {
            result.put("queries", childDicts(and.queries()));
        } else if (query instanceof QueryNode.Or or) {
            result.put("queries", childDicts(or.queries()));
        } else if (query instanceof QueryNode.Not not) {
            result.put("match", toDict(not.match()));
            result.put("no_match", toDict(not.noMatch()));
        }
        return result;
    }

    /**
     * 由嵌套表示构建 AST，任何不合法的子值都会抛出 {@link QueryValidationException}。
     */
    public QueryNode fromDict(Object value) {
        QueryNode query = convert(value, 1);
        QueryNode.requireStandalone("根查询", query);
        logger.debug("字典转换完成: {}", query.typeName());
        return query;
    }

    private QueryNode convert(Object value, int depth) {
        if (depth > config.getMaxNestingDepth()) {
            throw new QueryValidationException("嵌套层级超过上限 " + config.getMaxNestingDepth());
        }
        if (value instanceof String text) {
            return phraseOf(text);
        }
        if (value instanceof QueryTokens tokens) {
            return QueryNode.Phrase.of(tokens);
        }
        if (value instanceof Collection<?> items) {
            List<QueryNode.Phrase> phrases = phraseList(items, depth);
            return phrases.size() == 1 ? phrases.get(0) : new QueryNode.Phrases(phrases);
        }
        if (value instanceof Map<?, ?> map) {
            return convertMap(map, depth);
        }
        throw new QueryValidationException("无法识别的查询值: " + describe(value));
    }

    private QueryNode convertMap(Map<?, ?> map, int depth) {
        if (!map.containsKey(TYPE)) {
            throw new QueryValidationException("缺少键 '" + TYPE + "': " + map);
        }
        Object type = map.get(TYPE);
        if (!(type instanceof String typeName)) {
            throw new QueryValidationException("'" + TYPE + "' 必须是字符串: " + describe(type));
        }

        return switch (typeName) {
            case "PHRASE" -> convertPhrase(map);
            case "PHRASES" -> new QueryNode.Phrases(phraseList(requireCollection(map, "phrases"), depth));
            case "NEAR" -> convertNear(map, depth);
            case "COLUMNFILTER" -> convertColumnFilter(map, depth);
            case "AND", "OR" -> convertBoolean(typeName, map, depth);
            case "NOT" -> convertNot(map, depth);
            default -> throw new QueryValidationException("\"" + typeName + "\" 不是已知的查询类型");
        };
    }

    private QueryNode.Phrase convertPhrase(Map<?, ?> map) {
        Object text = require(map, "text");
        QueryNode.Phrase phrase;
        if (text instanceof String plain) {
            phrase = phraseOf(plain);
        } else if (text instanceof QueryTokens tokens) {
            phrase = QueryNode.Phrase.of(tokens);
        } else {
            throw new QueryValidationException("PHRASE 的 text 必须是字符串或 QueryTokens: " + describe(text));
        }
        return new QueryNode.Phrase(phrase.text(), phrase.tokens(),
                optionalBoolean(map, "initial"),
                optionalBoolean(map, "prefix"),
                optionalBoolean(map, "sequence"));
    }

    private QueryNode.Near convertNear(Map<?, ?> map, int depth) {
        Object phrasesValue = require(map, "phrases");
        List<QueryNode.Phrase> phrases;
        if (phrasesValue instanceof Collection<?> items) {
            phrases = phraseList(items, depth);
        } else {
            QueryNode converted = convert(phrasesValue, depth + 1);
            if (converted instanceof QueryNode.Phrases group) {
                phrases = group.phrases();
            } else if (converted instanceof QueryNode.Phrase single) {
                phrases = List.of(single);
            } else {
                throw new QueryValidationException("NEAR 的 phrases 必须是短语集合: " + describe(phrasesValue));
            }
        }
        if (phrases.size() < 2) {
            throw new QueryValidationException("NEAR 至少需要两个短语: " + describe(phrasesValue));
        }
        int distance = optionalInt(map, "distance", QueryNode.Near.DEFAULT_DISTANCE);
        if (distance < 1) {
            throw new QueryValidationException("NEAR distance 必须至少为 1: " + map);
        }
        return new QueryNode.Near(new QueryNode.Phrases(phrases), distance);
    }

    private QueryNode.ColumnFilter convertColumnFilter(Map<?, ?> map, int depth) {
        Collection<?> columnValues = requireCollection(map, "columns");
        List<String> columns = new ArrayList<>(columnValues.size());
        for (Object column : columnValues) {
            if (!(column instanceof String name)) {
                throw new QueryValidationException("COLUMNFILTER 的 columns 必须全部是字符串: " + describe(column));
            }
            columns.add(name);
        }
        FilterMode filter = FilterMode.fromWireName(map.get("filter"));
        QueryNode query = convert(require(map, "query"), depth + 1);
        return new QueryNode.ColumnFilter(columns, filter, query);
    }

    /**
     * AND/OR：同类子节点并入父节点，只剩一个子节点时直接返回该子节点。
     */
    private QueryNode convertBoolean(String typeName, Map<?, ?> map, int depth) {
        boolean isAnd = "AND".equals(typeName);
        List<QueryNode> queries = new ArrayList<>();
        for (Object item : requireCollection(map, "queries")) {
            QueryNode child = convert(item, depth + 1);
            if (isAnd && child instanceof QueryNode.And and) {
                queries.addAll(and.queries());
            } else if (!isAnd && child instanceof QueryNode.Or or) {
                queries.addAll(or.queries());
            } else {
                queries.add(child);
            }
        }
        if (queries.size() == 1) {
            return queries.get(0);
        }
        return isAnd ? new QueryNode.And(queries) : new QueryNode.Or(queries);
    }

    private QueryNode.Not convertNot(Map<?, ?> map, int depth) {
        Object match = map.get("match");
        Object noMatch = map.get("no_match");
        if (match == null || noMatch == null) {
            throw new QueryValidationException("NOT 必须同时包含 'match' 与 'no_match': " + map);
        }
        return new QueryNode.Not(convert(match, depth + 1), convert(noMatch, depth + 1));
    }

    /**
     * 集合中的每一项都必须解析为 PHRASE；第一个短语不能带 sequence。
     */
    private List<QueryNode.Phrase> phraseList(Collection<?> items, int depth) {
        if (items.isEmpty()) {
            throw new QueryValidationException("短语集合至少需要一个元素: " + items);
        }
        List<QueryNode.Phrase> phrases = new ArrayList<>(items.size());
        for (Object item : items) {
            QueryNode converted = convert(item, depth + 1);
            if (!(converted instanceof QueryNode.Phrase phrase)) {
                throw new QueryValidationException("此处需要 PHRASE，实际为 " + converted.typeName() + ": " + describe(item));
            }
            phrases.add(phrase);
        }
        return new QueryNode.Phrases(phrases).phrases();
    }

    private List<Map<String, Object>> phraseDicts(QueryNode.Phrases phrases) {
        List<Map<String, Object>> result = new ArrayList<>(phrases.phrases().size());
        for (QueryNode.Phrase phrase : phrases.phrases()) {
            result.add(toDict(phrase));
        }
        return result;
    }

    private List<Map<String, Object>> childDicts(List<QueryNode> queries) {
        List<Map<String, Object>> result = new ArrayList<>(queries.size());
        for (QueryNode query : queries) {
            result.add(toDict(query));
        }
        return result;
    }

    /**
     * 字符串短语；开启 token 字符串解码时，带保留前缀的视为预分词短语。
     */
    private QueryNode.Phrase phraseOf(String text) {
        if (!tokenStrings) {
            return QueryNode.Phrase.of(text);
        }
        return QueryTokens.decode(text)
                .map(QueryNode.Phrase::of)
                .orElseGet(() -> QueryNode.Phrase.of(text));
    }

    private static Object require(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            throw new QueryValidationException(map.get(TYPE) + " 缺少 '" + key + "': " + map);
        }
        return value;
    }

    private static Collection<?> requireCollection(Map<?, ?> map, String key) {
        Object value = require(map, key);
        if (!(value instanceof Collection<?> items) || items.isEmpty()) {
            throw new QueryValidationException(map.get(TYPE) + " 的 '" + key + "' 必须是至少包含一个元素的集合: " + describe(value));
        }
        return items;
    }

    private static boolean optionalBoolean(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return false;
        }
        if (!(value instanceof Boolean flag)) {
            throw new QueryValidationException("'" + key + "' 必须是布尔值: " + describe(value));
        }
        return flag;
    }

    private static int optionalInt(Map<?, ?> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long number = ((Number) value).longValue();
            if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        }
        if (value instanceof BigInteger big && big.bitLength() < Integer.SIZE) {
            return big.intValue();
        }
        throw new QueryValidationException("'" + key + "' 必须是整数: " + describe(value));
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return value + " (" + value.getClass().getSimpleName() + ")";
    }
}
