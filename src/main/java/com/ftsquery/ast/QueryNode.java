package com.ftsquery.ast;

import com.ftsquery.config.Constants;

import java.util.ArrayList;
import java.util.List;

/**
 * 全文检索查询的抽象语法树。
 *
 * <p>七种节点构成封闭集合，每个节点在构造时校验自身约束，并对子节点列表做不可变拷贝。
 * 节点之间不共享、无环；判等采用结构相等，树工具中的定位采用引用相等。
 */
public sealed interface QueryNode permits QueryNode.Phrase, QueryNode.Phrases,
        QueryNode.Near, QueryNode.ColumnFilter, QueryNode.And, QueryNode.Or, QueryNode.Not {

    /**
     * 字典表示中的类型名，例如 {@code PHRASE}、{@code NEAR}。
     */
    String typeName();

    /**
     * 单个短语。{@code text} 与 {@code tokens} 有且仅有一个非空。
     *
     * @param initial  必须匹配列的开头（{@code ^}）
     * @param prefix   最后一个 token 做前缀匹配（{@code *}）
     * @param sequence 紧接前一个短语（{@code +}），只能出现在 PHRASES 的非首位
     */
    record Phrase(String text, QueryTokens tokens, boolean initial, boolean prefix, boolean sequence)
            implements QueryNode {

        public Phrase {
            if ((text == null) == (tokens == null)) {
                throw new QueryValidationException("PHRASE 必须且只能包含 text 或 tokens 之一: text=" + text + ", tokens=" + tokens);
            }
            if (initial && sequence) {
                throw new QueryValidationException("PHRASE 不能同时设置 initial 与 sequence: " + (text != null ? text : tokens));
            }
        }

        public static Phrase of(String text) {
            if (text == null) {
                throw new QueryValidationException("PHRASE 文本不能为 null");
            }
            return new Phrase(text, null, false, false, false);
        }

        public static Phrase of(QueryTokens tokens) {
            if (tokens == null) {
                throw new QueryValidationException("PHRASE tokens 不能为 null");
            }
            return new Phrase(null, tokens, false, false, false);
        }

        public boolean hasTokens() {
            return tokens != null;
        }

        public Phrase withInitial(boolean initial) {
            return new Phrase(text, tokens, initial, prefix, sequence);
        }

        public Phrase withPrefix(boolean prefix) {
            return new Phrase(text, tokens, initial, prefix, sequence);
        }

        public Phrase withSequence(boolean sequence) {
            return new Phrase(text, tokens, initial, prefix, sequence);
        }

        @Override
        public String typeName() {
            return "PHRASE";
        }
    }

    /**
     * 一组相邻短语，组内隐式 AND。第一个短语不能带 {@code sequence}。
     */
    record Phrases(List<Phrase> phrases) implements QueryNode {

        public Phrases {
            phrases = copyChildren("PHRASES", "phrases", phrases);
            if (phrases.get(0).sequence()) {
                throw new QueryValidationException("PHRASES 的第一个短语不能设置 sequence: " + phrases.get(0));
            }
        }

        public static Phrases of(Phrase... phrases) {
            return new Phrases(List.of(phrases));
        }

        @Override
        public String typeName() {
            return "PHRASES";
        }
    }

    /**
     * 邻近查询：至少两个短语出现在 {@code distance} 个 token 之内。
     */
    record Near(Phrases phrases, int distance) implements QueryNode {
        public static final int DEFAULT_DISTANCE = Constants.DEFAULT_NEAR_DISTANCE;

        public Near {
            if (phrases == null) {
                throw new QueryValidationException("NEAR 缺少 phrases");
            }
            if (phrases.phrases().size() < 2) {
                throw new QueryValidationException("NEAR 至少需要两个短语: " + phrases.phrases());
            }
            if (distance < 1) {
                throw new QueryValidationException("NEAR distance 必须至少为 1，实际为: " + distance);
            }
        }

        public Near(Phrases phrases) {
            this(phrases, DEFAULT_DISTANCE);
        }

        @Override
        public String typeName() {
            return "NEAR";
        }
    }

    /**
     * 列过滤器：限定 {@code query} 中所有短语匹配的列。
     */
    record ColumnFilter(List<String> columns, FilterMode filter, QueryNode query) implements QueryNode {

        public ColumnFilter {
            columns = copyChildren("COLUMNFILTER", "columns", columns);
            if (filter == null) {
                throw new QueryValidationException("COLUMNFILTER 缺少 filter");
            }
            if (query == null) {
                throw new QueryValidationException("COLUMNFILTER 缺少 query");
            }
            requireStandalone("COLUMNFILTER", query);
        }

        @Override
        public String typeName() {
            return "COLUMNFILTER";
        }
    }

    /**
     * 所有子查询都必须匹配。至少两个子节点，且不能是 AND（应已展平）。
     */
    record And(List<QueryNode> queries) implements QueryNode {

        public And {
            queries = copyChildren("AND", "queries", queries);
            if (queries.size() < 2) {
                throw new QueryValidationException("AND 至少需要两个子查询: " + queries);
            }
            for (QueryNode query : queries) {
                if (query instanceof And) {
                    throw new QueryValidationException("AND 不能直接嵌套 AND，应展平: " + query);
                }
                requireStandalone("AND", query);
            }
        }

        public static And of(QueryNode... queries) {
            return new And(List.of(queries));
        }

        @Override
        public String typeName() {
            return "AND";
        }
    }

    /**
     * 任一子查询匹配即可。至少两个子节点，且不能是 OR（应已展平）。
     */
    record Or(List<QueryNode> queries) implements QueryNode {

        public Or {
            queries = copyChildren("OR", "queries", queries);
            if (queries.size() < 2) {
                throw new QueryValidationException("OR 至少需要两个子查询: " + queries);
            }
            for (QueryNode query : queries) {
                if (query instanceof Or) {
                    throw new QueryValidationException("OR 不能直接嵌套 OR，应展平: " + query);
                }
                requireStandalone("OR", query);
            }
        }

        public static Or of(QueryNode... queries) {
            return new Or(List.of(queries));
        }

        @Override
        public String typeName() {
            return "OR";
        }
    }

    /**
     * {@code match} 必须匹配且 {@code noMatch} 不能匹配。
     */
    record Not(QueryNode match, QueryNode noMatch) implements QueryNode {

        public Not {
            if (match == null || noMatch == null) {
                throw new QueryValidationException("NOT 必须同时包含 match 与 no_match");
            }
            requireStandalone("NOT", match);
            requireStandalone("NOT", noMatch);
        }

        @Override
        public String typeName() {
            return "NOT";
        }
    }

    /**
     * 除 PHRASES 内部外，任何位置的 PHRASE 都没有可衔接的前一个短语，不能带 sequence。
     */
    static void requireStandalone(String owner, QueryNode query) {
        if (query instanceof Phrase phrase && phrase.sequence()) {
            throw new QueryValidationException(owner + " 中的 PHRASE 不能设置 sequence: " + phrase);
        }
    }

    private static <T> List<T> copyChildren(String owner, String field, List<T> items) {
        if (items == null || items.isEmpty()) {
            throw new QueryValidationException(owner + " 的 " + field + " 至少需要一个元素: " + items);
        }
        List<T> copy = new ArrayList<>(items.size());
        for (T item : items) {
            if (item == null) {
                throw new QueryValidationException(owner + " 的 " + field + " 不能包含 null: " + items);
            }
            copy.add(item);
        }
        return List.copyOf(copy);
    }
}
