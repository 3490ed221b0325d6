package com.ftsquery.format;

import com.ftsquery.ast.FilterMode;
import com.ftsquery.ast.QueryNode;
import com.ftsquery.ast.QueryTokens;
import com.ftsquery.ast.QueryValidationException;

import java.util.List;
import java.util.Set;

/**
 * 将 AST 输出为规范化查询文本，只在必要处加括号。
 *
 * <p>输出可被 {@code QueryParser} 解析回语义相同的 AST，但不保留原始文本：
 * NEAR 默认距离、NEAR 组之间可省略的 AND、冗余括号都会被规范化。
 */
public final class QueryFormatter {
    // 数值越小结合越松；子节点优先级低于父节点时加括号
    private static final int OR_PRIORITY = 10;
    private static final int AND_PRIORITY = 20;
    private static final int NOT_PRIORITY = 30;
    private static final int COLUMNFILTER_PRIORITY = 50;
    private static final int NEAR_PRIORITY = 60;
    private static final int PHRASES_PRIORITY = 70;
    private static final int PHRASE_PRIORITY = 80;

    private static final Set<String> KEYWORDS = Set.of("OR", "AND", "NOT", "NEAR");

    private QueryFormatter() {
        // 工具类，禁止实例化
    }

    /**
     * 返回查询的规范化文本。
     */
    public static String toQueryString(QueryNode query) {
        if (query == null) {
            throw new QueryValidationException("查询节点不能为 null");
        }
        QueryNode.requireStandalone("根查询", query);
        StringBuilder builder = new StringBuilder();
        render(query, builder);
        return builder.toString();
    }

    /**
     * 按 FTS5 规则在必要时加双引号：空串或含 [A-Za-z0-9_] 之外的 ASCII 字符时加引号，内部引号加倍。
     */
    public static String quote(String text) {
        if (text == null || text.isEmpty()) {
            return "\"\"";
        }
        for (int index = 0; index < text.length(); index++) {
            char ch = text.charAt(index);
            if (ch < 0x80 && !isWordChar(ch)) {
                return "\"" + text.replace("\"", "\"\"") + "\"";
            }
        }
        return text;
    }

    /**
     * 预分词短语按编码后的字符串加引号。
     */
    public static String quote(QueryTokens tokens) {
        if (tokens == null) {
            return "\"\"";
        }
        return quote(tokens.encode());
    }

    static int priority(QueryNode node) {
        if (node instanceof QueryNode.Or) {
            return OR_PRIORITY;
        }
        if (node instanceof QueryNode.And) {
            return AND_PRIORITY;
        }
        if (node instanceof QueryNode.Not) {
            return NOT_PRIORITY;
        }
        if (node instanceof QueryNode.ColumnFilter) {
            return COLUMNFILTER_PRIORITY;
        }
        if (node instanceof QueryNode.Near) {
            return NEAR_PRIORITY;
        }
        if (node instanceof QueryNode.Phrases) {
            return PHRASES_PRIORITY;
        }
        return PHRASE_PRIORITY;
    }

    private static void render(QueryNode query, StringBuilder builder) {
        if (query instanceof QueryNode.Phrase phrase) {
            renderPhrase(phrase, builder);
        } else if (query instanceof QueryNode.Phrases phrases) {
            renderPhrases(phrases.phrases(), builder);
        } else if (query instanceof QueryNode.Near near) {
            builder.append("NEAR(");
            renderPhrases(near.phrases().phrases(), builder);
            if (near.distance() != QueryNode.Near.DEFAULT_DISTANCE) {
                builder.append(", ").append(near.distance());
            }
            builder.append(')');
        } else if (query instanceof QueryNode.ColumnFilter columnFilter) {
            renderColumnFilter(columnFilter, builder);
        } else if (query instanceof QueryNode.And and) {
            renderAnd(and, builder);
        } else if (query instanceof QueryNode.Or or) {
            List<QueryNode> queries = or.queries();
            for (int index = 0; index < queries.size(); index++) {
                if (index > 0) {
                    builder.append(" OR ");
                }
                renderChild(queries.get(index), priority(queries.get(index)) < OR_PRIORITY, builder);
            }
        } else if (query instanceof QueryNode.Not not) {
            renderChild(not.match(), priority(not.match()) < NOT_PRIORITY, builder);
            builder.append(" NOT ");
            // NOT 左结合，右侧的 NOT 必须加括号
            QueryNode noMatch = not.noMatch();
            renderChild(noMatch, priority(noMatch) < NOT_PRIORITY || noMatch instanceof QueryNode.Not, builder);
        }
    }

    private static void renderPhrase(QueryNode.Phrase phrase, StringBuilder builder) {
        if (phrase.initial()) {
            builder.append('^');
        }
        if (phrase.sequence()) {
            builder.append("+ ");
        }
        builder.append(phrase.hasTokens() ? quote(phrase.tokens()) : quoteTerm(phrase.text()));
        if (phrase.prefix()) {
            builder.append('*');
        }
    }

    private static void renderPhrases(List<QueryNode.Phrase> phrases, StringBuilder builder) {
        for (int index = 0; index < phrases.size(); index++) {
            if (index > 0) {
                builder.append(' ');
            }
            renderPhrase(phrases.get(index), builder);
        }
    }

    private static void renderColumnFilter(QueryNode.ColumnFilter columnFilter, StringBuilder builder) {
        if (columnFilter.filter() == FilterMode.EXCLUDE) {
            builder.append('-');
        }
        List<String> columns = columnFilter.columns();
        if (columns.size() > 1) {
            builder.append('{');
        }
        for (int index = 0; index < columns.size(); index++) {
            if (index > 0) {
                builder.append(' ');
            }
            builder.append(quoteTerm(columns.get(index)));
        }
        if (columns.size() > 1) {
            builder.append('}');
        }
        builder.append(": ");

        QueryNode scoped = columnFilter.query();
        boolean bare = scoped instanceof QueryNode.Phrase
                || scoped instanceof QueryNode.Phrases
                || scoped instanceof QueryNode.Near
                || scoped instanceof QueryNode.ColumnFilter;
        renderChild(scoped, !bare, builder);
    }

    /**
     * 相邻 NEAR 之间使用隐式 AND，其余子节点之间写出 AND。
     */
    private static void renderAnd(QueryNode.And and, StringBuilder builder) {
        List<QueryNode> queries = and.queries();
        for (int index = 0; index < queries.size(); index++) {
            QueryNode child = queries.get(index);
            if (index > 0) {
                boolean implicit = child instanceof QueryNode.Near && queries.get(index - 1) instanceof QueryNode.Near;
                builder.append(implicit ? " " : " AND ");
            }
            renderChild(child, priority(child) < AND_PRIORITY, builder);
        }
    }

    private static void renderChild(QueryNode child, boolean parenthesize, StringBuilder builder) {
        if (parenthesize) {
            builder.append('(');
        }
        render(child, builder);
        if (parenthesize) {
            builder.append(')');
        }
    }

    /**
     * 短语文本与列名：关键字本身也要加引号，否则会被词法分析为运算符。
     */
    private static String quoteTerm(String text) {
        if (KEYWORDS.contains(text)) {
            return "\"" + text + "\"";
        }
        return quote(text);
    }

    private static boolean isWordChar(char ch) {
        return (ch >= '0' && ch <= '9')
            || (ch >= 'A' && ch <= 'Z')
            || (ch >= 'a' && ch <= 'z')
            || ch == '_';
    }
}
