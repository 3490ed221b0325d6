package com.ftsquery.query;

import com.ftsquery.ast.FilterMode;
import com.ftsquery.ast.QueryNode;
import com.ftsquery.ast.QueryTokens;
import com.ftsquery.config.QueryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 递归下降 + 优先级爬升的查询解析器。
 *
 * <p>结合强度从高到低：相邻短语的隐式 AND、连续 NEAR 组、NOT、AND、OR。
 * 解析器实例持有单次解析的状态，不能被多个线程同时使用。
 */
public class QueryParser {
    private static final Logger logger = LoggerFactory.getLogger(QueryParser.class);

    private static final int OR_PRECEDENCE = 10;
    private static final int AND_PRECEDENCE = 20;
    private static final int NOT_PRECEDENCE = 30;

    private final QueryConfig config;

    private List<LexToken> tokens;
    private int pos;
    private String queryString;
    private int depth;
    // 最近解析的 part 是否以括号子查询结尾；括号之后不插入隐式 AND
    private boolean lastPartWasGroup;

    public QueryParser() {
        this(QueryConfig.defaults());
    }

    public QueryParser(QueryConfig config) {
        this.config = config;
    }

    /**
     * 将查询字符串解析为 AST。
     */
    public QueryNode parse(String query) {
        if (query == null) {
            throw new QueryParseException("查询字符串不能为空", 0, "");
        }
        if (query.length() > config.getMaxQueryLength()) {
            throw new QueryParseException("查询长度超过限制（最大 " + config.getMaxQueryLength() + " 字符）",
                    config.getMaxQueryLength(), query);
        }

        this.tokens = new QueryLexer().tokenize(query);
        this.pos = 0;
        this.queryString = query;
        this.depth = 0;
        this.lastPartWasGroup = false;

        if (current().type() == TokenType.EOF) {
            throw new QueryParseException("查询不能为空", 0, queryString);
        }

        QueryNode ast = parseQuery(0);
        if (current().type() != TokenType.EOF) {
            throw new QueryParseException("意外token: " + describe(current()), current().position(), queryString);
        }

        logger.debug("解析完成: {} 个 token -> {}", tokens.size(), ast.typeName());
        return ast;
    }

    /**
     * 优先级爬升：先解析一个隐式 AND 序列，再折叠优先级高于阈值的中缀运算符。
     */
    private QueryNode parseQuery(int rightBindingPower) {
        enterNested(current());
        try {
            QueryNode left = parseImplicitAnd();
            while (rightBindingPower < infixPrecedence(current().type())) {
                LexToken operator = advance();
                QueryNode right = parseQuery(infixPrecedence(operator.type()));
                left = combine(operator.type(), left, right);
            }
            return left;
        } finally {
            depth--;
        }
    }

    /**
     * 仅以空白分隔的短语、NEAR 组、列过滤器之间是隐式 AND，括号子查询前后除外。
     */
    private QueryNode parseImplicitAnd() {
        List<QueryNode> parts = new ArrayList<>();
        appendFlattenedAnd(parts, parsePart());
        while (!lastPartWasGroup && startsImplicitPart(current())) {
            appendFlattenedAnd(parts, parsePart());
        }
        return parts.size() == 1 ? parts.get(0) : new QueryNode.And(parts);
    }

    /**
     * 按前瞻 token 分派：括号、NEAR 组、列过滤器或短语序列。
     */
    private QueryNode parsePart() {
        if (isColumnFilterStart()) {
            return parseColumnFilter();
        }

        if (current().type() == TokenType.LP) {
            QueryNode grouped = parseGroup();
            lastPartWasGroup = true;
            return grouped;
        }

        if (current().type() == TokenType.NEAR) {
            List<QueryNode> nearGroups = new ArrayList<>();
            nearGroups.add(parseNear());
            while (current().type() == TokenType.NEAR) {
                nearGroups.add(parseNear());
            }
            lastPartWasGroup = false;
            return nearGroups.size() == 1 ? nearGroups.get(0) : new QueryNode.And(nearGroups);
        }

        QueryNode phrases = parsePhrases();
        lastPartWasGroup = false;
        return phrases;
    }

    /**
     * 解析括号子查询，括号内按完整优先级解析。
     */
    private QueryNode parseGroup() {
        LexToken open = advance();
        QueryNode grouped = parseQuery(0);
        if (current().type() != TokenType.RP) {
            if (current().type() == TokenType.EOF) {
                throw new QueryParseException("未闭合的左括号", open.position(), queryString);
            }
            throw new QueryParseException("缺少右括号以闭合位置 " + open.position() + " 的左括号",
                    current().position(), queryString);
        }
        advance();
        return grouped;
    }

    /**
     * 解析短语序列：单个短语返回 PHRASE，多个返回 PHRASES。
     */
    private QueryNode parsePhrases() {
        List<QueryNode.Phrase> phrases = parsePhraseRun();
        return phrases.size() == 1 ? phrases.get(0) : new QueryNode.Phrases(phrases);
    }

    private List<QueryNode.Phrase> parsePhraseRun() {
        List<QueryNode.Phrase> phrases = new ArrayList<>();
        phrases.add(parsePhrase(true));
        while (continuesPhraseRun()) {
            phrases.add(parsePhrase(false));
        }
        return phrases;
    }

    /**
     * 解析单个短语：[+] [^] 字符串 [*]。第一个短语不能带 +，带 + 的短语不能带 ^。
     */
    private QueryNode.Phrase parsePhrase(boolean first) {
        boolean sequence = false;
        if (current().type() == TokenType.PLUS) {
            if (first) {
                throw new QueryParseException("短语不能以 + 开头", current().position(), queryString);
            }
            advance();
            sequence = true;
        }

        boolean initial = false;
        if (current().type() == TokenType.CARET) {
            if (sequence) {
                throw new QueryParseException("+ 之后的短语不能使用 ^", current().position(), queryString);
            }
            advance();
            initial = true;
        }

        LexToken termToken = current();
        if (!termToken.isString()) {
            throw new QueryParseException("需要检索词，实际为: " + describe(termToken), termToken.position(), queryString);
        }
        advance();
        boolean prefix = match(TokenType.STAR);

        QueryTokens queryTokens = QueryTokens.decode(termToken.value()).orElse(null);
        String text = queryTokens == null ? termToken.value() : null;
        return new QueryNode.Phrase(text, queryTokens, initial, prefix, sequence);
    }

    /**
     * 解析 NEAR(短语 短语 ... [, 距离])。
     */
    private QueryNode.Near parseNear() {
        LexToken nearToken = advance();
        enterNested(nearToken);
        try {
            expect(TokenType.LP, "NEAR 后缺少左括号");
            List<QueryNode.Phrase> phrases = parsePhraseRun();
            if (phrases.size() < 2) {
                throw new QueryParseException("NEAR 至少需要两个短语", nearToken.position(), queryString);
            }

            int distance = QueryNode.Near.DEFAULT_DISTANCE;
            if (match(TokenType.COMMA)) {
                distance = parseDistance(current());
                advance();
            }

            expect(TokenType.RP, "NEAR 缺少右括号");
            return new QueryNode.Near(new QueryNode.Phrases(phrases), distance);
        } finally {
            depth--;
        }
    }

    /**
     * 距离必须是未加引号的正整数。
     */
    private int parseDistance(LexToken numberToken) {
        String value = numberToken.value();
        if (numberToken.type() != TokenType.STRING || value.isEmpty() || !value.chars().allMatch(ch -> ch >= '0' && ch <= '9')) {
            throw new QueryParseException("NEAR 距离需要数字，实际为: " + describe(numberToken), numberToken.position(), queryString);
        }
        int distance;
        try {
            distance = Integer.parseInt(value);
        } catch (NumberFormatException exception) {
            throw new QueryParseException("NEAR 距离超出范围: " + value, numberToken.position(), queryString);
        }
        if (distance < 1) {
            throw new QueryParseException("NEAR 距离必须至少为 1", numberToken.position(), queryString);
        }
        return distance;
    }

    /**
     * 解析列过滤器：[-] (列名 | {列名 ...}) : 作用域查询。
     * 作用域为括号子查询、单个 NEAR 组、嵌套列过滤器或短语序列。
     */
    private QueryNode parseColumnFilter() {
        enterNested(current());
        try {
            FilterMode filter = match(TokenType.MINUS) ? FilterMode.EXCLUDE : FilterMode.INCLUDE;

            List<String> columns = new ArrayList<>();
            if (match(TokenType.LCP)) {
                while (current().isString()) {
                    columns.add(advance().value());
                }
                if (columns.isEmpty()) {
                    throw new QueryParseException("缺少列名", current().position(), queryString);
                }
                expect(TokenType.RCP, "列名列表缺少右花括号");
            } else {
                if (!current().isString()) {
                    throw new QueryParseException("缺少列名", current().position(), queryString);
                }
                columns.add(advance().value());
            }

            expect(TokenType.COLON, "列过滤器缺少冒号");

            QueryNode scoped;
            if (current().type() == TokenType.LP) {
                scoped = parseGroup();
                lastPartWasGroup = true;
            } else if (current().type() == TokenType.NEAR) {
                scoped = parseNear();
                lastPartWasGroup = false;
            } else if (isColumnFilterStart()) {
                scoped = parseColumnFilter();
            } else {
                scoped = parsePhrases();
                lastPartWasGroup = false;
            }
            return new QueryNode.ColumnFilter(columns, filter, scoped);
        } finally {
            depth--;
        }
    }

    /**
     * 中缀折叠；同类 AND/OR 直接合并子节点，保持树扁平。
     */
    private QueryNode combine(TokenType operator, QueryNode left, QueryNode right) {
        if (operator == TokenType.NOT) {
            return new QueryNode.Not(left, right);
        }
        List<QueryNode> operands = new ArrayList<>();
        if (operator == TokenType.AND) {
            appendFlattenedAnd(operands, left);
            appendFlattenedAnd(operands, right);
            return new QueryNode.And(operands);
        }
        appendFlattenedOr(operands, left);
        appendFlattenedOr(operands, right);
        return new QueryNode.Or(operands);
    }

    private static void appendFlattenedAnd(List<QueryNode> operands, QueryNode operand) {
        if (operand instanceof QueryNode.And and) {
            operands.addAll(and.queries());
        } else {
            operands.add(operand);
        }
    }

    private static void appendFlattenedOr(List<QueryNode> operands, QueryNode operand) {
        if (operand instanceof QueryNode.Or or) {
            operands.addAll(or.queries());
        } else {
            operands.add(operand);
        }
    }

    private static int infixPrecedence(TokenType type) {
        return switch (type) {
            case OR -> OR_PRECEDENCE;
            case AND -> AND_PRECEDENCE;
            case NOT -> NOT_PRECEDENCE;
            default -> 0;
        };
    }

    /**
     * 判断当前位置是否为列过滤器起始：- 、{ 或紧跟冒号的字符串。
     */
    private boolean isColumnFilterStart() {
        TokenType type = current().type();
        return type == TokenType.MINUS
                || type == TokenType.LCP
                || (current().isString() && peek(1).type() == TokenType.COLON);
    }

    /**
     * 判断当前 token 是否可在隐式 AND 中开始新的 part。
     */
    private static boolean startsImplicitPart(LexToken token) {
        TokenType type = token.type();
        return type == TokenType.MINUS
                || type == TokenType.LCP
                || type == TokenType.NEAR
                || type == TokenType.CARET
                || token.isString();
    }

    /**
     * 判断短语序列是否继续；紧跟冒号的字符串属于下一个列过滤器。
     */
    private boolean continuesPhraseRun() {
        TokenType type = current().type();
        if (type == TokenType.PLUS || type == TokenType.CARET) {
            return true;
        }
        return current().isString() && peek(1).type() != TokenType.COLON;
    }

    /**
     * 进入一层嵌套，超过配置上限时抛出带位置的语法错误。
     */
    private void enterNested(LexToken token) {
        depth++;
        if (depth > config.getMaxNestingDepth()) {
            throw new QueryParseException("嵌套层级超过上限 " + config.getMaxNestingDepth(), token.position(), queryString);
        }
    }

    /**
     * 断言当前 token 类型符合预期，否则抛出带位置的语法错误。
     */
    private void expect(TokenType type, String message) {
        if (!match(type)) {
            throw new QueryParseException(message, current().position(), queryString);
        }
    }

    private static String describe(LexToken token) {
        return token.type() == TokenType.EOF ? "查询结尾" : token.type() + " '" + token.value() + "'";
    }

    /**
     * 返回当前位置 token。
     */
    private LexToken current() {
        return tokens.get(pos);
    }

    /**
     * 向前查看第 offset 个 token，越界时返回 EOF。
     */
    private LexToken peek(int offset) {
        return tokens.get(Math.min(pos + offset, tokens.size() - 1));
    }

    /**
     * 消费并返回当前位置 token。
     */
    private LexToken advance() {
        return tokens.get(pos++);
    }

    /**
     * 若当前位置匹配指定类型则消费并返回 true。
     */
    private boolean match(TokenType type) {
        if (current().type() == type) {
            pos++;
            return true;
        }
        return false;
    }
}
