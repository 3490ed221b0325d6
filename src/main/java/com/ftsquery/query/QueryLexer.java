package com.ftsquery.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class QueryLexer {
    private static final Map<Character, TokenType> SINGLE_CHAR_TOKENS = Map.of(
        '(', TokenType.LP,
        ')', TokenType.RP,
        '{', TokenType.LCP,
        '}', TokenType.RCP,
        ':', TokenType.COLON,
        ',', TokenType.COMMA,
        '+', TokenType.PLUS,
        '*', TokenType.STAR,
        '-', TokenType.MINUS,
        '^', TokenType.CARET
    );

    // 区分大小写
    private static final Map<String, TokenType> KEYWORDS = Map.of(
        "OR", TokenType.OR,
        "AND", TokenType.AND,
        "NOT", TokenType.NOT,
        "NEAR", TokenType.NEAR
    );

    /**
     * 将原始查询字符串切分为词法 token 序列，末尾总是 EOF。
     */
    public List<LexToken> tokenize(String query) {
        if (query == null) {
            throw new QueryParseException("查询字符串不能为空", 0, "");
        }

        List<LexToken> tokens = new ArrayList<>();
        int index = 0;
        while (index < query.length()) {
            char currentChar = query.charAt(index);
            if (isSpace(currentChar)) {
                index++;
                continue;
            }

            TokenType single = SINGLE_CHAR_TOKENS.get(currentChar);
            if (single != null) {
                tokens.add(new LexToken(single, String.valueOf(currentChar), index));
                index++;
                continue;
            }

            if (currentChar == '"') {
                index = readQuotedToken(query, index, tokens);
                continue;
            }

            if (isBareword(currentChar)) {
                index = readBareword(query, index, tokens);
                continue;
            }

            throw new QueryParseException("无法识别字符: '" + currentChar + "'", index, query);
        }

        tokens.add(new LexToken(TokenType.EOF, "", query.length()));
        demoteNear(tokens);
        return tokens;
    }

    /**
     * 读取双引号字符串，内部连续两个引号表示一个字面引号。
     */
    private int readQuotedToken(String query, int quoteIndex, List<LexToken> tokens) {
        int index = quoteIndex + 1;
        StringBuilder textBuilder = new StringBuilder();
        while (index < query.length()) {
            char currentChar = query.charAt(index);
            if (currentChar == '"') {
                if (index + 1 < query.length() && query.charAt(index + 1) == '"') {
                    textBuilder.append('"');
                    index += 2;
                    continue;
                }
                tokens.add(new LexToken(TokenType.QUOTED_STRING, textBuilder.toString(), quoteIndex));
                return index + 1;
            }
            textBuilder.append(currentChar);
            index++;
        }
        throw new QueryParseException("未闭合引号", quoteIndex, query);
    }

    /**
     * 读取最长裸词；完全等于关键字时产生关键字 token。
     */
    private int readBareword(String query, int start, List<LexToken> tokens) {
        int index = start;
        while (index < query.length() && isBareword(query.charAt(index))) {
            index++;
        }
        String value = query.substring(start, index);
        tokens.add(new LexToken(KEYWORDS.getOrDefault(value, TokenType.STRING), value, start));
        return index;
    }

    /**
     * NEAR 只有紧跟左括号时才是运算符，否则降级为普通字符串。
     */
    private void demoteNear(List<LexToken> tokens) {
        for (int index = 0; index < tokens.size() - 1; index++) {
            LexToken token = tokens.get(index);
            if (token.type() == TokenType.NEAR && tokens.get(index + 1).type() != TokenType.LP) {
                tokens.set(index, new LexToken(TokenType.STRING, token.value(), token.position()));
            }
        }
    }

    private static boolean isSpace(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\r';
    }

    /**
     * ASCII 字母数字、下划线、U+001A 以及所有非 ASCII 字符。
     */
    static boolean isBareword(char ch) {
        return (ch >= '0' && ch <= '9')
            || (ch >= 'A' && ch <= 'Z')
            || (ch >= 'a' && ch <= 'z')
            || ch == '_'
            || ch == '\u001a'
            || ch >= 0x80;
    }
}
