package com.ftsquery.codec;

import com.ftsquery.ast.QueryNode;
import com.ftsquery.ast.QueryNode.Phrase;
import com.ftsquery.ast.QueryTokens;
import com.ftsquery.ast.QueryValidationException;
import com.ftsquery.query.QueryParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueryJsonTest {

    private final QueryJson json = new QueryJson();

    @Test
    @DisplayName("紧凑JSON输出，类型键在前")
    void testToJson() {
        assertEquals("{\"@\":\"PHRASE\",\"prefix\":true,\"text\":\"hello\"}",
                json.toJson(Phrase.of("hello").withPrefix(true)));
    }

    @Test
    @DisplayName("预分词短语写为编码字符串并可读回")
    void testQueryTokensRoundTrip() {
        Phrase phrase = Phrase.of(QueryTokens.of("a", "b"));

        String text = json.toJson(phrase);
        assertTrue(text.contains("\"$!Tokens~a|b\""));
        assertEquals(phrase, json.fromJson(text));
    }

    @Test
    @DisplayName("JSON 中带保留前缀的字符串读为预分词短语")
    void testMarkerStringFromJson() {
        assertEquals(Phrase.of(QueryTokens.of("x")), json.fromJson("{\"@\":\"PHRASE\",\"text\":\"$!Tokens~x\"}"));
        assertEquals(Phrase.of(QueryTokens.of("x", "y")), json.fromJson("\"$!Tokens~x|y\""));
        assertEquals(Phrase.of("$!Tokens~x"),
                new QueryDictCodec().fromDict(new QueryDictCodec().toDict(Phrase.of("$!Tokens~x"))));
    }

    @Test
    @DisplayName("JSON往返得到相等的AST")
    void testRoundTrip() {
        QueryNode ast = new QueryParser().parse("{a b}: (NEAR(x y, 3) OR -c: z*) NOT ^w");

        assertEquals(ast, json.fromJson(json.toJson(ast)));
        assertEquals(ast, json.fromJson(json.toPrettyJson(ast)));
    }

    @Test
    @DisplayName("读取简写形式")
    void testShorthandJson() {
        assertEquals(Phrase.of("hello"), json.fromJson("\"hello\""));
        assertEquals("PHRASES", json.fromJson("[\"hello\", \"world\"]").typeName());
    }

    @Test
    @DisplayName("非法JSON抛出校验异常并保留原因")
    void testMalformedJson() {
        QueryValidationException exception = assertThrows(QueryValidationException.class, () -> json.fromJson("{\"@\":"));
        assertNotNull(exception.getCause());
        assertThrows(QueryValidationException.class, () -> json.fromJson(null));
        assertThrows(QueryValidationException.class, () -> json.fromJson("{\"@\":\"NEAR\",\"phrases\":[\"a\"]}"));
    }

    @Test
    @DisplayName("NEAR 距离超出 int 范围时失败")
    void testDistanceOutOfRange() {
        assertThrows(QueryValidationException.class,
                () -> json.fromJson("{\"@\":\"NEAR\",\"phrases\":[\"a\",\"b\"],\"distance\":99999999999999999999}"));
        assertThrows(QueryValidationException.class,
                () -> json.fromJson("{\"@\":\"NEAR\",\"phrases\":[\"a\",\"b\"],\"distance\":2.5}"));
        assertEquals(7, ((QueryNode.Near) json.fromJson("{\"@\":\"NEAR\",\"phrases\":[\"a\",\"b\"],\"distance\":7}")).distance());
    }
}
