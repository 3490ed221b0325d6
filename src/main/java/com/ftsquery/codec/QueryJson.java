package com.ftsquery.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.ftsquery.ast.QueryNode;
import com.ftsquery.ast.QueryTokens;
import com.ftsquery.ast.QueryValidationException;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * 嵌套 Map 表示与 JSON 文本之间的绑定，便于日志、存储和界面交换。
 *
 * <p>{@link QueryTokens} 写为带保留前缀的编码字符串，读回时解码为预分词短语，
 * 因此文本恰好以该前缀开头的普通短语经 JSON 往返后会变为预分词短语。
 */
public class QueryJson {
    private final QueryDictCodec codec;
    private final QueryDictCodec reader;
    private final ObjectMapper mapper;

    public QueryJson() {
        this(new QueryDictCodec());
    }

    public QueryJson(QueryDictCodec codec) {
        this.codec = codec;
        this.reader = codec.decodingTokenStrings();
        this.mapper = new ObjectMapper();
        SimpleModule module = new SimpleModule("fts-query");
        module.addSerializer(QueryTokens.class, new QueryTokensSerializer());
        mapper.registerModule(module);
        // "@" 排在所有字段名之前
        mapper.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    public String toJson(QueryNode query) {
        return write(codec.toDict(query), false);
    }

    public String toPrettyJson(QueryNode query) {
        return write(codec.toDict(query), true);
    }

    /**
     * 解析 JSON 文本并按字典规则构建 AST。
     */
    public QueryNode fromJson(String json) {
        if (json == null) {
            throw new QueryValidationException("JSON 文本不能为 null");
        }
        Object value;
        try {
            value = mapper.readValue(json, Object.class);
        } catch (JsonProcessingException exception) {
            throw new QueryValidationException("JSON 无法解析: " + exception.getOriginalMessage(), exception);
        }
        return reader.fromDict(value);
    }

    private String write(Object value, boolean pretty) {
        try {
            return pretty
                ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value)
                : mapper.writeValueAsString(value);
        } catch (JsonProcessingException exception) {
            throw new UncheckedIOException(exception);
        }
    }

    private static final class QueryTokensSerializer extends StdSerializer<QueryTokens> {

        QueryTokensSerializer() {
            super(QueryTokens.class);
        }

        @Override
        public void serialize(QueryTokens value, JsonGenerator generator, SerializerProvider provider) throws IOException {
            generator.writeString(value.encode());
        }
    }
}
