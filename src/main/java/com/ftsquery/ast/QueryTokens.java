package com.ftsquery.ast;

import com.ftsquery.config.Constants;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 预分词短语：调用方已经持有 token，绕过分词器直接作为短语内容。
 *
 * <p>至少一个槽位，每个槽位是一个非空 token 列表：长度为 1 表示普通 token，长度大于 1 表示同一位置的同义 token。
 * 编码后的字符串以 {@link Constants#QUERY_TOKENS_MARKER} 开头，槽位以 {@code |} 分隔，
 * 同位 token 以 {@code >} 分隔，NUL 字符替换为 {@link Constants#QUERY_TOKENS_ZERO}。
 */
public record QueryTokens(List<List<String>> tokens) {

    private static final Pattern SLOT_SPLITTER = Pattern.compile(Pattern.quote(Constants.QUERY_TOKENS_SLOT_SEPARATOR));
    private static final Pattern COLOCATED_SPLITTER = Pattern.compile(Pattern.quote(Constants.QUERY_TOKENS_COLOCATED_SEPARATOR));

    public QueryTokens {
        if (tokens == null) {
            throw new QueryValidationException("tokens 不能为空");
        }
        if (tokens.isEmpty()) {
            throw new QueryValidationException("tokens 至少需要一个槽位");
        }
        List<List<String>> slots = new ArrayList<>(tokens.size());
        for (List<String> slot : tokens) {
            if (slot == null || slot.isEmpty()) {
                throw new QueryValidationException("token 槽位必须至少包含一个 token: " + tokens);
            }
            for (String token : slot) {
                if (token == null) {
                    throw new QueryValidationException("token 不能为 null: " + tokens);
                }
            }
            slots.add(List.copyOf(slot));
        }
        tokens = List.copyOf(slots);
    }

    /**
     * 由普通 token 序列构造，每个 token 占一个槽位。
     */
    public static QueryTokens of(String... tokens) {
        List<List<String>> slots = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            slots.add(Arrays.asList(token));
        }
        return new QueryTokens(slots);
    }

    /**
     * 由混合序列构造：字符串为普通 token，字符串集合为同位 token。
     */
    public static QueryTokens of(List<?> tokens) {
        if (tokens == null) {
            throw new QueryValidationException("tokens 不能为空");
        }
        List<List<String>> slots = new ArrayList<>(tokens.size());
        for (Object item : tokens) {
            if (item instanceof String token) {
                slots.add(List.of(token));
            } else if (item instanceof Collection<?> colocated) {
                List<String> slot = new ArrayList<>(colocated.size());
                for (Object token : colocated) {
                    if (!(token instanceof String text)) {
                        throw new QueryValidationException("同位 token 必须是字符串: " + token);
                    }
                    slot.add(text);
                }
                slots.add(slot);
            } else {
                throw new QueryValidationException("token 必须是字符串或字符串集合: " + item);
            }
        }
        return new QueryTokens(slots);
    }

    /**
     * 生成带保留前缀的编码字符串。
     */
    public String encode() {
        StringBuilder builder = new StringBuilder(Constants.QUERY_TOKENS_MARKER);
        for (int slotIndex = 0; slotIndex < tokens.size(); slotIndex++) {
            if (slotIndex > 0) {
                builder.append(Constants.QUERY_TOKENS_SLOT_SEPARATOR);
            }
            List<String> slot = tokens.get(slotIndex);
            for (int index = 0; index < slot.size(); index++) {
                if (index > 0) {
                    builder.append(Constants.QUERY_TOKENS_COLOCATED_SEPARATOR);
                }
                builder.append(slot.get(index).replace("\0", Constants.QUERY_TOKENS_ZERO));
            }
        }
        return builder.toString();
    }

    /**
     * 若字符串带保留前缀则解码，否则返回空。不会抛出异常。
     */
    public static Optional<QueryTokens> decode(String data) {
        if (data == null || !data.startsWith(Constants.QUERY_TOKENS_MARKER)) {
            return Optional.empty();
        }
        String body = data.substring(Constants.QUERY_TOKENS_MARKER.length());
        List<List<String>> slots = new ArrayList<>();
        for (String slot : SLOT_SPLITTER.split(body, -1)) {
            List<String> colocated = new ArrayList<>();
            for (String token : COLOCATED_SPLITTER.split(slot, -1)) {
                colocated.add(token.replace(Constants.QUERY_TOKENS_ZERO, "\0"));
            }
            slots.add(colocated);
        }
        return Optional.of(new QueryTokens(slots));
    }

    /**
     * UTF-8 字节形式的解码。
     */
    public static Optional<QueryTokens> decode(byte[] utf8) {
        if (utf8 == null) {
            return Optional.empty();
        }
        return decode(new String(utf8, StandardCharsets.UTF_8));
    }
}
