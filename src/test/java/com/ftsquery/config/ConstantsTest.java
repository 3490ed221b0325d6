package com.ftsquery.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.lang.reflect.Constructor;
import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testConstantValues() {
        assertEquals(10, Constants.DEFAULT_NEAR_DISTANCE);
        assertEquals(100_000, Constants.MAX_QUERY_LENGTH);
        assertEquals(256, Constants.MAX_NESTING_DEPTH);

        assertEquals("$!Tokens~", Constants.QUERY_TOKENS_MARKER);
        assertEquals("$!ZeRo", Constants.QUERY_TOKENS_ZERO);
        assertEquals("|", Constants.QUERY_TOKENS_SLOT_SEPARATOR);
        assertEquals(">", Constants.QUERY_TOKENS_COLOCATED_SEPARATOR);
        assertEquals("@", Constants.DICT_TYPE_KEY);
    }

    @Test
    void testPrivateConstructorReachableByReflection() throws Exception {
        Constructor<Constants> constructor = Constants.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        Constants constantsInstance = constructor.newInstance();
        assertNotNull(constantsInstance);
    }
}
