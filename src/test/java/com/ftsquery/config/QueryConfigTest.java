package com.ftsquery.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;

import org.junit.jupiter.api.Test;

class QueryConfigTest {

    @Test
    void testDefaults() {
        QueryConfig config = QueryConfig.defaults();

        assertNotNull(config);
        assertEquals(Constants.MAX_QUERY_LENGTH, config.getMaxQueryLength());
        assertEquals(Constants.MAX_NESTING_DEPTH, config.getMaxNestingDepth());
        assertNotSame(config, QueryConfig.defaults());
    }

    @Test
    void testSetters() {
        QueryConfig config = new QueryConfig();

        config.setMaxQueryLength(2048);
        config.setMaxNestingDepth(16);

        assertEquals(2048, config.getMaxQueryLength());
        assertEquals(16, config.getMaxNestingDepth());
    }
}
