package com.cors.handler.policy;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class CorsOptionsTest {

    @Test
    void defaults_areEmpty() {
        CorsOptions options = CorsOptions.defaults();

        assertTrue(options.getAllowedOrigins().isEmpty());
        assertNull(options.getAllowOriginPredicate());
        assertTrue(options.getAllowedMethods().isEmpty());
        assertTrue(options.getAllowedHeaders().isEmpty());
        assertTrue(options.getExposedHeaders().isEmpty());
        assertEquals(0, options.getMaxAge());
        assertFalse(options.isAllowCredentials());
        assertFalse(options.isOptionsPassthrough());
        assertFalse(options.isDebug());
        assertNull(options.getLogger());
    }

    @Test
    void builder_accumulatesAndSkipsNulls() {
        CorsOptions options = CorsOptions.builder()
                .allowedOrigins("http://a.com")
                .allowedOrigins(Arrays.asList("http://b.com", null))
                .allowedOrigins((String[]) null)
                .allowedMethods((List<String>) null)
                .allowedMethods((String[]) null)
                .allowedHeaders((String[]) null)
                .exposedHeaders((String[]) null)
                .build();

        assertEquals(List.of("http://a.com", "http://b.com"), options.getAllowedOrigins());
        assertTrue(options.getAllowedMethods().isEmpty());
        assertTrue(options.getAllowedHeaders().isEmpty());
        assertTrue(options.getExposedHeaders().isEmpty());
    }

    @Test
    void builder_rejectsNullLogger() {
        assertThrows(IllegalArgumentException.class, () -> CorsOptions.builder().logger(null));
    }

    @Test
    void builder_keepsLogger() {
        Logger logger = mock(Logger.class);

        CorsOptions options = CorsOptions.builder().debug(true).logger(logger).build();

        assertTrue(options.isDebug());
        assertSame(logger, options.getLogger());
    }

    @Test
    void lists_areUnmodifiable() {
        CorsOptions options = CorsOptions.builder().allowedOrigins("http://a.com").build();

        assertThrows(UnsupportedOperationException.class, () -> options.getAllowedOrigins().add("x"));
    }
}
