package com.relay.control;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class PathPrefixesTest {

    @ParameterizedTest
    @CsvSource({
            "/svc/*, /svc",
            "/svc/,  /svc",
            "/svc,   /svc",
            "svc,    /svc",
            "/*,     ''",
            "/,      ''"
    })
    void normalizes(String raw, String expected) {
        assertThat(PathPrefixes.normalize(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "/svc, /svc,        true",
            "/svc, /svc/,       true",
            "/svc, /svc/items,  true",
            "/svc, /svcx,       false",
            "/svc, /other,      false",
            "'',   /anything,   true"
    })
    void matchesOnSegmentBoundaries(String prefix, String path, boolean expected) {
        assertThat(PathPrefixes.matches(prefix, path)).isEqualTo(expected);
    }
}
