package com.di.fleetnova.util;

import com.di.fleetnova.exception.MalformedTimestampException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimestampParser Tests")
class TimestampParserTest {

    @ParameterizedTest
    @CsvSource({
        "2024-01-15T10:15:30Z,        2024-01-15T10:15:30Z",
        "2024-01-15T12:15:30+02:00,   2024-01-15T10:15:30Z",
        "2024-01-15T10:15:30,         2024-01-15T10:15:30Z",
        "2024-01-15T10:15:30.250,     2024-01-15T10:15:30.250Z",
        "2024-01-15 10:15:30,         2024-01-15T10:15:30Z",
        "2024-01-15 10:15,            2024-01-15T10:15:00Z",
        "2024/01/15 10:15:30,         2024-01-15T10:15:30Z"
    })
    @DisplayName("Should parse known timestamp formats as UTC")
    void testParse_ValidFormats(String raw, String expected) {
        assertEquals(Instant.parse(expected), TimestampParser.parse(raw));
    }

    @ParameterizedTest
    @ValueSource(strings = {"not-a-time", "15/01/2024", "2024-13-45T99:00:00", " "})
    @DisplayName("Should throw MalformedTimestampException for unparseable values")
    void testParse_Invalid(String raw) {
        MalformedTimestampException ex = assertThrows(MalformedTimestampException.class,
                () -> TimestampParser.parse(raw));
        assertEquals(raw, ex.getRawValue());
    }

    @Test
    @DisplayName("Should throw for null")
    void testParse_Null() {
        assertThrows(MalformedTimestampException.class, () -> TimestampParser.parse(null));
    }
}
