package io.buildqueue4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DurationsTest {

    @Test
    void toSecondsShouldUseTwoDecimals() {
        assertEquals("1.25s", Durations.toSeconds(Duration.ofMillis(1250)));
        assertEquals("0.00s", Durations.toSeconds(Duration.ZERO));
    }

    @Test
    void toMillisShouldClampNegativeAndNull() {
        assertEquals(0L, Durations.toMillis(Duration.ofMillis(-5)));
        assertEquals(0L, Durations.toMillis(null));
        assertEquals(40L, Durations.toMillis(Duration.ofMillis(40)));
    }
}
