package eu.virtualparadox.citeqa.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TimestampFormatterTest {

    @Test
    @DisplayName("Below one hour renders as MM:SS")
    void testMinutes() {
        assertEquals("00:00", TimestampFormatter.format(0));
        assertEquals("01:05", TimestampFormatter.format(65.9));
        assertEquals("59:59", TimestampFormatter.format(3599));
    }

    @Test
    @DisplayName("From one hour upward renders as HH:MM:SS")
    void testHours() {
        assertEquals("01:00:00", TimestampFormatter.format(3600));
        assertEquals("02:03:04", TimestampFormatter.format(7384));
    }

    @Test
    @DisplayName("Negative offsets clamp to zero")
    void testNegative() {
        assertEquals("00:00", TimestampFormatter.format(-5));
    }
}
