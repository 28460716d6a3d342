package io.cwrelay.core.sink;

import io.cwrelay.core.model.OutputRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WavefrontLineFormatTest {

    @Test
    @DisplayName("Should format name, value, seconds, source and tags in order")
    void formatLine() {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("Namespace", "AWS/EC2");
        tags.put("InstanceId", "i-1");

        String line = WavefrontLineFormat.format(
                new OutputRecord("aws.ec2.cpuutilization", 42.0, 1709294400123L, "AWS", tags));

        assertEquals("aws.ec2.cpuutilization 42.0 1709294400 source=AWS Namespace=AWS/EC2 InstanceId=i-1", line);
    }

    @Test
    @DisplayName("Should format without tags")
    void noTags() {
        String line = WavefrontLineFormat.format(new OutputRecord("m", 1.5, 2000L, "host", Map.of()));

        assertEquals("m 1.5 2 source=host", line);
    }

    @Test
    @DisplayName("Should print values in plain notation")
    void plainValues() {
        assertEquals("0.00001", WavefrontLineFormat.formatValue(0.00001));
        assertEquals("12345678900", WavefrontLineFormat.formatValue(1.23456789E10));
        assertEquals("-3.25", WavefrontLineFormat.formatValue(-3.25));
        assertEquals("NaN", WavefrontLineFormat.formatValue(Double.NaN));
    }
}
