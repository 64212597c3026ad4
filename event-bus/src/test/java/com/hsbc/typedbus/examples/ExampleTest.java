package com.hsbc.typedbus.examples;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Example Tests")
class ExampleTest {

    @Test
    @DisplayName("Should run every demonstration")
    void shouldRunEveryDemonstration() {
        PrintStream original = System.out;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            Example.main(new String[0]);
        } finally {
            System.setOut(original);
        }

        String output = captured.toString(StandardCharsets.UTF_8);
        assertThat(output)
            .contains("A received ping 5", "B received ping 5", "B received ping 7")
            .doesNotContain("A received ping 7")
            .contains("Rendering frame 1", "Rendering frame 3")
            .contains("Flush 3 drained 1 event(s)")
            .contains("Dead events: 2");
    }
}
