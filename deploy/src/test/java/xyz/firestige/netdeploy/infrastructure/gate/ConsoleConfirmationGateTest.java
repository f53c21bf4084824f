package xyz.firestige.netdeploy.infrastructure.gate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("终端确认门 测试")
class ConsoleConfirmationGateTest {

    @ParameterizedTest(name = "输入 ''{0}'' -> {1}")
    @CsvSource(value = {"y,true", "YES,true", " yes ,true", "n,false", "'',false", "sure,false"}, ignoreLeadingAndTrailingWhitespace = false)
    @DisplayName("场景 - 只有 y / yes 视为同意")
    void onlyYesApproves(String answer, boolean expected) {
        // Given
        ByteArrayOutputStream prompt = new ByteArrayOutputStream();
        ConsoleConfirmationGate gate = new ConsoleConfirmationGate(
                new ByteArrayInputStream((answer + "\n").getBytes(StandardCharsets.UTF_8)),
                new PrintStream(prompt, true, StandardCharsets.UTF_8));

        // When
        boolean approved = gate.confirm("Deploy 3 devices?");

        // Then
        assertThat(approved).isEqualTo(expected);
        assertThat(prompt.toString(StandardCharsets.UTF_8)).contains("Deploy 3 devices? [y/N]");
    }

    @Test
    @DisplayName("场景 - 输入流结束视为拒绝")
    void endOfInputDeclines() {
        // Given
        ConsoleConfirmationGate gate = new ConsoleConfirmationGate(new ByteArrayInputStream(new byte[0]),
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));

        // Then
        assertThat(gate.confirm("Continue?")).isFalse();
    }
}
