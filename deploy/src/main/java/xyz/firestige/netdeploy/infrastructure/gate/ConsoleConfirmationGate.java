package xyz.firestige.netdeploy.infrastructure.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * 终端交互确认，只有 y / yes 视为同意；输入流结束或读取失败视为拒绝
 */
public class ConsoleConfirmationGate implements ConfirmationGate {

    private static final Logger log = LoggerFactory.getLogger(ConsoleConfirmationGate.class);

    private final BufferedReader in;
    private final PrintStream out;

    public ConsoleConfirmationGate() {
        this(System.in, System.out);
    }

    public ConsoleConfirmationGate(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public synchronized boolean confirm(String prompt) {
        out.print(prompt + " [y/N]: ");
        out.flush();
        try {
            String answer = in.readLine();
            if (answer == null) {
                log.warn("No answer on stdin for prompt '{}', treating as decline", prompt);
                return false;
            }
            String normalized = answer.strip().toLowerCase(Locale.ROOT);
            return normalized.equals("y") || normalized.equals("yes");
        } catch (IOException e) {
            log.warn("Cannot read confirmation from stdin, treating as decline: {}", e.getMessage());
            return false;
        }
    }
}
