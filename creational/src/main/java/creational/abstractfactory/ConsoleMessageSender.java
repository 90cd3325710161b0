package creational.abstractfactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Sender that writes each message, prefixed with its channel, to a {@link PrintStream}.
 */
abstract class ConsoleMessageSender implements MessageSender {

    private final PrintStream out;

    protected ConsoleMessageSender(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    /** Returns the prefix written before the message, e.g. {@code "EMAIL SENT: "}. */
    protected abstract String prefix();

    @Override
    public void send(String message) {
        out.println(prefix() + message);
    }
}
