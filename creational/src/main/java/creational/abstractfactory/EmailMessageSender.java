package creational.abstractfactory;

import java.io.PrintStream;

public class EmailMessageSender extends ConsoleMessageSender {

    public EmailMessageSender() {
        this(System.out);
    }

    public EmailMessageSender(PrintStream out) {
        super(out);
    }

    @Override
    protected String prefix() {
        return "EMAIL SENT: ";
    }
}
