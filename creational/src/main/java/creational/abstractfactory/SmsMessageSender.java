package creational.abstractfactory;

import java.io.PrintStream;

public class SmsMessageSender extends ConsoleMessageSender {

    public SmsMessageSender() {
        this(System.out);
    }

    public SmsMessageSender(PrintStream out) {
        super(out);
    }

    @Override
    protected String prefix() {
        return "SMS SENT: ";
    }
}
