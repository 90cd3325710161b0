package creational.abstractfactory;

public class SmsMessageFormatter implements MessageFormatter {

    @Override
    public String format(String message) {
        return "[SMS FORMAT] " + message;
    }
}
