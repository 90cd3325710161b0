package creational.abstractfactory;

public class EmailMessageFormatter implements MessageFormatter {

    @Override
    public String format(String message) {
        return "[EMAIL FORMAT] " + message;
    }
}
