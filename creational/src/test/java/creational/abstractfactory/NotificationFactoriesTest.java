package creational.abstractfactory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("NotificationFactories")
class NotificationFactoriesTest {

    @Test
    @DisplayName("forChannel should keep each family consistent")
    void forChannelShouldKeepEachFamilyConsistent() {
        NotificationFactory email = NotificationFactories.forChannel(NotificationChannel.EMAIL);
        NotificationFactory sms = NotificationFactories.forChannel(NotificationChannel.SMS);

        assertThat(email.channel()).isEqualTo(NotificationChannel.EMAIL);
        assertThat(email.createSender()).isInstanceOf(EmailMessageSender.class);
        assertThat(email.createFormatter()).isInstanceOf(EmailMessageFormatter.class);
        assertThat(sms.channel()).isEqualTo(NotificationChannel.SMS);
        assertThat(sms.createSender()).isInstanceOf(SmsMessageSender.class);
        assertThat(sms.createFormatter()).isInstanceOf(SmsMessageFormatter.class);
    }

    @Test
    @DisplayName("forName should ignore case")
    void forNameShouldIgnoreCase() {
        assertThat(NotificationFactories.forName("email").channel()).isEqualTo(NotificationChannel.EMAIL);
        assertThat(NotificationFactories.forName("SMS").channel()).isEqualTo(NotificationChannel.SMS);
        assertThat(NotificationFactories.forName(" Sms ").channel()).isEqualTo(NotificationChannel.SMS);
    }

    @Test
    @DisplayName("forName should route output to the given stream")
    void forNameShouldRouteOutputToGivenStream() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        NotificationFactories.forName("sms", out).createSender().send("ping");

        assertThat(buffer.toString(StandardCharsets.UTF_8)).startsWith("SMS SENT: ping");
    }

    @ParameterizedTest
    @ValueSource(strings = {"push", "", "mail"})
    @DisplayName("forName should reject unsupported types")
    void forNameShouldRejectUnsupportedTypes(String name) {
        assertThatThrownBy(() -> NotificationFactories.forName(name))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported notification type: " + name);
    }

    @Test
    @DisplayName("forChannel should reject null")
    void forChannelShouldRejectNull() {
        assertThatThrownBy(() -> NotificationFactories.forChannel(null))
                .isInstanceOf(NullPointerException.class);
    }
}
