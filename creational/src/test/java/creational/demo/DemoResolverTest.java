package creational.demo;

import creational.demo.fixtures.AlphaDemo;
import creational.demo.fixtures.BetaDemo;
import creational.demo.invalid.ExplodingConstructorDemo;
import creational.demo.invalid.NoDefaultConstructorDemo;
import creational.demo.invalid.NotADemo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DemoResolver")
class DemoResolverTest {

    private final DemoResolver resolver = new DemoResolver();

    static class PrivateConstructorDemo implements PatternDemo {
        private PrivateConstructorDemo() {
        }

        @Override
        public String name() {
            return "private";
        }

        @Override
        public void run(DemoContext context) {
        }
    }

    @Test
    @DisplayName("should instantiate a demo")
    void shouldInstantiateDemo() {
        PatternDemo demo = resolver.resolve(AlphaDemo.class);

        assertThat(demo).isInstanceOf(AlphaDemo.class);
        assertThat(demo.name()).isEqualTo("alpha");
    }

    @Test
    @DisplayName("should use a private no-arg constructor")
    void shouldUsePrivateNoArgConstructor() {
        assertThat(resolver.resolve(PrivateConstructorDemo.class)).isInstanceOf(PrivateConstructorDemo.class);
    }

    @Test
    @DisplayName("should keep order when resolving several")
    void shouldKeepOrderWhenResolvingSeveral() {
        List<PatternDemo> demos = resolver.resolveAll(List.of(BetaDemo.class, AlphaDemo.class));

        assertThat(demos).extracting(PatternDemo::name).containsExactly("beta", "alpha");
    }

    @Test
    @DisplayName("should reject a class that is not a PatternDemo")
    void shouldRejectClassThatIsNotPatternDemo() {
        assertThatThrownBy(() -> resolver.resolve(NotADemo.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must implement PatternDemo");
    }

    @Test
    @DisplayName("should reject a class without a no-arg constructor")
    void shouldRejectClassWithoutNoArgConstructor() {
        assertThatThrownBy(() -> resolver.resolve(NoDefaultConstructorDemo.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must have a no-arg constructor");
    }

    @Test
    @DisplayName("should wrap constructor failures")
    void shouldWrapConstructorFailures() {
        assertThatThrownBy(() -> resolver.resolve(ExplodingConstructorDemo.class))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("Failed to instantiate")
                .hasRootCauseInstanceOf(IllegalStateException.class)
                .hasRootCauseMessage("cannot start");
    }
}
