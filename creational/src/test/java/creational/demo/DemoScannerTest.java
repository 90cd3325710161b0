package creational.demo;

import creational.demo.fixtures.AardvarkDemo;
import creational.demo.fixtures.AlphaDemo;
import creational.demo.fixtures.BetaDemo;
import creational.demo.invalid.ExplodingConstructorDemo;
import creational.demo.invalid.NoDefaultConstructorDemo;
import creational.demo.invalid.NotADemo;
import creational.exceptions.DemoNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DemoScanner")
class DemoScannerTest {

    @Test
    @DisplayName("should find demos ordered by order then class name")
    void shouldFindDemosInRunOrder() {
        assertThat(DemoScanner.scan("creational.demo.fixtures"))
                .containsExactly(AlphaDemo.class, AardvarkDemo.class, BetaDemo.class);
    }

    @Test
    @DisplayName("should only return classes under the prefix")
    void shouldOnlyReturnClassesUnderPrefix() {
        assertThat(DemoScanner.scan("creational.demo.invalid"))
                .containsExactly(NotADemo.class, NoDefaultConstructorDemo.class, ExplodingConstructorDemo.class);
    }

    @Test
    @DisplayName("should throw when a package has no demos")
    void shouldThrowWhenPackageHasNoDemos() {
        assertThatThrownBy(() -> DemoScanner.scan("creational.builder"))
                .isInstanceOf(DemoNotFoundException.class)
                .hasMessageContaining("creational.builder");
    }

    @Test
    @DisplayName("should throw when the package does not exist")
    void shouldThrowWhenPackageDoesNotExist() {
        assertThatThrownBy(() -> DemoScanner.scan("no.such.pkg"))
                .isInstanceOf(DemoNotFoundException.class);
    }

    @Test
    @DisplayName("should reject a blank prefix")
    void shouldRejectBlankPrefix() {
        assertThatThrownBy(() -> DemoScanner.scan(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
