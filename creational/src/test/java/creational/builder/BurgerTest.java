package creational.builder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Burger")
class BurgerTest {

    @Nested
    @DisplayName("builder")
    class BuilderTests {

        @Test
        @DisplayName("should keep ingredients in the order they were added")
        void shouldKeepIngredientsInOrder() {
            Burger burger = Burger.builder("Medium")
                    .addCheese()
                    .addLettuce()
                    .addTomato()
                    .build();

            assertThat(burger.size()).isEqualTo("Medium");
            assertThat(burger.ingredients()).containsExactly("Cheese", "Lettuce", "Tomato");
        }

        @Test
        @DisplayName("should require a size")
        void shouldRequireSize() {
            assertThatThrownBy(() -> Burger.builder(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("Burger size must be provided");
            assertThatThrownBy(() -> Burger.builder("  "))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should not change built burgers when reused")
        void shouldNotChangeBuiltBurgersWhenReused() {
            Burger.Builder builder = Burger.builder("Large").addCheese();
            Burger first = builder.build();

            Burger second = builder.addExtraPatty().build();

            assertThat(first.ingredients()).containsExactly("Cheese");
            assertThat(second.ingredients()).containsExactly("Cheese", "Extra Patty");
        }

        @Test
        @DisplayName("should allow repeated ingredients")
        void shouldAllowRepeatedIngredients() {
            Burger burger = Burger.builder("Large").addPepperoni().addPepperoni().build();

            assertThat(burger.ingredients()).containsExactly("Pepperoni", "Pepperoni");
        }
    }

    @Test
    @DisplayName("ingredients should be unmodifiable")
    void ingredientsShouldBeUnmodifiable() {
        Burger burger = Burger.builder("Small").addCheese().build();

        assertThatThrownBy(() -> burger.ingredients().add("Bacon"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Nested
    @DisplayName("toString")
    class ToString {

        @Test
        @DisplayName("should list ingredients")
        void shouldListIngredients() {
            Burger burger = Burger.builder("Medium").addCheese().addLettuce().addTomato().build();

            assertThat(burger).hasToString("Burger(Size=Medium, Ingredients=[Cheese, Lettuce, Tomato])");
        }

        @Test
        @DisplayName("should show Plain without ingredients")
        void shouldShowPlainWithoutIngredients() {
            assertThat(Burger.builder("Small").build()).hasToString("Burger(Size=Small, Ingredients=[Plain])");
        }
    }
}
