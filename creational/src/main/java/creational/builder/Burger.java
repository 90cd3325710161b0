package creational.builder;

import java.util.ArrayList;
import java.util.List;

/**
 * An immutable burger, assembled step by step with a {@link Builder}.
 *
 * <h2>Usage:</h2>
 * <pre>
 * Burger classic = Burger.builder("Medium")
 *     .addCheese()
 *     .addLettuce()
 *     .addTomato()
 *     .build();
 * </pre>
 */
public final class Burger {

    private final String size;
    private final List<String> ingredients;

    private Burger(Builder b) {
        this.size = b.size;
        this.ingredients = List.copyOf(b.ingredients);
    }

    /**
     * Creates a new builder.
     *
     * @param size the burger size, required
     * @return a new builder instance
     * @throws IllegalArgumentException if size is null or blank
     */
    public static Builder builder(String size) {
        return new Builder(size);
    }

    /** Returns the burger size. */
    public String size() { return size; }

    /** Returns the ingredients in the order they were added. */
    public List<String> ingredients() { return ingredients; }

    @Override
    public String toString() {
        String list = ingredients.isEmpty() ? "Plain" : String.join(", ", ingredients);
        return "Burger(Size=" + size + ", Ingredients=[" + list + "])";
    }

    /**
     * Builder for constructing {@link Burger} instances.
     *
     * <p>{@link #build()} copies the ingredients, so adding more after building does not
     * change burgers already built.
     */
    public static final class Builder {
        private final String size;
        private final List<String> ingredients = new ArrayList<>();

        private Builder(String size) {
            if (size == null || size.isBlank()) {
                throw new IllegalArgumentException("Burger size must be provided");
            }
            this.size = size;
        }

        public Builder addCheese() {
            return add("Cheese");
        }

        public Builder addLettuce() {
            return add("Lettuce");
        }

        public Builder addTomato() {
            return add("Tomato");
        }

        public Builder addPepperoni() {
            return add("Pepperoni");
        }

        public Builder addExtraPatty() {
            return add("Extra Patty");
        }

        private Builder add(String ingredient) {
            ingredients.add(ingredient);
            return this;
        }

        public Burger build() {
            return new Burger(this);
        }
    }
}
