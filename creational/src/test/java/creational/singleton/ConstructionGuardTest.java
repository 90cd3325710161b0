package creational.singleton;

import creational.exceptions.IllegalConstructionException;
import creational.exceptions.IllegalConstructionException.Reason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayName("ConstructionGuard")
class ConstructionGuardTest {

    static final class Service {
        private Service(ConstructionGuard guard) {
            guard.checkConstruction();
        }
    }

    private static void assertRejected(Throwable thrown, Reason reason) {
        assertThat(thrown)
                .isInstanceOfSatisfying(IllegalConstructionException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(reason);
                    assertThat(e.getType()).isEqualTo(Service.class);
                });
    }

    @Nested
    @DisplayName("checkConstruction")
    class CheckConstruction {

        @Test
        @DisplayName("should reject construction without a permit")
        void shouldRejectConstructionWithoutPermit() {
            ConstructionGuard guard = ConstructionGuard.forType(Service.class);

            Throwable thrown = catchThrowable(() -> new Service(guard));

            assertRejected(thrown, Reason.OUTSIDE_ACCESSOR);
            assertThat(thrown).hasMessageContaining("use getInstance()");
            assertThat(guard.isConstructed()).isFalse();
        }

        @Test
        @DisplayName("should not leak the permit after construction")
        void shouldNotLeakPermitAfterConstruction() {
            ConstructionGuard guard = ConstructionGuard.forType(Service.class);
            guard.construct(() -> new Service(guard));

            assertRejected(catchThrowable(guard::checkConstruction),
                    Reason.OUTSIDE_ACCESSOR);
        }
    }

    @Nested
    @DisplayName("construct")
    class Construct {

        @Test
        @DisplayName("should construct once")
        void shouldConstructOnce() {
            ConstructionGuard guard = ConstructionGuard.forType(Service.class);

            Service service = guard.construct(() -> new Service(guard));

            assertThat(service).isNotNull();
            assertThat(guard.isConstructed()).isTrue();
            assertThat(guard.type()).isEqualTo(Service.class);
        }

        @Test
        @DisplayName("should reject a second construction")
        void shouldRejectSecondConstruction() {
            ConstructionGuard guard = ConstructionGuard.forType(Service.class);
            guard.construct(() -> new Service(guard));

            Throwable thrown = catchThrowable(
                    () -> guard.construct(() -> new Service(guard)));

            assertRejected(thrown, Reason.ALREADY_CONSTRUCTED);
            assertThat(thrown).hasMessageContaining("already been constructed");
        }

        @Test
        @DisplayName("should reject two constructor calls under one permit")
        void shouldRejectTwoConstructorCallsUnderOnePermit() {
            ConstructionGuard guard = ConstructionGuard.forType(Service.class);

            Throwable thrown = catchThrowable(() -> guard.construct(() -> {
                new Service(guard);
                return new Service(guard);
            }));

            assertRejected(thrown, Reason.ALREADY_CONSTRUCTED);
        }

        @Test
        @DisplayName("should reject recursive construction")
        void shouldRejectRecursiveConstruction() {
            ConstructionGuard guard = ConstructionGuard.forType(Service.class);

            Throwable thrown = catchThrowable(
                    () -> guard.construct(() -> guard.construct(() -> new Service(guard))));

            assertRejected(thrown, Reason.RECURSIVE);
            assertThat(guard.isConstructed()).isFalse();
        }

        @Test
        @DisplayName("should release the claim when the constructor fails")
        void shouldReleaseClaimWhenConstructorFails() {
            ConstructionGuard guard = ConstructionGuard.forType(Service.class);

            assertThatThrownBy(() -> guard.construct(() -> {
                guard.checkConstruction();
                throw new IllegalStateException("half built");
            })).isInstanceOf(IllegalStateException.class).hasMessage("half built");
            assertThat(guard.isConstructed()).isFalse();

            assertThat(guard.construct(() -> new Service(guard))).isNotNull();
            assertThat(guard.isConstructed()).isTrue();
        }

        @Test
        @DisplayName("should count a construction whose constructor skips the check")
        void shouldCountConstructionWithoutCheck() {
            ConstructionGuard guard = ConstructionGuard.forType(Service.class);

            guard.construct(Object::new);

            assertThat(guard.isConstructed()).isTrue();
        }
    }

    @Test
    @DisplayName("constructChecked should pass checked exceptions through")
    void constructCheckedShouldPassCheckedExceptionsThrough() {
        ConstructionGuard guard = ConstructionGuard.forType(Service.class);

        assertThatThrownBy(() -> guard.constructChecked(() -> {
            throw new IOException("no config");
        })).isInstanceOf(IOException.class).hasMessage("no config");
        assertThat(guard.isConstructed()).isFalse();
    }
}
