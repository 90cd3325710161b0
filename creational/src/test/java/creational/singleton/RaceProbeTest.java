package creational.singleton;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RaceProbe")
class RaceProbeTest {

    @Test
    @DisplayName("should report one instance for a shared accessor")
    void shouldReportOneInstanceForSharedAccessor() throws InterruptedException {
        Object shared = new Object();

        RaceReport report = RaceProbe.race(20, () -> shared);

        assertThat(report.callers()).isEqualTo(20);
        assertThat(report.distinctInstances()).isEqualTo(1);
        assertThat(report.failures()).isEmpty();
        assertThat(report.allSame()).isTrue();
    }

    @Test
    @DisplayName("should count distinct instances by identity")
    void shouldCountDistinctInstancesByIdentity() throws InterruptedException {
        RaceReport report = RaceProbe.race(10, () -> new String("same text"));

        assertThat(report.distinctInstances()).isEqualTo(10);
        assertThat(report.allSame()).isFalse();
    }

    @Test
    @DisplayName("should collect failures from callers")
    void shouldCollectFailuresFromCallers() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();

        RaceReport report = RaceProbe.race(8, () -> {
            if (calls.incrementAndGet() % 2 == 0) {
                throw new IllegalStateException("even caller");
            }
            return "ok";
        });

        assertThat(report.failures()).hasSize(4)
                .allMatch(e -> e instanceof IllegalStateException);
        assertThat(report.allSame()).isFalse();
    }

    @Test
    @DisplayName("should call the accessor once per caller through a holder")
    void shouldCallAccessorOncePerCallerThroughHolder() throws InterruptedException {
        AtomicInteger built = new AtomicInteger();
        SingletonHolder<Object> holder = SingletonHolder.of("shared", () -> {
            built.incrementAndGet();
            return new Object();
        });

        RaceReport report = RaceProbe.race(100, holder::get);

        assertThat(report.allSame()).isTrue();
        assertThat(built).hasValue(1);
    }

    @Test
    @DisplayName("should release started callers when a caller thread cannot be created")
    void shouldReleaseStartedCallersWhenThreadCreationFails() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        List<Thread> created = new ArrayList<>();
        ThreadFactory failsOnFourth = r -> {
            if (created.size() == 3) {
                throw new IllegalStateException("unable to create native thread");
            }
            Thread t = new Thread(r, "limited-caller-" + created.size());
            t.setDaemon(true);
            created.add(t);
            return t;
        };

        assertThatThrownBy(() -> RaceProbe.race(10, () -> calls.incrementAndGet(), failsOnFourth))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("unable to create native thread");

        for (Thread t : created) {
            t.join(5_000);
        }
        assertThat(created).hasSize(3).noneMatch(Thread::isAlive);
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("should release started callers when the calling thread is interrupted")
    void shouldReleaseStartedCallersWhenInterrupted() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        List<Thread> created = new ArrayList<>();
        ThreadFactory recording = r -> {
            Thread t = new Thread(r, "interrupted-caller-" + created.size());
            t.setDaemon(true);
            created.add(t);
            return t;
        };

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> RaceProbe.race(5, () -> calls.incrementAndGet(), recording))
                    .isInstanceOf(InterruptedException.class);
        } finally {
            Thread.interrupted();
        }

        for (Thread t : created) {
            t.join(5_000);
        }
        assertThat(created).hasSize(5).noneMatch(Thread::isAlive);
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("should reject a non-positive caller count")
    void shouldRejectNonPositiveCallerCount() {
        assertThatThrownBy(() -> RaceProbe.race(0, Object::new))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("callers must be positive");
    }

    @Test
    @DisplayName("report should copy its failures")
    void reportShouldCopyItsFailures() {
        List<Throwable> failures = new ArrayList<>();
        RaceReport report = new RaceReport(1, 1, failures, 0);
        failures.add(new RuntimeException());

        assertThat(report.failures()).isEmpty();
        assertThat(report.allSame()).isTrue();
    }
}
