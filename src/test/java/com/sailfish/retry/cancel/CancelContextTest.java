package com.sailfish.retry.cancel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class CancelContextTest {

    @Test
    @DisplayName("Should report cancellation and release waiters")
    void shouldCancel() throws InterruptedException {
        // Given
        CancelContext context = CancelContext.create(null);
        assertThat(context.isCancelled()).isFalse();
        assertThat(context.awaitCancellation(Duration.ofMillis(10))).isFalse();

        // When
        context.cancel();

        // Then
        assertThat(context.isCancelled()).isTrue();
        assertThat(context.awaitCancellation(Duration.ofHours(1))).isTrue();
    }

    @Test
    @DisplayName("Should run listeners exactly once, and late listeners immediately")
    void shouldNotifyListenersOnce() {
        // Given
        CancelContext context = CancelContext.create(CancelContext.background());
        AtomicInteger notified = new AtomicInteger();
        context.addListener(notified::incrementAndGet);

        // When
        context.cancel();
        context.cancel();
        context.addListener(notified::incrementAndGet);

        // Then
        assertThat(notified).hasValue(2);
    }

    @Test
    @DisplayName("Should not run removed listeners")
    void shouldSkipRemovedListeners() {
        CancelContext context = CancelContext.create(null);
        AtomicInteger notified = new AtomicInteger();
        Runnable listener = notified::incrementAndGet;
        context.addListener(listener);

        context.removeListener(listener);
        context.cancel();

        assertThat(notified).hasValue(0);
    }

    @Test
    @DisplayName("Should keep notifying when a listener fails")
    void shouldSurviveFailingListener() {
        CancelContext context = CancelContext.create(null);
        AtomicInteger notified = new AtomicInteger();
        context.addListener(() -> {
            throw new IllegalStateException("listener failure");
        });
        context.addListener(notified::incrementAndGet);

        context.cancel();

        assertThat(notified).hasValue(1);
        assertThat(context.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("Should cancel children with their parent but not the other way round")
    void shouldPropagateFromParentOnly() {
        // Given
        CancelContext parent = CancelContext.create(null);
        CancelContext child = CancelContext.create(parent);
        CancelContext grandChild = CancelContext.create(child);
        CancelContext sibling = CancelContext.create(parent);

        // When
        child.cancel();

        // Then
        assertThat(grandChild.isCancelled()).isTrue();
        assertThat(parent.isCancelled()).isFalse();
        assertThat(sibling.isCancelled()).isFalse();

        // When
        parent.cancel();

        // Then
        assertThat(sibling.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("Should cancel a child created from an already cancelled parent")
    void shouldCancelChildOfCancelledParent() {
        CancelContext parent = CancelContext.create(null);
        parent.cancel();

        assertThat(CancelContext.create(parent).isCancelled()).isTrue();
    }

    @Test
    @DisplayName("Should cancel itself once the timeout elapses")
    void shouldCancelOnTimeout() throws InterruptedException {
        // Given
        CancelContext context = CancelContext.withTimeout(CancelContext.background(), Duration.ofMillis(50));

        // When / Then
        assertThat(context.deadline()).isPresent();
        assertThat(context.awaitCancellation(Duration.ofSeconds(5))).isTrue();
        assertThat(context.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("Should cancel immediately when the deadline already passed")
    void shouldCancelWhenDeadlinePassed() {
        CancelContext context = CancelContext.withDeadline(null, Instant.now().minusSeconds(1));

        assertThat(context.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("Should inherit the earlier deadline of its parent")
    void shouldInheritEarlierParentDeadline() {
        // Given
        CancelContext parent = CancelContext.withTimeout(null, Duration.ofMillis(50));

        // When
        CancelContext child = CancelContext.withTimeout(parent, Duration.ofHours(1));
        CancelContext plainChild = CancelContext.create(parent);

        // Then
        assertThat(child.deadline()).isEqualTo(parent.deadline());
        assertThat(plainChild.deadline()).isEqualTo(parent.deadline());
        await().atMost(Duration.ofSeconds(5)).until(child::isCancelled);
        assertThat(plainChild.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("Should never cancel the background context")
    void shouldNeverCancelBackground() throws InterruptedException {
        CancellationContext background = CancelContext.background();

        assertThat(background.isCancelled()).isFalse();
        assertThat(background.deadline()).isEmpty();
        assertThat(background.awaitCancellation(Duration.ofMillis(5))).isFalse();
    }
}
