package com.roomchat.gateway.ws;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationSerialQueueTest {

    private final ConversationSerialQueue queue = new ConversationSerialQueue();

    @Test
    void sameConversationRunsInEnqueueOrder() throws Exception {
        List<Integer> order = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> firstGate = new CompletableFuture<>();

        CompletableFuture<Integer> f1 = queue.enqueue(10L, () -> firstGate.thenApply(v -> {
            order.add(1);
            return 1;
        }));
        CompletableFuture<Integer> f2 = queue.enqueue(10L, () -> {
            order.add(2);
            return CompletableFuture.completedFuture(2);
        });

        assertThat(f2).isNotDone();
        assertThat(order).isEmpty();

        firstGate.complete(null);

        assertThat(f2.get(1, TimeUnit.SECONDS)).isEqualTo(2);
        assertThat(f1.get(1, TimeUnit.SECONDS)).isEqualTo(1);
        assertThat(order).containsExactly(1, 2);
    }

    @Test
    void otherConversationsAreNotBlocked() throws Exception {
        CompletableFuture<Void> blocker = new CompletableFuture<>();
        queue.enqueue(10L, () -> blocker);

        CompletableFuture<String> other = queue.enqueue(11L, () -> CompletableFuture.completedFuture("ok"));

        assertThat(other.get(1, TimeUnit.SECONDS)).isEqualTo("ok");
        assertThat(queue.activeKeys()).isEqualTo(1);

        blocker.complete(null);
        assertThat(queue.activeKeys()).isZero();
    }

    @Test
    void failureIsReportedButQueueContinues() throws Exception {
        CompletableFuture<Object> failed = queue.enqueue(10L, () -> {
            throw new IllegalStateException("boom");
        });
        CompletableFuture<String> next = queue.enqueue(10L, () -> CompletableFuture.completedFuture("next"));

        assertThatThrownBy(() -> failed.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(next.get(1, TimeUnit.SECONDS)).isEqualTo("next");
    }
}
