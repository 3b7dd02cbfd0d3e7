package com.roomchat.gateway.ws;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WsChannelSerialQueueTest {

    @Test
    void shouldRunFramesInArrivalOrder() throws Exception {
        EmbeddedChannel ch = new EmbeddedChannel();

        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch allowFirstFinish = new CountDownLatch(1);
        AtomicBoolean secondStarted = new AtomicBoolean(false);

        CompletableFuture<Void> f1 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.runAsync(() -> {
            firstStarted.countDown();
            try {
                assertTrue(allowFirstFinish.await(2, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException(e);
            }
        }));

        CompletableFuture<Void> f2 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.runAsync(() -> secondStarted.set(true)));

        pumpUntil(ch, firstStarted, 1000);
        TimeUnit.MILLISECONDS.sleep(80);
        assertFalse(secondStarted.get());
        assertEquals(2, WsChannelSerialQueue.pending(ch));

        allowFirstFinish.countDown();
        pumpUntilDone(ch, CompletableFuture.allOf(f1, f2), 2000);
        assertTrue(secondStarted.get());
    }

    @Test
    void failedFrameDoesNotBlockTheNextOne() throws Exception {
        EmbeddedChannel ch = new EmbeddedChannel();
        List<String> order = Collections.synchronizedList(new ArrayList<>());

        CompletableFuture<Void> f1 = WsChannelSerialQueue.enqueue(ch, () -> {
            order.add("send");
            return CompletableFuture.failedFuture(new RuntimeException("store down"));
        });
        CompletableFuture<Void> f2 = WsChannelSerialQueue.enqueue(ch, () -> {
            order.add("read");
            return CompletableFuture.completedFuture(null);
        });

        pumpUntilDone(ch, f2, 2000);
        ExecutionException e = assertThrows(ExecutionException.class, () -> f1.get(100, TimeUnit.MILLISECONDS));
        assertEquals("store down", e.getCause().getMessage());
        assertEquals(List.of("send", "read"), order);
    }

    @Test
    void tryEnqueueRejectsWhenBacklogIsFull() throws Exception {
        EmbeddedChannel ch = new EmbeddedChannel();
        CompletableFuture<Void> blocker = new CompletableFuture<>();

        WsChannelSerialQueue.enqueue(ch, () -> blocker);
        CompletableFuture<Void> rejected = WsChannelSerialQueue.tryEnqueue(ch, () -> CompletableFuture.completedFuture(null), 1);

        ExecutionException e = assertThrows(ExecutionException.class, () -> rejected.get(100, TimeUnit.MILLISECONDS));
        assertInstanceOf(RejectedExecutionException.class, e.getCause());

        blocker.complete(null);
        ch.runPendingTasks();
        assertEquals(0, WsChannelSerialQueue.pending(ch));
    }

    private static void pumpUntil(EmbeddedChannel ch, CountDownLatch latch, long timeoutMs) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (latch.getCount() > 0 && System.currentTimeMillis() < deadline) {
            ch.runPendingTasks();
            TimeUnit.MILLISECONDS.sleep(5);
        }
        assertTrue(latch.getCount() == 0);
    }

    private static void pumpUntilDone(EmbeddedChannel ch, CompletableFuture<?> f, long timeoutMs) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!f.isDone() && System.currentTimeMillis() < deadline) {
            ch.runPendingTasks();
            TimeUnit.MILLISECONDS.sleep(5);
        }
        f.get(100, TimeUnit.MILLISECONDS);
    }
}
