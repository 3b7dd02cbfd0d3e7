package com.roomchat.gateway.ws;

import io.netty.channel.Channel;
import io.netty.util.Attribute;
import io.netty.util.AttributeKey;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 每个 Channel 一条 Future 链，保证同一连接的入站帧按到达顺序处理；任务总是在该 channel 的 eventLoop 上启动。
 *
 * <p>上一个任务的异常不会阻断队列，但返回给调用方的 future 保留异常。</p>
 */
public final class WsChannelSerialQueue {

    private static final AttributeKey<AtomicReference<CompletableFuture<Void>>> ATTR_TAIL =
            AttributeKey.valueOf("chat:ws:inbound:tail");

    private static final AttributeKey<AtomicInteger> ATTR_PENDING =
            AttributeKey.valueOf("chat:ws:inbound:pending");

    private WsChannelSerialQueue() {
    }

    public static CompletableFuture<Void> enqueue(Channel channel, Supplier<? extends CompletionStage<?>> task) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(task, "task");

        CompletableFuture<Void> result = new CompletableFuture<>();
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<Void> prev = attr(channel, ATTR_TAIL, () -> new AtomicReference<>(CompletableFuture.completedFuture(null)))
                .getAndSet(gate);
        AtomicInteger pending = attr(channel, ATTR_PENDING, AtomicInteger::new);
        pending.incrementAndGet();

        prev.whenComplete((v, e) -> runOnEventLoop(channel, task, result, gate));
        gate.whenComplete((v, e) -> pending.decrementAndGet());
        return result;
    }

    /**
     * 排队数达到 maxPending 时直接拒绝（RejectedExecutionException）。
     */
    public static CompletableFuture<Void> tryEnqueue(Channel channel, Supplier<? extends CompletionStage<?>> task, int maxPending) {
        Objects.requireNonNull(channel, "channel");
        if (pending(channel) >= Math.max(1, maxPending)) {
            return CompletableFuture.failedFuture(new RejectedExecutionException("ws_inbound_queue_full"));
        }
        return enqueue(channel, task);
    }

    public static int pending(Channel channel) {
        return attr(channel, ATTR_PENDING, AtomicInteger::new).get();
    }

    private static void runOnEventLoop(Channel channel, Supplier<? extends CompletionStage<?>> task,
                                       CompletableFuture<Void> result, CompletableFuture<Void> gate) {
        Runnable r = () -> {
            CompletionStage<?> stage;
            try {
                stage = task.get();
            } catch (Throwable t) {
                result.completeExceptionally(t);
                gate.complete(null);
                return;
            }
            if (stage == null) {
                result.complete(null);
                gate.complete(null);
                return;
            }
            stage.whenComplete((v, e) -> {
                if (e != null) {
                    result.completeExceptionally(e);
                } else {
                    result.complete(null);
                }
                gate.complete(null);
            });
        };
        if (channel.eventLoop().inEventLoop()) {
            r.run();
            return;
        }
        try {
            channel.eventLoop().execute(r);
        } catch (RejectedExecutionException e) {
            // eventLoop 已关闭
            result.completeExceptionally(e);
            gate.complete(null);
        }
    }

    private static <T> T attr(Channel channel, AttributeKey<T> key, Supplier<T> factory) {
        Attribute<T> attr = channel.attr(key);
        T existing = attr.get();
        if (existing != null) {
            return existing;
        }
        T created = factory.get();
        T raced = attr.setIfAbsent(created);
        return raced == null ? created : raced;
    }
}
