package com.roomchat.gateway.ws;

import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 按 conversationId 串行的 Future 链：同一会话的任务按入队顺序一个接一个执行，不同会话互不影响。
 *
 * <p>发送链路里“落库 → 投影 → 广播 → delivered”整体作为一个任务入队，因此同一会话的广播顺序等于落库顺序。</p>
 * <p>上一个任务失败不影响后续任务；返回给调用方的 future 保留该任务自己的结果/异常。</p>
 */
@Component
public class ConversationSerialQueue {

    private final ConcurrentHashMap<Long, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public <T> CompletableFuture<T> enqueue(long conversationId, Supplier<? extends CompletionStage<T>> task) {
        Objects.requireNonNull(task, "task");
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<Void> gate = new CompletableFuture<>();

        // put 的原子性决定了入队顺序
        CompletableFuture<Void> prev = tails.put(conversationId, gate);
        gate.whenComplete((v, e) -> tails.remove(conversationId, gate));

        if (prev == null) {
            run(task, result, gate);
        } else {
            prev.whenComplete((v, e) -> run(task, result, gate));
        }
        return result;
    }

    /**
     * 当前有排队/执行中任务的会话数。
     */
    public int activeKeys() {
        return tails.size();
    }

    private static <T> void run(Supplier<? extends CompletionStage<T>> task, CompletableFuture<T> result, CompletableFuture<Void> gate) {
        CompletionStage<T> stage;
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
                result.complete(v);
            }
            gate.complete(null);
        });
    }
}
