package com.roomchat.common.error;

import org.springframework.dao.DataAccessException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 把异步链路上拿到的异常统一翻译为 {@link ChatException}。
 */
public final class ChatErrors {

    private ChatErrors() {
    }

    public static ChatException translate(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof ChatException ce) {
            return ce;
        }
        if (t instanceof DataAccessException || t instanceof TimeoutException) {
            return ChatException.transientFailure("store_unavailable", t);
        }
        if (t instanceof RejectedExecutionException) {
            return ChatException.transientFailure("server_busy", t);
        }
        return ChatException.transientFailure("internal_error", t);
    }

    public static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
