package com.roomchat.common.error;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class ChatErrorsTest {

    @Test
    void chatExceptionPassesThroughWrappers() {
        ChatException original = ChatException.notFound("message_not_found");

        assertSame(original, ChatErrors.translate(new CompletionException(original)));
    }

    @Test
    void infrastructureFailuresBecomeTransient() {
        ChatException db = ChatErrors.translate(new CompletionException(new DataAccessResourceFailureException("down")));
        assertEquals(ChatErrorCode.TRANSIENT, db.getCode());
        assertEquals("store_unavailable", db.getReason());

        assertEquals("store_unavailable", ChatErrors.translate(new TimeoutException()).getReason());
        assertEquals("server_busy", ChatErrors.translate(new RejectedExecutionException()).getReason());
        assertEquals("internal_error", ChatErrors.translate(new NullPointerException()).getReason());
    }
}
