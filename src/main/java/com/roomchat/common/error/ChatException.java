package com.roomchat.common.error;

import lombok.Getter;

@Getter
public class ChatException extends RuntimeException {

    private final ChatErrorCode code;
    private final String reason;

    public ChatException(ChatErrorCode code, String reason) {
        super(reason);
        this.code = code;
        this.reason = reason;
    }

    public ChatException(ChatErrorCode code, String reason, Throwable cause) {
        super(reason, cause);
        this.code = code;
        this.reason = reason;
    }

    public static ChatException permissionDenied(String reason) {
        return new ChatException(ChatErrorCode.PERMISSION_DENIED, reason);
    }

    public static ChatException notFound(String reason) {
        return new ChatException(ChatErrorCode.NOT_FOUND, reason);
    }

    public static ChatException validation(String reason) {
        return new ChatException(ChatErrorCode.VALIDATION_FAILED, reason);
    }

    public static ChatException transientFailure(String reason, Throwable cause) {
        return new ChatException(ChatErrorCode.TRANSIENT, reason, cause);
    }
}
