package com.roomchat.auth.web;

/**
 * 请求级别的当前用户。
 *
 * <p>由 AccessTokenInterceptor 写入，afterCompletion 清理，避免线程复用串号。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<Long> USER_ID = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void setUserId(Long userId) {
        USER_ID.set(userId);
    }

    public static Long getUserId() {
        return USER_ID.get();
    }

    public static void clear() {
        USER_ID.remove();
    }
}
