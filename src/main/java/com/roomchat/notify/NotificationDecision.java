package com.roomchat.notify;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum NotificationDecision {

    /** 接收方在线且正在看这个会话 */
    SUPPRESS_VIEWING(false, false),

    /** 接收方对该会话静音且未到期 */
    SUPPRESS_MUTED(false, false),

    PUSH(true, false),

    /** 离线超过阈值：push 之外再发一封邮件 */
    PUSH_AND_EMAIL(true, true);

    private final boolean push;
    private final boolean email;

    public boolean isDispatch() {
        return push || email;
    }
}
