package com.roomchat.common.error;

import com.roomchat.common.api.ApiCodes;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 错误分类。WS 的 error 事件里 code 字段取 {@link #getCondition()}。
 */
@Getter
@RequiredArgsConstructor
public enum ChatErrorCode {

    /** token 缺失/无效，连接在注册前被拒绝 */
    AUTHENTICATION_FAILED("authentication_failed", ApiCodes.UNAUTHORIZED, HttpStatus.UNAUTHORIZED),

    /** 非成员、会话不可用、非本人操作、超出时间窗口 */
    PERMISSION_DENIED("permission_denied", ApiCodes.FORBIDDEN, HttpStatus.FORBIDDEN),

    /** 消息/会话/回复目标不存在或已删除 */
    NOT_FOUND("not_found", ApiCodes.NOT_FOUND, HttpStatus.NOT_FOUND),

    /** 空内容、非法 reaction、metadata 格式不对 */
    VALIDATION_FAILED("validation_failed", ApiCodes.BAD_REQUEST, HttpStatus.BAD_REQUEST),

    /** 存储不可用 / 超时 */
    TRANSIENT("transient", ApiCodes.SERVICE_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE);

    private final String condition;
    private final int apiCode;
    private final HttpStatus httpStatus;
}
