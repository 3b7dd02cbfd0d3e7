package com.roomchat.common.api;

/**
 * 统一错误码定义。
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** 非会话成员 / 会话不可用 / 超出可编辑删除窗口 */
    public static final int FORBIDDEN = 40300;

    /** 资源不存在或已删除 */
    public static final int NOT_FOUND = 40400;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;

    /** 存储暂不可用，可重试 */
    public static final int SERVICE_UNAVAILABLE = 50300;
}
