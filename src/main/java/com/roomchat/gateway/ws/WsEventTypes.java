package com.roomchat.gateway.ws;

/**
 * WS 事件类型常量。
 */
public final class WsEventTypes {

    private WsEventTypes() {
    }

    // 入站
    public static final String AUTH = "auth";
    public static final String PING = "ping";
    public static final String SEND_MESSAGE = "send_message";
    public static final String EDIT_MESSAGE = "edit_message";
    public static final String DELETE_MESSAGE = "delete_message";
    public static final String REACT_TO_MESSAGE = "react_to_message";
    public static final String REMOVE_REACTION = "remove_reaction";
    public static final String JOIN_CONVERSATION = "join_conversation";
    public static final String LEAVE_CONVERSATION = "leave_conversation";
    public static final String CREATE_CONVERSATION = "create_conversation";
    public static final String TYPING_START = "typing_start";
    public static final String TYPING_STOP = "typing_stop";
    public static final String STATUS_CHANGE = "status_change";
    public static final String SET_ACTIVITY = "set_activity";
    public static final String CLEAR_ACTIVITY = "clear_activity";

    // 双向
    public static final String MESSAGE_DELIVERED = "message_delivered";
    public static final String MESSAGE_READ = "message_read";

    // 出站
    public static final String CONNECTED = "connected";
    public static final String PONG = "pong";
    public static final String NEW_MESSAGE = "new_message";
    public static final String MESSAGE_SENT = "message_sent";
    public static final String MESSAGE_FAILED = "message_failed";
    public static final String MESSAGE_EDITED = "message_edited";
    public static final String MESSAGE_DELETED = "message_deleted";
    public static final String MESSAGE_REACTION = "message_reaction";
    public static final String USER_TYPING = "user_typing";
    public static final String USER_STATUS_CHANGE = "user_status_change";
    public static final String CONVERSATION_JOINED = "conversation_joined";
    public static final String CONVERSATION_LEFT = "conversation_left";
    public static final String CONVERSATION_CREATED = "conversation_created";
    public static final String ERROR = "error";
}
