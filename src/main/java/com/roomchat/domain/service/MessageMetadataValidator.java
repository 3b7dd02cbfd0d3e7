package com.roomchat.domain.service;

import cn.hutool.core.util.NumberUtil;
import cn.hutool.core.util.StrUtil;
import com.roomchat.common.error.ChatException;
import com.roomchat.domain.enums.MessageType;

import java.util.Map;

/**
 * 按消息类型校验 metadata。不通过统一抛 VALIDATION_FAILED(malformed_metadata)。
 */
public final class MessageMetadataValidator {

    private MessageMetadataValidator() {
    }

    public static void validate(MessageType type, Map<String, Object> metadata) {
        switch (type) {
            case IMAGE, FILE -> requireText(metadata, "fileUrl");
            case LOCATION -> {
                double lat = requireNumber(metadata, "latitude");
                double lng = requireNumber(metadata, "longitude");
                if (lat < -90 || lat > 90 || lng < -180 || lng > 180) {
                    throw ChatException.validation("malformed_metadata");
                }
            }
            case SHARED_LISTING -> requireText(metadata, "listingId");
            default -> {
            }
        }
    }

    private static void requireText(Map<String, Object> metadata, String key) {
        Object v = metadata == null ? null : metadata.get(key);
        if (v == null || StrUtil.isBlank(String.valueOf(v))) {
            throw ChatException.validation("malformed_metadata");
        }
    }

    private static double requireNumber(Map<String, Object> metadata, String key) {
        Object v = metadata == null ? null : metadata.get(key);
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof String s && NumberUtil.isNumber(s.trim())) {
            return Double.parseDouble(s.trim());
        }
        throw ChatException.validation("malformed_metadata");
    }
}
