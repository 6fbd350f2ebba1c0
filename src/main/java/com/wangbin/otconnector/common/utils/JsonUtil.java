package com.wangbin.otconnector.common.utils;

import com.alibaba.fastjson2.JSON;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON工具类
 */
@Slf4j
public class JsonUtil {

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * 对象转JSON字符串
     */
    public static String toJsonString(Object object) {
        try {
            return JSON.toJSONString(object);
        } catch (Exception e) {
            log.error("对象转JSON字符串失败", e);
            return null;
        }
    }

    /**
     * JSON字符串转对象，失败返回null
     */
    public static <T> T parseObject(String json, Class<T> clazz) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return JSON.parseObject(json, clazz);
        } catch (Exception e) {
            log.warn("JSON字符串转对象失败: {}", e.getMessage());
            return null;
        }
    }

    /**
     * 解析消息负载：合法JSON返回解析结果，否则原样返回字符串
     */
    public static Object parsePayload(String payload) {
        if (payload == null || payload.isEmpty()) {
            return payload;
        }
        try {
            if (JSON.isValid(payload)) {
                return JSON.parse(payload);
            }
        } catch (Exception e) {
            log.debug("负载不是合法JSON，按原始字符串处理: {}", e.getMessage());
        }
        return payload;
    }
}
