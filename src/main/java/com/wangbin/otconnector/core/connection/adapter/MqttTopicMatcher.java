package com.wangbin.otconnector.core.connection.adapter;

/**
 * MQTT 主题过滤器匹配，支持 + 与 # 通配符
 */
public final class MqttTopicMatcher {

    private MqttTopicMatcher() {
    }

    public static boolean matches(String filter, String topic) {
        if (filter == null || topic == null) {
            return false;
        }
        if (filter.equals(topic)) {
            return true;
        }
        String[] filterLevels = filter.split("/", -1);
        String[] topicLevels = topic.split("/", -1);
        for (int i = 0; i < filterLevels.length; i++) {
            String level = filterLevels[i];
            if ("#".equals(level)) {
                // # 只能是最后一级，且匹配父级本身
                return i == filterLevels.length - 1;
            }
            if (i >= topicLevels.length) {
                return false;
            }
            if (!"+".equals(level) && !level.equals(topicLevels[i])) {
                return false;
            }
        }
        return filterLevels.length == topicLevels.length;
    }

    public static boolean matchesAny(Iterable<String> filters, String topic) {
        for (String filter : filters) {
            if (matches(filter, topic)) {
                return true;
            }
        }
        return false;
    }
}
