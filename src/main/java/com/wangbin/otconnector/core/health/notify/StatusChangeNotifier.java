package com.wangbin.otconnector.core.health.notify;

import com.wangbin.otconnector.core.health.StatusTransitionEvent;

/**
 * 连接状态变化通知，调用方不等待处理结果
 */
public interface StatusChangeNotifier {

    void onStatusChange(StatusTransitionEvent event);
}
