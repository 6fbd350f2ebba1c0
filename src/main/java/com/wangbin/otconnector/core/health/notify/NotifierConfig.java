package com.wangbin.otconnector.core.health.notify;

import com.wangbin.otconnector.core.config.OtConnectorProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class NotifierConfig {

    @Bean
    @ConditionalOnMissingBean(StatusChangeNotifier.class)
    public StatusChangeNotifier statusChangeNotifier(ApplicationEventPublisher publisher,
                                                     OtConnectorProperties properties) {
        StatusChangeNotifier local = new LoggingStatusChangeNotifier();
        OtConnectorProperties.NotifierConfig config = properties.getNotifier();
        if (config.getThrottleMs() > 0) {
            local = new ThrottlingStatusChangeNotifier(local, config.getThrottleMs(), config.getMaxEntries());
        }
        return new PublishingStatusChangeNotifier(publisher, local);
    }
}
