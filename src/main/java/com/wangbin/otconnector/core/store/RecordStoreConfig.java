package com.wangbin.otconnector.core.store;

import com.wangbin.otconnector.common.domain.entity.ConnectionRecord;
import com.wangbin.otconnector.core.config.OtConnectorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 连接记录存储装配，配置了 ot-connector.store.seed-file 时启动即导入
 */
@Slf4j
@Configuration
public class RecordStoreConfig {

    @Bean
    @ConditionalOnMissingBean(ConnectionRecordRepository.class)
    public ConnectionRecordRepository connectionRecordRepository(OtConnectorProperties properties) {
        InMemoryConnectionRecordRepository repository = new InMemoryConnectionRecordRepository();
        String seedFile = properties.getStore().getSeedFile();
        if (seedFile != null && !seedFile.isBlank()) {
            for (ConnectionRecord record : JsonConnectionRecordLoader.loadFromJson(seedFile)) {
                repository.save(record);
            }
            log.info("连接记录已导入: file={}, count={}", seedFile, repository.size());
        }
        return repository;
    }
}
