package com.wangbin.otconnector.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.otconnector.common.domain.entity.ConnectionRecord;
import com.wangbin.otconnector.common.domain.enums.ConnectionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON 连接记录加载工具类
 * <p>
 * config 字段既可以是JSON对象，也可以是已经序列化好的JSON字符串。
 */
@Slf4j
public class JsonConnectionRecordLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonConnectionRecordLoader() {
    }

    /**
     * 从类路径或文件路径加载连接记录
     */
    public static List<ConnectionRecord> loadFromJson(String filePath) {
        log.info("开始从文件加载连接记录: {}", filePath);
        try (InputStream inputStream = open(filePath)) {
            List<Map<String, Object>> maps = objectMapper.readValue(
                    inputStream,
                    new TypeReference<List<Map<String, Object>>>() {}
            );
            List<ConnectionRecord> records = convertMapsToRecords(maps);
            log.info("成功加载 {} 条连接记录", records.size());
            return records;
        } catch (IOException e) {
            log.error("加载连接记录文件失败: {}", filePath, e);
            throw new IllegalStateException("加载连接记录文件失败: " + filePath, e);
        }
    }

    /**
     * 从 JSON 字符串加载连接记录
     */
    public static List<ConnectionRecord> loadFromJsonString(String json) {
        try {
            List<Map<String, Object>> maps = objectMapper.readValue(
                    json,
                    new TypeReference<List<Map<String, Object>>>() {}
            );
            return convertMapsToRecords(maps);
        } catch (IOException e) {
            log.error("解析连接记录 JSON 失败", e);
            throw new IllegalStateException("解析连接记录 JSON 失败", e);
        }
    }

    private static InputStream open(String filePath) throws IOException {
        Resource resource = new ClassPathResource(filePath);
        if (resource.exists()) {
            log.debug("从类路径加载文件: {}", filePath);
            return resource.getInputStream();
        }
        Path path = Paths.get(filePath);
        if (Files.exists(path)) {
            log.debug("从文件路径加载文件: {}", path);
            return Files.newInputStream(path);
        }
        throw new IOException("文件不存在: " + filePath);
    }

    private static List<ConnectionRecord> convertMapsToRecords(List<Map<String, Object>> maps) throws IOException {
        List<ConnectionRecord> records = new ArrayList<>(maps.size());
        for (Map<String, Object> map : maps) {
            ConnectionRecord record = new ConnectionRecord();
            record.setId(toText(map.get("id")));
            record.setOrgId(toText(map.get("orgId")));
            record.setName(toText(map.get("name")));
            record.setProtocol(toText(map.get("protocol")));
            record.setStatus(ConnectionStatus.fromCode(toText(map.get("status"))));

            Object config = map.get("config");
            if (config instanceof String text) {
                record.setConfig(text);
            } else if (config != null) {
                record.setConfig(objectMapper.writeValueAsString(config));
            }
            records.add(record);
        }
        return records;
    }

    private static String toText(Object value) {
        return value != null ? value.toString() : null;
    }
}
