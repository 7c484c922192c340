package com.forex.optimizer.configuration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 参数空间配置文件读取器
 * <p>
 * 文件格式: { "维度名": [ { "子键": "特征名" 或 数值, ... }, ... ], ... }。
 * 字符串解析为特征引用，数值解析为常量，维度顺序与文件中一致。
 * </p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationOptionsReader {

    private final ObjectMapper objectMapper;

    public Map<String, ConfigurationOption> read(Path file) throws IOException {
        log.info("读取参数空间配置: {}", file.toAbsolutePath());
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public Map<String, ConfigurationOption> read(InputStream in) throws IOException {
        JsonNode root = objectMapper.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IOException("参数空间配置必须是JSON对象");
        }

        Map<String, ConfigurationOption> options = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            options.put(field.getKey(), parseOption(field.getKey(), field.getValue()));
        }
        log.debug("已读取 {} 个参数维度", options.size());
        return options;
    }

    private ConfigurationOption parseOption(String name, JsonNode node) throws IOException {
        if (!node.isArray()) {
            throw new IOException("参数维度 " + name + " 必须是数组");
        }

        List<Map<String, OptionValue>> assignments = new ArrayList<>();
        for (JsonNode assignmentNode : node) {
            if (!assignmentNode.isObject()) {
                throw new IOException("参数维度 " + name + " 的取值组必须是对象");
            }
            Map<String, OptionValue> assignment = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> values = assignmentNode.fields();
            while (values.hasNext()) {
                Map.Entry<String, JsonNode> value = values.next();
                assignment.put(value.getKey(), parseValue(name, value.getKey(), value.getValue()));
            }
            assignments.add(assignment);
        }
        return ConfigurationOption.of(assignments);
    }

    private OptionValue parseValue(String option, String key, JsonNode node) throws IOException {
        if (node.isTextual()) {
            return OptionValue.reference(node.asText());
        }
        if (node.isNumber()) {
            return OptionValue.literal(node.asDouble());
        }
        throw new IOException(String.format("参数 %s.%s 只能是特征名或数值: %s", option, key, node));
    }
}
