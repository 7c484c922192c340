package com.forex.optimizer.configuration;

import com.forex.config.AppConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ConfigurationOptionsReader单元测试")
class ConfigurationOptionsReaderTest {

    private final ConfigurationOptionsReader reader = new ConfigurationOptionsReader(new AppConfig().objectMapper());

    @Test
    @DisplayName("字符串解析为特征引用，数字解析为常量，保持维度顺序")
    void testReadOptions() throws IOException {
        String json = """
                {
                  "rsi": [
                    { "rsi": "rsi5", "rsiOverbought": 80, "rsiOversold": 20.5 },
                    {}
                  ],
                  "prChannel": [
                    { "prChannelUpper": "prChannelUpper100_2_195" }
                  ]
                }
                """;

        Map<String, ConfigurationOption> options = reader.read(stream(json));

        assertThat(options.keySet()).containsExactly("rsi", "prChannel");
        ConfigurationOption rsi = options.get("rsi");
        assertThat(rsi.size()).isEqualTo(2);
        assertThat(rsi.getAssignments().get(0))
                .containsEntry("rsi", OptionValue.reference("rsi5"))
                .containsEntry("rsiOverbought", OptionValue.literal(80))
                .containsEntry("rsiOversold", OptionValue.literal(20.5));
        assertThat(rsi.getAssignments().get(1)).isEmpty();
    }

    @Test
    @DisplayName("内置的参数文件可以被读取")
    void testReadBundledOptions() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/options/reversals.json")) {
            assertThat(in).isNotNull();
            Map<String, ConfigurationOption> options = reader.read(in);

            assertThat(options).containsKeys("longTrend", "rsi", "prChannel");
        }
    }

    @Test
    @DisplayName("取值既不是字符串也不是数字时报错")
    void testInvalidValue() {
        String json = "{ \"rsi\": [ { \"rsi\": true } ] }";

        assertThatThrownBy(() -> reader.read(stream(json)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("rsi.rsi");
    }

    @Test
    @DisplayName("参数维度不是数组时报错")
    void testOptionMustBeArray() {
        assertThatThrownBy(() -> reader.read(stream("{ \"rsi\": { \"rsi\": \"rsi5\" } }")))
                .isInstanceOf(IOException.class);
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
