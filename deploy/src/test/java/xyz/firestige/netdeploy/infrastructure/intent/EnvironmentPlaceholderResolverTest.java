package xyz.firestige.netdeploy.infrastructure.intent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import xyz.firestige.netdeploy.domain.shared.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("环境变量占位符解析 测试")
class EnvironmentPlaceholderResolverTest {

    private final Map<String, String> env = Map.of("SNMP_COMMUNITY", "secret-ro", "BLANK", "  ");

    @Test
    @DisplayName("场景 - 环境变量优先，其次默认值，空默认值得到空串")
    void resolvesFromEnvThenDefault() {
        // Given
        EnvironmentPlaceholderResolver resolver = new EnvironmentPlaceholderResolver(env::get, false);

        // Then
        assertThat(resolver.replacePlaceholders("{$SNMP_COMMUNITY:ro}", new LinkedHashSet<>())).isEqualTo("secret-ro");
        assertThat(resolver.replacePlaceholders("x-{$UNSET:fallback}-y", new LinkedHashSet<>())).isEqualTo("x-fallback-y");
        assertThat(resolver.replacePlaceholders("{$UNSET:}", new LinkedHashSet<>())).isEmpty();
        assertThat(resolver.replacePlaceholders("{$BLANK:dflt}", new LinkedHashSet<>())).isEqualTo("dflt");
        assertThat(resolver.replacePlaceholders("{$UNSET:{a}}", new LinkedHashSet<>())).isEqualTo("{a}");
        assertThat(resolver.replacePlaceholders("plain {$UNCLOSED", new LinkedHashSet<>())).isEqualTo("plain {$UNCLOSED");
    }

    @Test
    @DisplayName("场景 - 递归替换嵌套 Map 与 List 中的字符串")
    void resolvesNestedTree() {
        // Given
        Map<String, Object> root = new LinkedHashMap<>();
        Map<String, Object> enterprise = new LinkedHashMap<>();
        enterprise.put("snmp_community", "{$SNMP_COMMUNITY}");
        List<Object> servers = new ArrayList<>(List.of("{$NTP:10.0.0.1}", "10.0.0.2"));
        enterprise.put("ntp_servers", servers);
        root.put("enterprise", enterprise);

        // When
        new EnvironmentPlaceholderResolver(env::get, false).resolve(root);

        // Then
        assertThat(enterprise.get("snmp_community")).isEqualTo("secret-ro");
        assertThat(servers).containsExactly("10.0.0.1", "10.0.0.2");
    }

    @Test
    @DisplayName("场景 - 缺失变量：严格模式报错，宽松模式替换为空串")
    void missingVariables() {
        // Given
        Map<String, Object> strictTree = new LinkedHashMap<>(Map.of("password", "{$MISSING_PASSWORD}"));
        Map<String, Object> lenientTree = new LinkedHashMap<>(Map.of("password", "{$MISSING_PASSWORD}"));

        // Then
        assertThatThrownBy(() -> new EnvironmentPlaceholderResolver(env::get, false).resolve(strictTree))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("MISSING_PASSWORD");
        new EnvironmentPlaceholderResolver(env::get, true).resolve(lenientTree);
        assertThat(lenientTree.get("password")).isEqualTo("");
    }
}
