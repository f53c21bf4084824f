package xyz.firestige.netdeploy.infrastructure.intent;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;
import xyz.firestige.netdeploy.domain.shared.exception.ConfigurationException;
import xyz.firestige.netdeploy.domain.shared.exception.IntentNotFoundException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * YAML 意图加载测试
 */
@DisplayName("YAML 意图加载 测试")
class YamlIntentLoaderTest {

    private static final Map<String, Integer> ROLE_TIERS = Map.of("core", 0, "gateway", 1, "aggregation", 2, "edge", 3);

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    private YamlIntentLoader loader(Map<String, String> env) {
        return new YamlIntentLoader(new DefaultResourceLoader(), validator,
                new EnvironmentPlaceholderResolver(env::get, false), ROLE_TIERS);
    }

    private IntentRepository load(String yaml) {
        return loader(Map.of()).load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "inline");
    }

    @Test
    @DisplayName("场景 - 从 classpath 加载测试意图，保持声明顺序")
    void loadsClasspathDocument() {
        // When
        IntentRepository repository = loader(Map.of("NETDEPLOY_TEST_COMMUNITY", "from-env"))
                .load("classpath:intent/test-fleet.yaml");

        // Then
        assertThat(repository.names()).containsExactly("LAB-CORE1", "LAB-EDGE1", "LAB-SPARE");
        assertThat(repository.enterprise().snmpCommunity()).isEqualTo("from-env");
        assertThat(repository.enterprise().password()).isEqualTo("secret");
        DeviceIntent edge = repository.get("LAB-EDGE1");
        assertThat(edge.getTier()).isEqualTo(3);
        assertThat(edge.getVrfs()).containsExactly("STAFF-NET", "STUDENT-NET");
        assertThat(edge.getDependsOn()).containsExactly("LAB-CORE1");
        assertThat(repository.get("LAB-SPARE").getTier()).isEqualTo(5);
    }

    @Test
    @DisplayName("场景 - 查询不存在的设备抛出 IntentNotFoundException")
    void unknownDevice() {
        // Given
        IntentRepository repository = load("devices:\n  R1:\n    role: core\n    template: core_router\n");

        // Then
        assertThat(repository.find("R2")).isEmpty();
        assertThatThrownBy(() -> repository.get("R2")).isInstanceOf(IntentNotFoundException.class);
    }

    @Test
    @DisplayName("场景 - 引用未定义的 VRF 时加载失败")
    void undefinedVrfRejected() {
        // Given
        String yaml = "devices:\n  R1:\n    role: edge\n    template: pe_router\n    vrfs: [GUEST-NET]\n";

        // Then
        assertThatThrownBy(() -> load(yaml))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("GUEST-NET");
    }

    @Test
    @DisplayName("场景 - 未映射的角色且没有显式层级时加载失败")
    void unmappedRoleRejected() {
        // Given
        String yaml = "devices:\n  R1:\n    role: firewall\n    template: core_router\n";

        // Then
        assertThatThrownBy(() -> load(yaml))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("firewall");
    }

    @Test
    @DisplayName("场景 - 缺少必填字段时 Bean Validation 报错")
    void missingTemplateRejected() {
        // Given
        String yaml = "devices:\n  R1:\n    role: core\n";

        // Then
        assertThatThrownBy(() -> load(yaml))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("template");
    }

    @Test
    @DisplayName("场景 - 未知字段被拒绝")
    void unknownFieldRejected() {
        // Given
        String yaml = "devices:\n  R1:\n    role: core\n    template: core_router\n    colour: blue\n";

        // Then
        assertThatThrownBy(() -> load(yaml)).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("场景 - 缺失且无默认值的环境变量导致加载失败")
    void missingEnvWithoutDefaultRejected() {
        // Given
        String yaml = "enterprise:\n  password: \"{$NO_SUCH_PASSWORD}\"\n"
                + "devices:\n  R1:\n    role: core\n    template: core_router\n";

        // Then
        assertThatThrownBy(() -> load(yaml))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("NO_SUCH_PASSWORD");
    }
}
