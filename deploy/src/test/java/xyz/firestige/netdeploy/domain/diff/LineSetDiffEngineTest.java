package xyz.firestige.netdeploy.domain.diff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * LineSetDiffEngine 单元测试
 * <p>
 * 覆盖：幂等、增删集合、注释/空行/横幅忽略、层级盲区
 */
@Tag("unit")
@DisplayName("行集合差异 测试")
class LineSetDiffEngineTest {

    private final LineSetDiffEngine engine = new LineSetDiffEngine();

    @Test
    @DisplayName("场景 - 相同文本差异为空")
    void identicalTextsProduceEmptyDiff() {
        // Given
        String text = "hostname R1\ninterface Gi1\n ip address 10.0.0.1 255.255.255.0\n";

        // When
        ConfigDiff diff = engine.diff(text, text);

        // Then
        assertThat(diff.isEmpty()).isTrue();
        assertThat(diff.summary()).isEqualTo("+0/-0");
    }

    @Test
    @DisplayName("场景 - 现网 [a,b,c]，期望 [b,c,d]：新增 {d}，删除 {a}")
    void computesSetDifference() {
        // Given
        String live = "a\nb\nc\n";
        String desired = "b\nc\nd\n";

        // When
        ConfigDiff diff = engine.diff(live, desired);

        // Then
        assertThat(diff.getLinesToAdd()).containsExactly("d");
        assertThat(diff.getLinesToRemove()).containsExactly("a");
        assertThat(diff.summary()).isEqualTo("+1/-1");
    }

    @Test
    @DisplayName("场景 - 新增与删除各自按字典序排列")
    void addAndRemoveAreSorted() {
        // Given
        String live = "z\nb\ny\n";
        String desired = "b\nm\nc\n";

        // When
        ConfigDiff diff = engine.diff(live, desired);

        // Then
        assertThat(diff.getLinesToAdd()).containsExactly("c", "m");
        assertThat(diff.getLinesToRemove()).containsExactly("y", "z");
    }

    @Test
    @DisplayName("场景 - 忽略注释、空行、横幅与行尾空白")
    void ignoresCommentsBlankLinesAndBanners() {
        // Given
        String live = "Building configuration...\r\n\r\nCurrent configuration : 1234 bytes\r\n!\r\nhostname R1   \r\n";
        String desired = "! generated\nhostname R1\n\n   ! indented comment\n";

        // When
        ConfigDiff diff = engine.diff(live, desired);

        // Then
        assertThat(diff.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("场景 - 空的现网配置时期望配置全部为新增")
    void emptyLiveAddsEverything() {
        // When
        ConfigDiff diff = engine.diff("", "hostname R1\nip domain name x\n");

        // Then
        assertThat(diff.getLinesToAdd()).containsExactly("hostname R1", "ip domain name x");
        assertThat(diff.getLinesToRemove()).isEmpty();
    }

    @Test
    @DisplayName("场景 - 相同行出现在不同父块下视为未变化")
    void sameLineUnderDifferentParentIsInvisible() {
        // Given
        String live = "interface Gi1\n no shutdown\ninterface Gi2\n";
        String desired = "interface Gi1\ninterface Gi2\n no shutdown\n";

        // When
        ConfigDiff diff = engine.diff(live, desired);

        // Then
        assertThat(diff.isEmpty()).isTrue();
    }
}
