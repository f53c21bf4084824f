package xyz.firestige.netdeploy.domain.diff;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 行集合差异
 * <p>
 * 算法：
 * 1. 两份文本按行切分（兼容 CRLF），去掉行尾空白
 * 2. 丢弃空行、注释行（首个非空白字符为 '!'）以及设备回显的横幅行
 * 3. 剩余行视为无序集合：add = desired - live，remove = live - desired
 * <p>
 * 注意：该算法不感知配置层级。同一行文本出现在不同父块下（例如两个接口下都有 "no shutdown"），
 * 会被视为未变化。这是已知的局限，保持扁平语义，不做特殊处理。
 */
public class LineSetDiffEngine implements DiffEngine {

    private static final List<String> BANNER_PREFIXES = List.of(
            "Building configuration",
            "Current configuration :"
    );

    @Override
    public ConfigDiff diff(String liveText, String desiredText) {
        Set<String> live = significantLines(liveText);
        Set<String> desired = significantLines(desiredText);

        SortedSet<String> add = new TreeSet<>(desired);
        add.removeAll(live);
        SortedSet<String> remove = new TreeSet<>(live);
        remove.removeAll(desired);
        return new ConfigDiff(add, remove);
    }

    /**
     * 提取参与比较的行，保持首次出现的顺序
     */
    public static Set<String> significantLines(String text) {
        Set<String> lines = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        for (String raw : text.split("\\r?\\n|\\r")) {
            String line = raw.stripTrailing();
            if (isIgnorable(line)) {
                continue;
            }
            lines.add(line);
        }
        return lines;
    }

    static boolean isIgnorable(String line) {
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("!")) {
            return true;
        }
        for (String prefix : BANNER_PREFIXES) {
            if (trimmed.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }
}
