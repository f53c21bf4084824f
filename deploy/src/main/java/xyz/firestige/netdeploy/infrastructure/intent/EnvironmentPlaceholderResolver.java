package xyz.firestige.netdeploy.infrastructure.intent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.domain.shared.exception.ConfigurationException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * 环境变量占位符解析器，作用于 YAML 解析出的 Map/List 树（绑定到文档对象之前）。
 * 语法:
 *  - {$VAR}
 *  - {$VAR:defaultValue}
 * 默认值中允许出现成对的花括号；第一个深度为 0 的 '}' 关闭占位符。
 */
public class EnvironmentPlaceholderResolver {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentPlaceholderResolver.class);

    private static final List<String> SECRET_SUFFIXES = List.of("_SECRET", "_PASSWORD", "_KEY", "_COMMUNITY");

    private final Function<String, String> env;
    private final boolean allowMissing;
    private final Map<String, String> cache = new HashMap<>();

    public EnvironmentPlaceholderResolver(boolean allowMissing) {
        this(System::getenv, allowMissing);
    }

    public EnvironmentPlaceholderResolver(Function<String, String> env, boolean allowMissing) {
        this.env = env;
        this.allowMissing = allowMissing;
    }

    /**
     * 原地替换树中所有字符串值里的占位符
     *
     * @throws ConfigurationException allowMissing=false 且存在无默认值的缺失变量
     */
    @SuppressWarnings("unchecked")
    public void resolve(Object root) {
        if (root == null) return;
        Set<String> missing = new LinkedHashSet<>();
        int replacedCount = 0;
        Deque<Object> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Object current = stack.pop();
            if (current instanceof List<?> list) {
                List<Object> values = (List<Object>) list;
                for (int i = 0; i < values.size(); i++) {
                    Object val = values.get(i);
                    if (val instanceof String s) {
                        String replaced = replacePlaceholders(s, missing);
                        if (!Objects.equals(s, replaced)) {
                            values.set(i, replaced);
                            replacedCount++;
                        }
                    } else if (isContainer(val)) {
                        stack.push(val);
                    }
                }
            } else if (current instanceof Map<?, ?> map) {
                Map<Object, Object> entries = (Map<Object, Object>) map;
                for (Map.Entry<Object, Object> e : entries.entrySet()) {
                    Object val = e.getValue();
                    if (val instanceof String s) {
                        String replaced = replacePlaceholders(s, missing);
                        if (!Objects.equals(s, replaced)) {
                            e.setValue(replaced);
                            replacedCount++;
                        }
                    } else if (isContainer(val)) {
                        stack.push(val);
                    }
                }
            }
        }
        if (!missing.isEmpty() && !allowMissing) {
            throw new ConfigurationException("Missing env vars: " + String.join(", ", missing));
        }
        log.info("Env placeholders resolved: replaced={}, missingCount={}", replacedCount, missing.size());
        if (!missing.isEmpty()) {
            log.warn("Missing env vars (allowMissing={}) -> {}", allowMissing, missing);
        }
    }

    private boolean isContainer(Object o) {
        return o instanceof Map<?, ?> || o instanceof List<?>;
    }

    String replacePlaceholders(String input, Set<String> missing) {
        if (input == null || !input.contains("{$")) return input;
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < input.length()) {
            int start = input.indexOf("{$", i);
            if (start < 0) {
                out.append(input, i, input.length());
                break;
            }
            out.append(input, i, start);
            int cursor = start + 2;
            while (cursor < input.length() && input.charAt(cursor) != ':' && input.charAt(cursor) != '}') {
                cursor++;
            }
            if (cursor >= input.length()) {
                // 不完整的占位符，原样保留
                out.append(input.substring(start));
                break;
            }
            String varName = input.substring(start + 2, cursor);
            String defaultVal = null;
            if (input.charAt(cursor) == ':') {
                int defStart = ++cursor;
                int depth = 0;
                while (cursor < input.length()) {
                    char c = input.charAt(cursor);
                    if (c == '{') {
                        depth++;
                    } else if (c == '}') {
                        if (depth == 0) break;
                        depth--;
                    }
                    cursor++;
                }
                if (cursor >= input.length()) {
                    out.append(input.substring(start));
                    break;
                }
                defaultVal = input.substring(defStart, cursor);
            }
            out.append(lookup(varName, defaultVal, missing));
            i = cursor + 1;
        }
        return out.toString();
    }

    private String lookup(String varName, String defaultVal, Set<String> missing) {
        String key = defaultVal == null ? varName : varName + ":" + defaultVal;
        String cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        String envVal = env.apply(varName);
        String resolved;
        if (envVal != null && !envVal.isBlank()) {
            resolved = envVal;
            log.debug("Env placeholder {} resolved via env -> {}", varName, display(varName, resolved));
        } else if (defaultVal != null) {
            resolved = defaultVal;
            log.debug("Env placeholder {} resolved via default -> {}", varName, display(varName, resolved));
        } else {
            missing.add(varName);
            resolved = "";
            log.debug("Env placeholder {} missing (no default) -> ''", varName);
        }
        cache.put(key, resolved);
        return resolved;
    }

    private String display(String varName, String value) {
        for (String suffix : SECRET_SUFFIXES) {
            if (varName.endsWith(suffix)) {
                return "***";
            }
        }
        return value;
    }
}
