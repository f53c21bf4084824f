package xyz.firestige.netdeploy.infrastructure.parser;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.shared.exception.ParseUnavailableException;
import xyz.firestige.netdeploy.domain.shared.exception.SessionException;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 读取 {root}/{device}/state.yaml 的离线解析器，与 DirectorySessionProvider 配套使用。
 * <pre>
 * interfaces:
 *   - name: GigabitEthernet2
 *     state: up/up
 * bgp:
 *   - name: 10.255.0.1
 *     state: Established
 * </pre>
 * 键名为类别名小写（mpls_ldp、vrf ...）。键缺失 = 未配置；state.yaml 缺失 = 无法解析。
 */
public class StateFileOutputParser implements OutputParser {

    private static final Logger log = LoggerFactory.getLogger(StateFileOutputParser.class);
    static final String STATE_FILE = "state.yaml";

    private final Path root;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public StateFileOutputParser(Path root) {
        this.root = root;
    }

    @Override
    public Optional<ProtocolState> parse(DeviceIntent device, CheckCategory category) {
        Path dir = root.resolve(device.getName());
        if (!Files.isDirectory(dir)) {
            throw new SessionException("Device " + device.getName() + " unreachable: no lab directory " + dir);
        }
        Path file = dir.resolve(STATE_FILE);
        if (!Files.exists(file)) {
            throw new ParseUnavailableException("No protocol state published for " + device.getName());
        }
        Map<String, List<Map<String, Object>>> document;
        try {
            document = yamlMapper.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, List<Map<String, Object>>>>() {});
        } catch (IOException e) {
            throw new ParseUnavailableException("Unparseable state file " + file + ": " + e.getMessage());
        }
        if (document == null) {
            return Optional.empty();
        }
        List<Map<String, Object>> rows = document.get(category.name().toLowerCase(Locale.ROOT));
        if (rows == null) {
            log.debug("Category {} not configured on {}", category, device.getName());
            return Optional.empty();
        }
        List<ProtocolEntry> entries = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            Map<String, String> attributes = new LinkedHashMap<>();
            row.forEach((k, v) -> {
                if (!"name".equals(k) && !"state".equals(k) && v != null) {
                    attributes.put(k, String.valueOf(v));
                }
            });
            entries.add(new ProtocolEntry(String.valueOf(row.get("name")), String.valueOf(row.get("state")), attributes));
        }
        return Optional.of(new ProtocolState(category, entries));
    }
}
