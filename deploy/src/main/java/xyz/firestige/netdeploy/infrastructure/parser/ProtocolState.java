package xyz.firestige.netdeploy.infrastructure.parser;

import xyz.firestige.netdeploy.domain.validation.CheckCategory;

import java.util.List;
import java.util.Optional;

/**
 * 某一校验类别在设备上的结构化状态
 */
public record ProtocolState(CheckCategory category, List<ProtocolEntry> entries) {

    public ProtocolState {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public Optional<ProtocolEntry> find(String name) {
        return entries.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
