package xyz.firestige.netdeploy.infrastructure.parser;

import java.util.Map;

/**
 * 结构化状态中的一行，例如一个接口、一个 OSPF 邻居、一个 BGP 会话
 *
 * @param name  标识（接口名 / 邻居地址 / VRF 名）
 * @param state 状态文本（up/up、FULL、Established、Oper ...）
 */
public record ProtocolEntry(String name, String state, Map<String, String> attributes) {

    public ProtocolEntry {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public ProtocolEntry(String name, String state) {
        this(name, state, Map.of());
    }
}
