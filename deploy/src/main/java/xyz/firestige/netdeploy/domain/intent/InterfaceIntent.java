package xyz.firestige.netdeploy.domain.intent;

import java.util.Comparator;

/**
 * 三层接口声明。ip 为空表示该接口不参与三层（接口状态校验会忽略它）。
 */
public record InterfaceIntent(String name, String ip, String mask, String ipv6, String description) {

    public static final Comparator<InterfaceIntent> BY_NAME =
            Comparator.comparing(InterfaceIntent::name, NaturalOrder.INSTANCE);

    public boolean hasAddress() {
        return ip != null && !ip.isBlank();
    }
}
