package xyz.firestige.netdeploy.domain.intent;

import java.util.Comparator;

/**
 * BGP 邻居声明
 */
public record BgpNeighborIntent(String ip, String ipv6, String remoteAs, String description) {

    public static final Comparator<BgpNeighborIntent> BY_ADDRESS =
            Comparator.comparing(BgpNeighborIntent::ip, NaturalOrder.INSTANCE);
}
