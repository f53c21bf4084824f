package xyz.firestige.netdeploy.domain.intent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 单台设备的完整期望状态，渲染器唯一的数据来源。
 * <p>
 * 加载后不可变。多值字段在构造时排序，保证渲染结果与声明顺序无关：
 * <ul>
 *   <li>interfaces 按接口名</li>
 *   <li>bgpNeighbors 按邻居地址</li>
 *   <li>vrfs 按 VRF 名称</li>
 * </ul>
 * dependsOn 保留声明顺序，只用于部署排序。
 */
public final class DeviceIntent {

    private final String name;
    private final String role;
    private final int tier;
    private final String template;
    private final String mgmtIp;
    private final String loopbackIp;
    private final String loopbackIpv6;
    private final String bgpAsn;
    private final boolean routeReflector;
    private final String rrClusterId;
    private final List<InterfaceIntent> interfaces;
    private final List<BgpNeighborIntent> bgpNeighbors;
    private final List<String> vrfs;
    private final List<String> dependsOn;

    private DeviceIntent(Builder b) {
        this.name = Objects.requireNonNull(b.name, "name");
        this.role = b.role;
        this.tier = b.tier;
        this.template = Objects.requireNonNull(b.template, "template");
        this.mgmtIp = b.mgmtIp;
        this.loopbackIp = b.loopbackIp;
        this.loopbackIpv6 = b.loopbackIpv6;
        this.bgpAsn = b.bgpAsn;
        this.routeReflector = b.routeReflector;
        this.rrClusterId = b.rrClusterId;
        this.interfaces = sorted(b.interfaces, InterfaceIntent.BY_NAME);
        this.bgpNeighbors = sorted(b.bgpNeighbors, BgpNeighborIntent.BY_ADDRESS);
        this.vrfs = sorted(b.vrfs, NaturalOrder.INSTANCE);
        this.dependsOn = List.copyOf(b.dependsOn);
    }

    private static <T> List<T> sorted(List<T> source, Comparator<? super T> order) {
        List<T> copy = new ArrayList<>(source);
        copy.sort(order);
        return List.copyOf(copy);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getRole() {
        return role;
    }

    public int getTier() {
        return tier;
    }

    public String getTemplate() {
        return template;
    }

    public String getMgmtIp() {
        return mgmtIp;
    }

    public String getLoopbackIp() {
        return loopbackIp;
    }

    public String getLoopbackIpv6() {
        return loopbackIpv6;
    }

    public String getBgpAsn() {
        return bgpAsn;
    }

    public boolean isRouteReflector() {
        return routeReflector;
    }

    public String getRrClusterId() {
        return rrClusterId;
    }

    public List<InterfaceIntent> getInterfaces() {
        return interfaces;
    }

    public List<BgpNeighborIntent> getBgpNeighbors() {
        return bgpNeighbors;
    }

    public List<String> getVrfs() {
        return vrfs;
    }

    public List<String> getDependsOn() {
        return dependsOn;
    }

    public boolean hasBgp() {
        return bgpAsn != null && !bgpAsn.isBlank();
    }

    /**
     * 复制出一个新的 Builder，用于测试或在加载阶段做派生。
     */
    public Builder toBuilder() {
        return new Builder(name)
                .role(role)
                .tier(tier)
                .template(template)
                .mgmtIp(mgmtIp)
                .loopbackIp(loopbackIp)
                .loopbackIpv6(loopbackIpv6)
                .bgpAsn(bgpAsn)
                .routeReflector(routeReflector)
                .rrClusterId(rrClusterId)
                .interfaces(interfaces)
                .bgpNeighbors(bgpNeighbors)
                .vrfs(vrfs)
                .dependsOn(dependsOn);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeviceIntent that)) return false;
        return tier == that.tier
                && routeReflector == that.routeReflector
                && name.equals(that.name)
                && Objects.equals(role, that.role)
                && template.equals(that.template)
                && Objects.equals(mgmtIp, that.mgmtIp)
                && Objects.equals(loopbackIp, that.loopbackIp)
                && Objects.equals(loopbackIpv6, that.loopbackIpv6)
                && Objects.equals(bgpAsn, that.bgpAsn)
                && Objects.equals(rrClusterId, that.rrClusterId)
                && interfaces.equals(that.interfaces)
                && bgpNeighbors.equals(that.bgpNeighbors)
                && vrfs.equals(that.vrfs)
                && dependsOn.equals(that.dependsOn);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tier, template, interfaces, bgpNeighbors, vrfs);
    }

    @Override
    public String toString() {
        return "DeviceIntent{" +
                "name='" + name + '\'' +
                ", role='" + role + '\'' +
                ", tier=" + tier +
                ", template='" + template + '\'' +
                '}';
    }

    public static final class Builder {
        private final String name;
        private String role;
        private int tier;
        private String template;
        private String mgmtIp;
        private String loopbackIp;
        private String loopbackIpv6;
        private String bgpAsn;
        private boolean routeReflector;
        private String rrClusterId;
        private List<InterfaceIntent> interfaces = new ArrayList<>();
        private List<BgpNeighborIntent> bgpNeighbors = new ArrayList<>();
        private List<String> vrfs = new ArrayList<>();
        private List<String> dependsOn = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder tier(int tier) {
            this.tier = tier;
            return this;
        }

        public Builder template(String template) {
            this.template = template;
            return this;
        }

        public Builder mgmtIp(String mgmtIp) {
            this.mgmtIp = mgmtIp;
            return this;
        }

        public Builder loopbackIp(String loopbackIp) {
            this.loopbackIp = loopbackIp;
            return this;
        }

        public Builder loopbackIpv6(String loopbackIpv6) {
            this.loopbackIpv6 = loopbackIpv6;
            return this;
        }

        public Builder bgpAsn(String bgpAsn) {
            this.bgpAsn = bgpAsn;
            return this;
        }

        public Builder routeReflector(boolean routeReflector) {
            this.routeReflector = routeReflector;
            return this;
        }

        public Builder rrClusterId(String rrClusterId) {
            this.rrClusterId = rrClusterId;
            return this;
        }

        public Builder interfaces(List<InterfaceIntent> interfaces) {
            this.interfaces = new ArrayList<>(interfaces);
            return this;
        }

        public Builder addInterface(InterfaceIntent iface) {
            this.interfaces.add(iface);
            return this;
        }

        public Builder bgpNeighbors(List<BgpNeighborIntent> bgpNeighbors) {
            this.bgpNeighbors = new ArrayList<>(bgpNeighbors);
            return this;
        }

        public Builder addBgpNeighbor(BgpNeighborIntent neighbor) {
            this.bgpNeighbors.add(neighbor);
            return this;
        }

        public Builder vrfs(List<String> vrfs) {
            this.vrfs = new ArrayList<>(vrfs);
            return this;
        }

        public Builder dependsOn(List<String> dependsOn) {
            this.dependsOn = new ArrayList<>(dependsOn);
            return this;
        }

        public DeviceIntent build() {
            return new DeviceIntent(this);
        }
    }
}
