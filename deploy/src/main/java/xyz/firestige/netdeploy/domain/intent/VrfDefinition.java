package xyz.firestige.netdeploy.domain.intent;

/**
 * VRF（逻辑分区）定义，全网共享；设备通过名称引用。
 *
 * @param rdSuffix    RD 后缀，与设备 BGP ASN 组合成 route distinguisher
 * @param routeTarget 导入与导出使用同一个 route target
 */
public record VrfDefinition(String name, String description, String rdSuffix, String routeTarget, String ipv6Prefix) {
}
