package xyz.firestige.netdeploy.infrastructure.intent;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import xyz.firestige.netdeploy.domain.intent.BgpNeighborIntent;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.intent.EnterpriseSettings;
import xyz.firestige.netdeploy.domain.intent.IntentRepository;
import xyz.firestige.netdeploy.domain.intent.InterfaceIntent;
import xyz.firestige.netdeploy.domain.intent.VrfDefinition;
import xyz.firestige.netdeploy.domain.shared.exception.ConfigurationException;
import xyz.firestige.netdeploy.infrastructure.intent.model.BgpNeighborDocument;
import xyz.firestige.netdeploy.infrastructure.intent.model.DeviceDocument;
import xyz.firestige.netdeploy.infrastructure.intent.model.EnterpriseDocument;
import xyz.firestige.netdeploy.infrastructure.intent.model.IntentDocument;
import xyz.firestige.netdeploy.infrastructure.intent.model.InterfaceDocument;
import xyz.firestige.netdeploy.infrastructure.intent.model.VrfDocument;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * YAML 意图加载器
 * <p>
 * 职责：
 * 1. 读取意图文档（classpath: / file: 均可）
 * 2. 在绑定前解析 {$VAR:default} 环境变量占位符
 * 3. Bean Validation 校验 + 引用完整性校验（VRF 引用、层级可解析）
 * 4. 构建不可变的 IntentRepository
 */
public class YamlIntentLoader {

    private static final Logger log = LoggerFactory.getLogger(YamlIntentLoader.class);

    private final ResourceLoader resourceLoader;
    private final Validator validator;
    private final EnvironmentPlaceholderResolver placeholderResolver;
    private final Map<String, Integer> roleTiers;
    private final ObjectMapper yamlMapper;

    public YamlIntentLoader(ResourceLoader resourceLoader,
                            Validator validator,
                            EnvironmentPlaceholderResolver placeholderResolver,
                            Map<String, Integer> roleTiers) {
        this.resourceLoader = resourceLoader;
        this.validator = validator;
        this.placeholderResolver = placeholderResolver;
        this.roleTiers = new LinkedHashMap<>();
        roleTiers.forEach((role, tier) -> this.roleTiers.put(role.toLowerCase(Locale.ROOT), tier));
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public IntentRepository load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigurationException("Intent document not found: " + location);
        }
        log.info("Loading intent document from {}", location);
        try (InputStream in = resource.getInputStream()) {
            return load(in, location);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read intent document: " + location, e);
        }
    }

    public IntentRepository load(InputStream in, String sourceName) {
        IntentDocument document = parse(in, sourceName);
        validate(document, sourceName);
        IntentRepository repository = toRepository(document);
        log.info("Intent loaded from {}: devices={}, vrfs={}", sourceName, repository.size(), repository.vrfs().size());
        return repository;
    }

    private IntentDocument parse(InputStream in, String sourceName) {
        try {
            Map<String, Object> tree = yamlMapper.readValue(in, new TypeReference<LinkedHashMap<String, Object>>() {});
            if (tree == null) {
                throw new ConfigurationException("Intent document is empty: " + sourceName);
            }
            placeholderResolver.resolve(tree);
            return yamlMapper.convertValue(tree, IntentDocument.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException("Malformed intent document " + sourceName + ": " + e.getMessage(), e);
        }
    }

    private void validate(IntentDocument document, String sourceName) {
        Set<ConstraintViolation<IntentDocument>> violations = validator.validate(document);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ConfigurationException("Invalid intent document " + sourceName + ": " + details);
        }
        document.getDevices().forEach((name, device) -> {
            for (String vrf : device.getVrfs()) {
                if (!document.getVrfs().containsKey(vrf)) {
                    throw new ConfigurationException("Device " + name + " references undefined VRF: " + vrf);
                }
            }
            resolveTier(name, device);
        });
    }

    private int resolveTier(String name, DeviceDocument device) {
        if (device.getTier() != null) {
            return device.getTier();
        }
        Integer mapped = roleTiers.get(device.getRole().toLowerCase(Locale.ROOT));
        if (mapped == null) {
            throw new ConfigurationException("Device " + name + " has no tier and role '" + device.getRole()
                    + "' is not mapped in netdeploy.planner.role-tiers");
        }
        return mapped;
    }

    private IntentRepository toRepository(IntentDocument document) {
        Map<String, DeviceIntent> devices = new LinkedHashMap<>();
        document.getDevices().forEach((name, d) -> devices.put(name, toIntent(name, d)));

        Map<String, VrfDefinition> vrfs = new LinkedHashMap<>();
        document.getVrfs().forEach((name, v) -> vrfs.put(name, new VrfDefinition(
                name, blankToNull(v.getDescription()), v.getRdSuffix(), v.getRouteTarget(), blankToNull(v.getIpv6Prefix()))));

        return new IntentRepository(devices, toEnterprise(document.getEnterprise()), vrfs);
    }

    private DeviceIntent toIntent(String name, DeviceDocument d) {
        List<InterfaceIntent> interfaces = d.getInterfaces().stream()
                .map(this::toInterface)
                .toList();
        List<BgpNeighborIntent> neighbors = d.getBgpNeighbors().stream()
                .map(this::toNeighbor)
                .toList();
        return DeviceIntent.builder(name)
                .role(d.getRole())
                .tier(resolveTier(name, d))
                .template(d.getTemplate())
                .mgmtIp(blankToNull(d.getMgmtIp()))
                .loopbackIp(blankToNull(d.getLoopbackIp()))
                .loopbackIpv6(blankToNull(d.getLoopbackIpv6()))
                .bgpAsn(blankToNull(d.getBgpAsn()))
                .routeReflector(d.isRouteReflector())
                .rrClusterId(blankToNull(d.getRrClusterId()))
                .interfaces(interfaces)
                .bgpNeighbors(neighbors)
                .vrfs(d.getVrfs())
                .dependsOn(d.getDependsOn())
                .build();
    }

    private InterfaceIntent toInterface(InterfaceDocument i) {
        return new InterfaceIntent(i.getName(), blankToNull(i.getIp()), blankToNull(i.getMask()),
                blankToNull(i.getIpv6()), blankToNull(i.getDescription()));
    }

    private BgpNeighborIntent toNeighbor(BgpNeighborDocument n) {
        return new BgpNeighborIntent(n.getIp(), blankToNull(n.getIpv6()), n.getRemoteAs(), blankToNull(n.getDescription()));
    }

    private EnterpriseSettings toEnterprise(EnterpriseDocument e) {
        if (e == null) {
            return EnterpriseSettings.empty();
        }
        return new EnterpriseSettings(
                blankToNull(e.getDomainName()),
                e.getDnsServers(),
                e.getDnsServersV6(),
                e.getNtpServers(),
                blankToNull(e.getSnmpCommunity()),
                blankToNull(e.getSnmpLocation()),
                blankToNull(e.getSnmpContact()),
                blankToNull(e.getDefaultGateway()),
                blankToNull(e.getMgmtMask()),
                blankToNull(e.getUsername()),
                blankToNull(e.getPassword()),
                blankToNull(e.getEnableSecret()),
                blankToNull(e.getOspfAuthKey()),
                blankToNull(e.getBgpAuthKey()));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
