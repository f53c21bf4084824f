package xyz.firestige.netdeploy.infrastructure.template;

import io.quarkus.qute.Engine;
import io.quarkus.qute.Template;
import io.quarkus.qute.TemplateInstance;
import io.quarkus.qute.ValueResolvers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import xyz.firestige.netdeploy.domain.config.ConfigRenderer;
import xyz.firestige.netdeploy.domain.intent.DeviceIntent;
import xyz.firestige.netdeploy.domain.shared.exception.TemplateRenderException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于 Qute 的配置渲染器
 * <p>
 * 模板位于 {templateLocation}/{template}.txt；设备意图里写的模板名允许带扩展名（.txt / .j2 会被去掉）。
 * 严格渲染：任何无法解析的表达式都会失败，而不是输出空值。
 * <p>
 * 解析后的模板按名称缓存；模板内容只由 classpath 决定，因此缓存不影响确定性。
 */
public class QuteConfigRenderer implements ConfigRenderer {

    private static final Logger log = LoggerFactory.getLogger(QuteConfigRenderer.class);

    private final Engine engine;
    private final ResourceLoader resourceLoader;
    private final String templateLocation;
    private final TemplateModelBuilder modelBuilder;
    private final Map<String, Template> templates = new ConcurrentHashMap<>();

    public QuteConfigRenderer(ResourceLoader resourceLoader, String templateLocation, TemplateModelBuilder modelBuilder) {
        this.engine = Engine.builder()
                .addDefaults()
                .addValueResolver(ValueResolvers.mapResolver())
                .strictRendering(true)
                .build();
        this.resourceLoader = resourceLoader;
        this.templateLocation = templateLocation.endsWith("/") ? templateLocation : templateLocation + "/";
        this.modelBuilder = modelBuilder;
    }

    @Override
    public String render(DeviceIntent intent) {
        Template template = template(intent.getTemplate());
        Map<String, Object> model = modelBuilder.build(intent);
        try {
            TemplateInstance instance = template.instance();
            model.forEach(instance::data);
            return instance.render();
        } catch (RuntimeException e) {
            throw new TemplateRenderException(
                    "Failed to render template " + intent.getTemplate() + " for " + intent.getName() + ": " + e.getMessage(), e);
        }
    }

    private Template template(String name) {
        String id = normalize(name);
        Template cached = templates.get(id);
        if (cached != null) {
            return cached;
        }
        Template parsed = parse(id);
        Template previous = templates.putIfAbsent(id, parsed);
        return previous != null ? previous : parsed;
    }

    private Template parse(String id) {
        String location = templateLocation + id + ".txt";
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new TemplateRenderException("Template not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            String content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            log.debug("Parsed template {} from {}", id, location);
            return engine.parse(content);
        } catch (IOException e) {
            throw new TemplateRenderException("Cannot read template " + location, e);
        } catch (RuntimeException e) {
            throw new TemplateRenderException("Invalid template " + location + ": " + e.getMessage(), e);
        }
    }

    static String normalize(String name) {
        String id = name.strip();
        for (String ext : new String[]{".txt", ".j2"}) {
            if (id.endsWith(ext)) {
                return id.substring(0, id.length() - ext.length());
            }
        }
        return id;
    }
}
