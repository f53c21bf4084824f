package xyz.firestige.netdeploy.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.firestige.netdeploy.domain.validation.CheckCategory;

import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 部署工具配置属性
 * prefix: netdeploy
 */
@ConfigurationProperties(prefix = "netdeploy")
@Validated
public class NetDeployProperties {

    @Valid
    @NotNull
    private Intent intent = new Intent();
    @Valid
    @NotNull
    private Template template = new Template();
    @Valid
    @NotNull
    private Store store = new Store();
    @Valid
    @NotNull
    private Planner planner = new Planner();
    @Valid
    @NotNull
    private Execution execution = new Execution();
    @Valid
    @NotNull
    private Validation validation = new Validation();
    @Valid
    @NotNull
    private Lab lab = new Lab();
    @Valid
    @NotNull
    private Report report = new Report();
    @NotNull
    private Cli cli = new Cli();

    // ========== Intent ==========
    public static class Intent {
        /** 意图文档位置，支持 classpath: / file: */
        @NotBlank
        private String location = "classpath:intent/fleet.yaml";
        /** 环境变量缺失且无默认值时是否保留占位符原文（否则启动失败） */
        private boolean allowMissingEnv = false;
        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
        public boolean isAllowMissingEnv() { return allowMissingEnv; }
        public void setAllowMissingEnv(boolean allowMissingEnv) { this.allowMissingEnv = allowMissingEnv; }
    }

    // ========== Template ==========
    public static class Template {
        /** 模板目录，模板文件名为 {template}.txt */
        @NotBlank
        private String location = "classpath:templates/";
        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }

    // ========== Store ==========
    public static class Store {
        public enum Type { file, redis, memory }

        /** 存储类型，默认 file */
        @NotNull
        private Type type = Type.file;
        /** file 模式的根目录：generated/ 与 backups/ 位于其下 */
        @NotBlank
        private String baseDir = "netdeploy-data";
        /** redis 键前缀 */
        @NotBlank
        private String redisNamespace = "netdeploy";
        public Type getType() { return type; }
        public void setType(Type type) { this.type = type; }
        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
        public String getRedisNamespace() { return redisNamespace; }
        public void setRedisNamespace(String redisNamespace) { this.redisNamespace = redisNamespace; }
    }

    // ========== Planner ==========
    public static class Planner {
        /** 未显式声明 tier 的设备按角色映射层级 */
        @NotEmpty
        private Map<String, Integer> roleTiers = new LinkedHashMap<>() {{
            put("core", 0);
            put("gateway", 1);
            put("aggregation", 2);
            put("edge", 3);
        }};
        public Map<String, Integer> getRoleTiers() { return roleTiers; }
        public void setRoleTiers(Map<String, Integer> roleTiers) { this.roleTiers = roleTiers; }
    }

    // ========== Execution ==========
    public static class Execution {
        /** 并行阶段（生成/备份/预览/校验）的工作线程数 */
        @Min(1)
        private int workerPoolSize = 8;
        @Min(1)
        private int queueCapacity = 256;
        /** 单次设备会话操作超时 */
        @NotNull
        private Duration operationTimeout = Duration.ofSeconds(30);
        public int getWorkerPoolSize() { return workerPoolSize; }
        public void setWorkerPoolSize(int workerPoolSize) { this.workerPoolSize = workerPoolSize; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getOperationTimeout() { return operationTimeout; }
        public void setOperationTimeout(Duration operationTimeout) { this.operationTimeout = operationTimeout; }
    }

    // ========== Validation ==========
    public static class Validation {
        @NotNull
        private Set<CheckCategory> preChecks = EnumSet.of(CheckCategory.REACHABILITY, CheckCategory.INTERFACES);
        @NotNull
        private Set<CheckCategory> postChecks = EnumSet.allOf(CheckCategory.class);
        public Set<CheckCategory> getPreChecks() { return preChecks; }
        public void setPreChecks(Set<CheckCategory> preChecks) { this.preChecks = preChecks; }
        public Set<CheckCategory> getPostChecks() { return postChecks; }
        public void setPostChecks(Set<CheckCategory> postChecks) { this.postChecks = postChecks; }
    }

    // ========== Lab ==========
    public static class Lab {
        /** 离线实验目录：{directory}/{device}/running-config.cfg、state.yaml */
        @NotBlank
        private String directory = "lab";
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    // ========== Report ==========
    public static class Report {
        @NotBlank
        private String directory = "reports";
        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    // ========== CLI ==========
    public static class Cli {
        /** 是否在启动后执行命令行（测试中关闭） */
        private boolean enabled = true;
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public Intent getIntent() { return intent; }
    public void setIntent(Intent intent) { this.intent = intent; }
    public Template getTemplate() { return template; }
    public void setTemplate(Template template) { this.template = template; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Planner getPlanner() { return planner; }
    public void setPlanner(Planner planner) { this.planner = planner; }
    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Validation getValidation() { return validation; }
    public void setValidation(Validation validation) { this.validation = validation; }
    public Lab getLab() { return lab; }
    public void setLab(Lab lab) { this.lab = lab; }
    public Report getReport() { return report; }
    public void setReport(Report report) { this.report = report; }
    public Cli getCli() { return cli; }
    public void setCli(Cli cli) { this.cli = cli; }
}
