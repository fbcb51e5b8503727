package io.rankwatch4j.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime configuration for crawling, scheduling and gap monitoring.
 */
@ConfigurationProperties(prefix = "rankwatch")
public class RankwatchProperties {
    private boolean enabled = true;
    private boolean ensureIndexesOnStartup = false;

    @NestedConfigurationProperty
    private SchedulerProperties scheduler = new SchedulerProperties();
    @NestedConfigurationProperty
    private HttpClientProperties http = new HttpClientProperties();
    @NestedConfigurationProperty
    private MonitorProperties monitor = new MonitorProperties();
    @NestedConfigurationProperty
    private NormalizerProperties normalizer = new NormalizerProperties();

    // template name -> URL with {placeholders}
    private Map<String, String> templates = new LinkedHashMap<>();
    private Map<String, String> baseParams = new LinkedHashMap<>();
    private String detailTemplate;

    private Map<String, SourceProperties> sources = new LinkedHashMap<>();
    private Map<String, BatchJobProperties> jobs = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    public HttpClientProperties getHttp() {
        return http;
    }

    public void setHttp(HttpClientProperties http) {
        this.http = http;
    }

    public MonitorProperties getMonitor() {
        return monitor;
    }

    public void setMonitor(MonitorProperties monitor) {
        this.monitor = monitor;
    }

    public NormalizerProperties getNormalizer() {
        return normalizer;
    }

    public void setNormalizer(NormalizerProperties normalizer) {
        this.normalizer = normalizer;
    }

    public Map<String, String> getTemplates() {
        return templates;
    }

    public void setTemplates(Map<String, String> templates) {
        this.templates = templates;
    }

    public Map<String, String> getBaseParams() {
        return baseParams;
    }

    public void setBaseParams(Map<String, String> baseParams) {
        this.baseParams = baseParams;
    }

    public String getDetailTemplate() {
        return detailTemplate;
    }

    public void setDetailTemplate(String detailTemplate) {
        this.detailTemplate = detailTemplate;
    }

    public Map<String, SourceProperties> getSources() {
        return sources;
    }

    public void setSources(Map<String, SourceProperties> sources) {
        this.sources = sources;
    }

    public Map<String, BatchJobProperties> getJobs() {
        return jobs;
    }

    public void setJobs(Map<String, BatchJobProperties> jobs) {
        this.jobs = jobs;
    }
}
