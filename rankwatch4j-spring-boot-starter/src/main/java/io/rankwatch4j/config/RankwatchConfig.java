package io.rankwatch4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.rankwatch4j.CrawlScheduler;
import io.rankwatch4j.crawl.CrawlExecutor;
import io.rankwatch4j.crawl.SourceCatalog;
import io.rankwatch4j.http.RateLimitedClient;
import io.rankwatch4j.internal.DefaultCrawlScheduler;
import io.rankwatch4j.internal.memory.InMemoryCrawlStore;
import io.rankwatch4j.internal.memory.InMemoryJobStore;
import io.rankwatch4j.internal.mongo.MongoCrawlStore;
import io.rankwatch4j.internal.mongo.MongoJobStore;
import io.rankwatch4j.monitor.TaskMonitor;
import io.rankwatch4j.normalize.ResponseNormalizer;
import io.rankwatch4j.store.CrawlStore;
import io.rankwatch4j.store.JobStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for rankwatch components.
 *
 * <p>Stores are backed by MongoDB when a {@link MongoTemplate} bean exists and kept in memory otherwise.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration"
})
@ConditionalOnClass(CrawlScheduler.class)
@EnableConfigurationProperties(RankwatchProperties.class)
@ConditionalOnProperty(prefix = "rankwatch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RankwatchConfig {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper rankwatchObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore rankwatchJobStore(ObjectProvider<MongoTemplate> mongoTemplate) {
        MongoTemplate template = mongoTemplate.getIfAvailable();
        return template != null ? new MongoJobStore(template) : new InMemoryJobStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public CrawlStore rankwatchCrawlStore(ObjectProvider<MongoTemplate> mongoTemplate) {
        MongoTemplate template = mongoTemplate.getIfAvailable();
        return template != null ? new MongoCrawlStore(template) : new InMemoryCrawlStore();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MongoTemplate.class)
    protected RankwatchMongoIndexConfig rankwatchMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new RankwatchMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnBean(MongoTemplate.class)
    @ConditionalOnProperty(prefix = "rankwatch", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton rankwatchIndexesInitializer(RankwatchMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    @Bean
    @ConditionalOnMissingBean
    public RateLimitedClient rateLimitedClient(RankwatchProperties props, ObjectMapper objectMapper) {
        return new RateLimitedClient(props.getHttp(), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResponseNormalizer responseNormalizer(RankwatchProperties props) {
        return new ResponseNormalizer(props.getNormalizer().getMalformedItemPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public SourceCatalog sourceCatalog(RankwatchProperties props) {
        return SourceCatalog.fromProperties(
                props.getTemplates(), props.getBaseParams(), props.getSources(), props.getDetailTemplate());
    }

    @Bean
    @ConditionalOnMissingBean
    public CrawlExecutor crawlExecutor(RateLimitedClient client,
                                       ResponseNormalizer normalizer,
                                       CrawlStore crawlStore,
                                       SourceCatalog catalog) {
        return new CrawlExecutor(client, normalizer, crawlStore, catalog);
    }

    @Bean
    @ConditionalOnMissingBean
    public CrawlScheduler crawlScheduler(RankwatchProperties props, JobStore jobStore, CrawlExecutor crawlExecutor) {
        return new DefaultCrawlScheduler(props.getScheduler(), jobStore, crawlExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "rankwatch.monitor", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TaskMonitor taskMonitor(RankwatchProperties props,
                                   SourceCatalog catalog,
                                   CrawlStore crawlStore,
                                   CrawlExecutor crawlExecutor) {
        return new TaskMonitor(props.getMonitor(), catalog, crawlStore, crawlExecutor);
    }

    @Bean
    @ConditionalOnMissingBean
    public RankwatchLifecycle rankwatchLifecycle(CrawlScheduler scheduler,
                                                 ObjectProvider<TaskMonitor> monitor,
                                                 RankwatchProperties props) {
        return new RankwatchLifecycle(scheduler, monitor.getIfAvailable(), props);
    }
}
