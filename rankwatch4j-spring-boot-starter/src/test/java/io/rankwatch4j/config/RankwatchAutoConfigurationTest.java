package io.rankwatch4j.config;

import io.rankwatch4j.CrawlScheduler;
import io.rankwatch4j.core.JobDefinition;
import io.rankwatch4j.core.TriggerType;
import io.rankwatch4j.crawl.CrawlExecutor;
import io.rankwatch4j.crawl.SourceCatalog;
import io.rankwatch4j.crawl.SourceKind;
import io.rankwatch4j.internal.memory.InMemoryCrawlStore;
import io.rankwatch4j.internal.memory.InMemoryJobStore;
import io.rankwatch4j.internal.mongo.MongoCrawlStore;
import io.rankwatch4j.internal.mongo.MongoJobStore;
import io.rankwatch4j.monitor.TaskMonitor;
import io.rankwatch4j.normalize.MalformedItemPolicy;
import io.rankwatch4j.normalize.ResponseNormalizer;
import io.rankwatch4j.store.CrawlStore;
import io.rankwatch4j.store.JobStore;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class RankwatchAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RankwatchConfig.class))
            .withPropertyValues(
                    "rankwatch.scheduler.worker-id=test-worker",
                    "rankwatch.scheduler.process-every=500ms",
                    "rankwatch.templates.jiazi=https://app.test/getPrivilegeList?version={version}",
                    "rankwatch.templates.page=https://app.test/getAppIndexData?channel={channel}&version={version}",
                    "rankwatch.base-params.version=20"
            );

    @Test
    void shouldAutoConfigureInMemoryStoresWithoutMongo() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(CrawlScheduler.class);
            assertThat(context).hasSingleBean(CrawlExecutor.class);
            assertThat(context).hasSingleBean(TaskMonitor.class);
            assertThat(context).hasSingleBean(RankwatchLifecycle.class);
            assertThat(context).hasSingleBean(RankwatchProperties.class);
            assertThat(context).doesNotHaveBean(RankwatchMongoIndexConfig.class);
            assertThat(context.getBean(JobStore.class)).isInstanceOf(InMemoryJobStore.class);
            assertThat(context.getBean(CrawlStore.class)).isInstanceOf(InMemoryCrawlStore.class);
            assertThat(context.getBean(CrawlScheduler.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldUseMongoStoresWhenMongoTemplateIsPresent() {
        contextRunner
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .withPropertyValues("rankwatch.monitor.enabled=false")
                .run(context -> {
                    assertThat(context.getBean(JobStore.class)).isInstanceOf(MongoJobStore.class);
                    assertThat(context.getBean(CrawlStore.class)).isInstanceOf(MongoCrawlStore.class);
                    assertThat(context).hasSingleBean(RankwatchMongoIndexConfig.class);
                    assertThat(context).doesNotHaveBean(TaskMonitor.class);
                });
    }

    @Test
    void shouldBindSourcesAndRegisterConfiguredJobs() {
        contextRunner
                .withPropertyValues(
                        "rankwatch.monitor.enabled=false",
                        "rankwatch.normalizer.malformed-item-policy=SKIP_ITEM",
                        "rankwatch.sources.jiazi.kind=HOT_LIST",
                        "rankwatch.sources.jiazi.template=jiazi",
                        "rankwatch.sources.jiazi.trigger=1 hour",
                        "rankwatch.sources.jiazi.max-retries=5",
                        "rankwatch.sources.romance.kind=CATEGORY",
                        "rankwatch.sources.romance.template=page",
                        "rankwatch.sources.romance.params.channel=romance",
                        "rankwatch.sources.romance.trigger=0 8 * * *",
                        "rankwatch.sources.fantasy.kind=CATEGORY",
                        "rankwatch.sources.fantasy.template=page",
                        "rankwatch.sources.fantasy.params.channel=fantasy",
                        "rankwatch.jobs.categories.targets=category",
                        "rankwatch.jobs.categories.trigger=AT 03:00"
                )
                .run(context -> {
                    SourceCatalog catalog = context.getBean(SourceCatalog.class);
                    assertThat(catalog.definitions()).hasSize(3);
                    assertThat(catalog.find("romance").orElseThrow().kind()).isEqualTo(SourceKind.CATEGORY);
                    assertThat(context.getBean(ResponseNormalizer.class).getMalformedItemPolicy())
                            .isEqualTo(MalformedItemPolicy.SKIP_ITEM);

                    JobStore jobStore = context.getBean(JobStore.class);
                    assertThat(jobStore.countDefinitions()).isEqualTo(3);

                    JobDefinition jiazi = jobStore.findDefinition("jiazi").orElseThrow();
                    assertThat(jiazi.maxRetries()).isEqualTo(5);
                    assertThat(jiazi.trigger().type()).isEqualTo(TriggerType.INTERVAL);

                    assertThat(jobStore.findDefinition("romance").orElseThrow().trigger().type())
                            .isEqualTo(TriggerType.CRON);
                    assertThat(jobStore.findDefinition("fantasy")).isEmpty();

                    JobDefinition categories = jobStore.findDefinition("categories").orElseThrow();
                    assertThat(categories.targets()).containsExactlyInAnyOrder("romance", "fantasy");
                    assertThat(categories.trigger().type()).isEqualTo(TriggerType.DAILY);
                });
    }

    @Test
    void shouldBindDurations() {
        contextRunner
                .withPropertyValues(
                        "rankwatch.http.rate-limit-delay=250ms",
                        "rankwatch.monitor.interval=10m",
                        "rankwatch.scheduler.max-workers=2"
                )
                .run(context -> {
                    RankwatchProperties props = context.getBean(RankwatchProperties.class);
                    assertThat(props.getHttp().getRateLimitDelay()).isEqualTo(Duration.ofMillis(250));
                    assertThat(props.getMonitor().getInterval()).isEqualTo(Duration.ofMinutes(10));
                    assertThat(props.getScheduler().getMaxWorkers()).isEqualTo(2);
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("rankwatch.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(CrawlScheduler.class);
                    assertThat(context).doesNotHaveBean(RankwatchLifecycle.class);
                });
    }

    @Test
    void invalidSourceConfigurationShouldFailStartup() {
        contextRunner
                .withPropertyValues(
                        "rankwatch.sources.broken.kind=CATEGORY",
                        "rankwatch.sources.broken.template=missing"
                )
                .run(context -> assertThat(context).hasFailed());
    }
}
