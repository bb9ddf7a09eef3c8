package com.mailmind.adapter.spring;

import com.mailmind.backend.FakeInferenceBackend;
import com.mailmind.backend.InferenceBackend;
import com.mailmind.config.MailMindConfig;
import com.mailmind.dispatch.BatchDispatcher;
import com.mailmind.pool.InferencePool;
import com.mailmind.pool.PoolStats;
import com.mailmind.priority.PriorityClassifier;
import com.mailmind.store.ClassificationLog;
import com.mailmind.store.InMemoryClassificationLog;
import com.mailmind.store.InMemoryPreferenceStore;
import com.mailmind.store.PreferenceStore;
import com.mailmind.store.jdbc.JdbcClassificationLog;
import com.mailmind.store.jdbc.JdbcPreferenceStore;
import com.mailmind.triage.TriageService;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import javax.sql.DataSource;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MailMindAutoConfiguration.
 */
class MailMindAutoConfigurationTest {

    private final FakeInferenceBackend backend = new FakeInferenceBackend();

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(MailMindAutoConfiguration.class))
            .withBean(InferenceBackend.class, () -> backend);

    @Test
    @DisplayName("Should wire every component with in-memory stores by default")
    void shouldCreateAllBeans() {
        runner.run(ctx -> {
            assertNotNull(ctx.getBean(MailMindConfig.class));
            assertNotNull(ctx.getBean(BatchDispatcher.class));
            assertNotNull(ctx.getBean(PriorityClassifier.class));
            assertNotNull(ctx.getBean(TriageService.class));
            assertInstanceOf(InMemoryPreferenceStore.class, ctx.getBean(PreferenceStore.class));
            assertInstanceOf(InMemoryClassificationLog.class, ctx.getBean(ClassificationLog.class));

            InferencePool pool = ctx.getBean(InferencePool.class);
            assertTrue(pool.healthCheck());
            assertEquals(new PoolStats(3, 0, 3), pool.stats());
        });
    }

    @Test
    @DisplayName("Should close pooled clients when the context shuts down")
    void shouldClosePoolOnShutdown() {
        runner.run(ctx -> assertEquals(3, backend.getConnectCount()));

        assertEquals(3, backend.getClosedCount());
    }

    @Test
    @DisplayName("Should create no beans when disabled")
    void shouldBackOffWhenDisabled() {
        runner.withPropertyValues("mailmind.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("inferencePool"));
            assertFalse(ctx.containsBean("priorityClassifier"));
            assertEquals(0, backend.getConnectCount());
        });
    }

    @Test
    @DisplayName("Should use JDBC stores on the application DataSource")
    void shouldUseJdbcStores() {
        runner.withPropertyValues("mailmind.store-type=jdbc")
                .withBean(DataSource.class, () -> {
                    JdbcDataSource ds = new JdbcDataSource();
                    ds.setURL("jdbc:h2:mem:mailmind_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
                    return ds;
                })
                .run(ctx -> {
                    assertInstanceOf(JdbcPreferenceStore.class, ctx.getBean(PreferenceStore.class));
                    assertInstanceOf(JdbcClassificationLog.class, ctx.getBean(ClassificationLog.class));

                    PriorityClassifier classifier = ctx.getBean(PriorityClassifier.class);
                    classifier.setSenderVip("ceo@example.com", true);
                    assertTrue(classifier.getSenderStats("ceo@example.com").orElseThrow().vip());
                });
    }

    @Test
    @DisplayName("Should fail to start with JDBC stores but no DataSource")
    void shouldFailWithoutDataSource() {
        runner.withPropertyValues("mailmind.store-type=jdbc")
                .run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }

    @Test
    @DisplayName("Should fail to start when the configuration file is missing")
    void shouldFailOnMissingConfig() {
        runner.withPropertyValues("mailmind.config-path=classpath:does-not-exist.yaml")
                .run(ctx -> assertNotNull(ctx.getStartupFailure()));
    }
}
