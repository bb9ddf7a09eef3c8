package com.mailmind.adapter.spring;

import com.mailmind.backend.InferenceBackend;
import com.mailmind.backend.ModelSelector;
import com.mailmind.backend.OllamaInferenceBackend;
import com.mailmind.config.BackendConfig;
import com.mailmind.config.ConfigLoader;
import com.mailmind.config.MailMindConfig;
import com.mailmind.dispatch.BatchDispatcher;
import com.mailmind.dispatch.DefaultBatchDispatcher;
import com.mailmind.dispatch.GenerateItemProcessor;
import com.mailmind.exception.ConfigurationException;
import com.mailmind.pool.DefaultInferencePool;
import com.mailmind.pool.InferencePool;
import com.mailmind.pool.PooledClient;
import com.mailmind.priority.DefaultPriorityClassifier;
import com.mailmind.priority.PriorityClassifier;
import com.mailmind.store.ClassificationLog;
import com.mailmind.store.InMemoryClassificationLog;
import com.mailmind.store.InMemoryPreferenceStore;
import com.mailmind.store.PreferenceStore;
import com.mailmind.store.jdbc.JdbcClassificationLog;
import com.mailmind.store.jdbc.JdbcPreferenceStore;
import com.mailmind.triage.TriageService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * Spring Boot auto-configuration for MailMind.
 */
@Configuration
@ConditionalOnProperty(prefix = "mailmind", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(MailMindProperties.class)
public class MailMindAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MailMindAutoConfiguration.class);

    private InferencePool inferencePool;
    private BatchDispatcher<String, String> batchDispatcher;
    private PriorityClassifier priorityClassifier;

    @Bean
    @ConditionalOnMissingBean
    public MailMindConfig mailMindConfig(MailMindProperties properties) {
        log.info("Loading MailMind configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public InferenceBackend inferenceBackend(MailMindConfig config) {
        BackendConfig backend = config.backend();
        log.info("Creating Ollama backend: {}", backend.baseUrl());
        return new OllamaInferenceBackend(backend.baseUrl(),
                Duration.ofSeconds(backend.connectTimeoutSeconds()),
                Duration.ofSeconds(backend.requestTimeoutSeconds()));
    }

    @Bean
    @ConditionalOnMissingBean
    public InferencePool inferencePool(MailMindConfig config, InferenceBackend backend) {
        log.info("Creating InferencePool: {} (size {})", config.name(), config.pool().size());
        DefaultInferencePool pool = new DefaultInferencePool(backend, config.pool().size());
        if (config.pool().initializeOnStartup()) {
            pool.initialize();
        }
        this.inferencePool = pool;
        return pool;
    }

    @Bean
    @ConditionalOnMissingBean
    public ModelSelector modelSelector(MailMindConfig config) {
        return new ModelSelector(config.backend().primaryModel(), config.backend().fallbackModel());
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchDispatcher<String, String> batchDispatcher(MailMindConfig config, InferencePool pool,
                                                           ModelSelector modelSelector) {
        String model = selectModel(config, pool, modelSelector);
        log.info("Creating BatchDispatcher with model {}", model);
        this.batchDispatcher = new DefaultBatchDispatcher<>(pool,
                new GenerateItemProcessor(model, config.backend().generateOptions()),
                config.dispatcher().threadNamePrefix());
        return this.batchDispatcher;
    }

    /**
     * Verifies the model against the backend when the pool is already connected,
     * otherwise trusts the configured primary model.
     */
    private static String selectModel(MailMindConfig config, InferencePool pool, ModelSelector modelSelector) {
        if (!pool.healthCheck()) {
            return config.backend().primaryModel();
        }
        try (PooledClient lease = pool.acquire(Duration.ofSeconds(config.pool().acquireTimeoutSeconds()))) {
            return modelSelector.select(lease.client());
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public PreferenceStore preferenceStore(MailMindProperties properties, ObjectProvider<DataSource> dataSource) {
        if (properties.getStoreType() == MailMindProperties.StoreType.JDBC) {
            JdbcPreferenceStore store = new JdbcPreferenceStore(requireDataSource(dataSource));
            store.createSchema();
            return store;
        }
        return new InMemoryPreferenceStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public ClassificationLog classificationLog(MailMindProperties properties, ObjectProvider<DataSource> dataSource) {
        if (properties.getStoreType() == MailMindProperties.StoreType.JDBC) {
            JdbcClassificationLog classificationLog = new JdbcClassificationLog(requireDataSource(dataSource));
            classificationLog.createSchema();
            return classificationLog;
        }
        return new InMemoryClassificationLog();
    }

    private static DataSource requireDataSource(ObjectProvider<DataSource> dataSource) {
        DataSource available = dataSource.getIfAvailable();
        if (available == null) {
            throw new ConfigurationException("mailmind.store-type=jdbc requires a DataSource bean");
        }
        return available;
    }

    @Bean
    @ConditionalOnMissingBean
    public PriorityClassifier priorityClassifier(MailMindConfig config, PreferenceStore preferenceStore,
                                                 ClassificationLog classificationLog) {
        log.info("Creating PriorityClassifier");
        this.priorityClassifier = new DefaultPriorityClassifier(preferenceStore, classificationLog,
                config.classifier());
        return this.priorityClassifier;
    }

    @Bean
    @ConditionalOnMissingBean
    public TriageService triageService(MailMindConfig config, BatchDispatcher<String, String> batchDispatcher,
                                       PriorityClassifier priorityClassifier) {
        return new TriageService(batchDispatcher, priorityClassifier, config.dispatcher().itemTimeout());
    }

    @PreDestroy
    public void shutdown() {
        if (batchDispatcher != null && !batchDispatcher.isShutdown()) {
            log.info("Shutting down BatchDispatcher");
            batchDispatcher.shutdown();
        }
        if (priorityClassifier != null) {
            priorityClassifier.close();
        }
        if (inferencePool != null) {
            log.info("Closing InferencePool");
            inferencePool.close();
        }
    }
}
