package com.mailmind.config;

/**
 * Root configuration for MailMind core.
 *
 * @param name       Instance name used in logs
 * @param backend    Inference backend configuration
 * @param pool       Inference pool configuration
 * @param dispatcher Batch dispatcher configuration
 * @param classifier Priority classifier configuration
 */
public record MailMindConfig(
        String name,
        BackendConfig backend,
        PoolConfig pool,
        DispatcherConfig dispatcher,
        ClassifierConfig classifier
) {
    /**
     * Configuration with every section at its defaults.
     */
    public static MailMindConfig defaults() {
        return new MailMindConfig(
                "mailmind",
                BackendConfig.defaults(),
                PoolConfig.defaults(),
                DispatcherConfig.defaults(),
                ClassifierConfig.defaults()
        );
    }
}
