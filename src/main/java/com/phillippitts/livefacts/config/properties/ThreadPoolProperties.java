package com.phillippitts.livefacts.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>The session pool runs two long-lived tasks per tracked user (delivery loop and health
 * monitor), so its maximum size caps the number of concurrent sessions at half that value.
 * The generation pool runs the bounded-timeout content generation calls.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private SessionPoolProperties session = new SessionPoolProperties();
    @Valid
    private GenerationPoolProperties generation = new GenerationPoolProperties();

    public SessionPoolProperties getSession() {
        return session;
    }

    public void setSession(SessionPoolProperties session) {
        this.session = session;
    }

    public GenerationPoolProperties getGeneration() {
        return generation;
    }

    public void setGeneration(GenerationPoolProperties generation) {
        this.generation = generation;
    }

    /**
     * Session executor pool configuration. Tasks never queue: a full pool rejects the
     * submission and the session start fails.
     */
    public static class SessionPoolProperties {
        @Positive
        private int corePoolSize = 8;
        @Positive
        private int maxPoolSize = 512;
        @Min(1)
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "session-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Generation executor pool configuration.
     */
    public static class GenerationPoolProperties {
        @Positive
        private int corePoolSize = 4;
        @Positive
        private int maxPoolSize = 16;
        @Min(0)
        private int queueCapacity = 100;
        @Min(1)
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "generation-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
