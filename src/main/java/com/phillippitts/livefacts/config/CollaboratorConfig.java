package com.phillippitts.livefacts.config;

import com.phillippitts.livefacts.service.content.ContentGenerator;
import com.phillippitts.livefacts.service.content.UnconfiguredContentGenerator;
import com.phillippitts.livefacts.service.delivery.DeliveryChannel;
import com.phillippitts.livefacts.service.delivery.LoggingDeliveryChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback collaborators for a deployment without a content provider or transport.
 *
 * <p>A real {@link ContentGenerator} or {@link DeliveryChannel} bean replaces these.
 * Without one, every cycle delivers a placeholder and every message goes to the log.
 */
@Configuration
public class CollaboratorConfig {

    private static final Logger LOG = LogManager.getLogger(CollaboratorConfig.class);

    @Bean
    @ConditionalOnMissingBean(ContentGenerator.class)
    public ContentGenerator contentGenerator() {
        LOG.warn("No ContentGenerator configured; deliveries will be placeholders");
        return new UnconfiguredContentGenerator();
    }

    @Bean
    @ConditionalOnMissingBean(DeliveryChannel.class)
    public DeliveryChannel deliveryChannel() {
        LOG.warn("No DeliveryChannel configured; outgoing messages are only logged");
        return new LoggingDeliveryChannel();
    }
}
