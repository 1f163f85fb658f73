package com.phillippitts.livefacts.service.tracking;

import com.phillippitts.livefacts.config.properties.TrackingProperties;
import com.phillippitts.livefacts.service.content.ContentParser;
import com.phillippitts.livefacts.service.content.GenerationService;
import com.phillippitts.livefacts.service.delivery.DeliveryChannel;
import com.phillippitts.livefacts.service.delivery.FactMessageFormatter;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Builds the two background tasks of a session from the shared collaborators.
 */
@Component
public class SessionTaskFactory {

    private final TrackingProperties props;
    private final GenerationService generation;
    private final ContentParser parser;
    private final FactMessageFormatter formatter;
    private final DeliveryChannel channel;
    private final SessionNotifier notifier;
    private final ApplicationEventPublisher publisher;

    public SessionTaskFactory(TrackingProperties props,
                              GenerationService generation,
                              ContentParser parser,
                              FactMessageFormatter formatter,
                              DeliveryChannel channel,
                              SessionNotifier notifier,
                              ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.generation = Objects.requireNonNull(generation, "generation");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    DeliveryLoop deliveryLoop(SessionState state) {
        return new DeliveryLoop(state, props, generation, parser, formatter, channel, notifier, publisher);
    }

    HealthMonitor healthMonitor(SessionState state) {
        return new HealthMonitor(state, props, notifier);
    }
}
