package com.phillippitts.livefacts.service.delivery;

import com.phillippitts.livefacts.domain.Coordinates;
import com.phillippitts.livefacts.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Channel used when no transport is configured. Writes every outgoing message to the log.
 */
public class LoggingDeliveryChannel implements DeliveryChannel {

    private static final Logger LOG = LogManager.getLogger(LoggingDeliveryChannel.class);
    private static final int PREVIEW_CHARS = 120;

    @Override
    public void deliver(String destinationId, String text) {
        LOG.info("deliver destination={} text='{}'", destinationId, LogSanitizer.truncate(text, PREVIEW_CHARS));
    }

    @Override
    public void deliverVenue(String destinationId, String title, String address, Coordinates coordinates) {
        LOG.info("venue destination={} title='{}' at {}", destinationId,
                LogSanitizer.truncate(title, PREVIEW_CHARS), LogSanitizer.coarse(coordinates));
    }

    @Override
    public void notify(String destinationId, NotificationKind kind, String text) {
        LOG.info("notify destination={} kind={}", destinationId, kind);
    }
}
