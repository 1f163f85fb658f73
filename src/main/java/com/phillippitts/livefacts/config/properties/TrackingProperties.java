package com.phillippitts.livefacts.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Locale;

/**
 * Pacing and health policy for live-location tracking sessions.
 *
 * <p>Properties (prefix {@code tracking}):
 * <ul>
 *   <li>{@code latency-estimate} - expected generation latency subtracted from the first wait (default: 180s)</li>
 *   <li>{@code min-initial-wait} - lower bound of the first wait (default: 30s)</li>
 *   <li>{@code floor-sleep} - lower bound of the wait between two cycles (default: 15s)</li>
 *   <li>{@code silence-threshold} - position silence after which a session is considered abandoned (default: 3m)</li>
 *   <li>{@code health-poll-interval} - how often the health monitor checks a session (default: 30s)</li>
 *   <li>{@code generation-timeout} - upper bound of one generation call (default: 120s)</li>
 *   <li>{@code stop-timeout} - how long {@code stop} waits for a cancelled task to settle (default: 10s)</li>
 *   <li>{@code history-limit} - maximum retained history entries (default: 10)</li>
 *   <li>{@code exclusion-window} - history entries passed to the generator (default: 5)</li>
 *   <li>{@code default-locale} - language of user-facing messages when none is given (default: en)</li>
 *   <li>{@code immediate-first-delivery} - deliver one fact as soon as tracking begins (default: true)</li>
 * </ul>
 *
 * <p>The silence threshold and poll interval trade false stop detection against
 * responsiveness; tune them together.
 */
@ConfigurationProperties(prefix = "tracking")
@Validated
public class TrackingProperties {

    @NotNull
    @DurationMin(seconds = 0)
    private Duration latencyEstimate = Duration.ofSeconds(180);

    @NotNull
    @DurationMin(millis = 1)
    private Duration minInitialWait = Duration.ofSeconds(30);

    @NotNull
    @DurationMin(millis = 1)
    private Duration floorSleep = Duration.ofSeconds(15);

    @NotNull
    @DurationMin(millis = 1)
    private Duration silenceThreshold = Duration.ofMinutes(3);

    @NotNull
    @DurationMin(millis = 1)
    private Duration healthPollInterval = Duration.ofSeconds(30);

    @NotNull
    @DurationMin(millis = 1)
    private Duration generationTimeout = Duration.ofSeconds(120);

    @NotNull
    @DurationMin(millis = 1)
    private Duration stopTimeout = Duration.ofSeconds(10);

    @Positive(message = "History limit must be positive")
    @Max(value = 10, message = "History limit must not exceed 10")
    private int historyLimit = 10;

    @Positive(message = "Exclusion window must be positive")
    private int exclusionWindow = 5;

    @NotBlank
    private String defaultLocale = "en";

    private boolean immediateFirstDelivery = true;

    public Duration getLatencyEstimate() {
        return latencyEstimate;
    }

    public void setLatencyEstimate(Duration latencyEstimate) {
        this.latencyEstimate = latencyEstimate;
    }

    public Duration getMinInitialWait() {
        return minInitialWait;
    }

    public void setMinInitialWait(Duration minInitialWait) {
        this.minInitialWait = minInitialWait;
    }

    public Duration getFloorSleep() {
        return floorSleep;
    }

    public void setFloorSleep(Duration floorSleep) {
        this.floorSleep = floorSleep;
    }

    public Duration getSilenceThreshold() {
        return silenceThreshold;
    }

    public void setSilenceThreshold(Duration silenceThreshold) {
        this.silenceThreshold = silenceThreshold;
    }

    public Duration getHealthPollInterval() {
        return healthPollInterval;
    }

    public void setHealthPollInterval(Duration healthPollInterval) {
        this.healthPollInterval = healthPollInterval;
    }

    public Duration getGenerationTimeout() {
        return generationTimeout;
    }

    public void setGenerationTimeout(Duration generationTimeout) {
        this.generationTimeout = generationTimeout;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public void setStopTimeout(Duration stopTimeout) {
        this.stopTimeout = stopTimeout;
    }

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = historyLimit;
    }

    public int getExclusionWindow() {
        return exclusionWindow;
    }

    public void setExclusionWindow(int exclusionWindow) {
        this.exclusionWindow = exclusionWindow;
    }

    public String getDefaultLocale() {
        return defaultLocale;
    }

    public void setDefaultLocale(String defaultLocale) {
        this.defaultLocale = defaultLocale;
    }

    /** Parsed form of {@link #getDefaultLocale()}. */
    public Locale defaultLocale() {
        return Locale.forLanguageTag(defaultLocale);
    }

    public boolean isImmediateFirstDelivery() {
        return immediateFirstDelivery;
    }

    public void setImmediateFirstDelivery(boolean immediateFirstDelivery) {
        this.immediateFirstDelivery = immediateFirstDelivery;
    }
}
