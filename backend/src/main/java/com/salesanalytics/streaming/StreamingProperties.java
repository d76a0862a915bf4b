package com.salesanalytics.streaming;

import com.salesanalytics.security.Role;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

/**
 * Tuning knobs for live sentiment streams, bound from {@code app.streaming.*}.
 */
@Data
@ConfigurationProperties(prefix = "app.streaming")
public class StreamingProperties {

    /**
     * Interval between two samples of one call; the first sample follows one interval after the first subscriber.
     */
    private Duration tickInterval = Duration.ofSeconds(2);

    /**
     * Number of most recent samples retained per call.
     */
    private int historySize = 100;

    private int maxSessionsPerCall = 50;

    private int maxSessionsPerIdentity = 5;

    /**
     * How long a call without subscribers keeps its loop before stopping. Zero stops immediately.
     */
    private Duration stopGracePeriod = Duration.ofSeconds(5);

    private int maxConsecutiveFailures = 3;

    private Set<Role> allowedRoles = EnumSet.allOf(Role.class);

    private int schedulerPoolSize = 4;

    /**
     * Upper bound on a single outbound WebSocket send before the session is dropped.
     */
    private Duration sendTimeLimit = Duration.ofSeconds(10);

    private int sendBufferLimit = 512 * 1024;
}
