package com.geodash.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables for finish arbitration, progression and health sync.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "geodash")
public class GeodashRuntimeProperties {

    private Finish finish = new Finish();
    private Progression progression = new Progression();
    private Sync sync = new Sync();

    @Getter
    @Setter
    public static class Finish {
        /**
         * Grace period after a provisional finish during which the winner may still change.
         */
        private long confirmationWindowMs = 90_000;
    }

    @Getter
    @Setter
    public static class Progression {
        private int xpPerKm = 10;
    }

    @Getter
    @Setter
    public static class Sync {
        private int maxBatchSize = 60;
    }
}
