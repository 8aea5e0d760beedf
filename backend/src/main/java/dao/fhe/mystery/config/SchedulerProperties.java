package dao.fhe.mystery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    private RelayConfig relay = new RelayConfig();
    private SettlementConfig settlement = new SettlementConfig();

    @Data
    public static class RelayConfig {
        /**
         * Enable/disable the local oracle relay (request messages -> signed reply messages).
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to drain pending request messages (in milliseconds)
         * Default: 2000ms
         */
        private long checkIntervalMs = 2000;
    }

    @Data
    public static class SettlementConfig {
        /**
         * Enable/disable automatic settlement of reply messages.
         * Default: true
         */
        private boolean enabled = true;

        /**
         * How often to drain pending reply messages (in milliseconds)
         * Default: 1000ms
         */
        private long checkIntervalMs = 1000;

        /**
         * Max number of replies settled per tick.
         * Default: 50
         */
        private int maxPerTick = 50;
    }
}
