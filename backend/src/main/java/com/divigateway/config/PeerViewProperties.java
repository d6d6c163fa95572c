package com.divigateway.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Filtered peer list: cache lifetime and filter thresholds.
 */
@ConfigurationProperties(prefix = "divi.peers")
@NoArgsConstructor
@Getter
@Setter
public class PeerViewProperties {

    private Duration cacheTtl = Duration.ofHours(5);

    /** Lowest client version kept; compared as a plain string. */
    private String minimumVersion = "DIVI Core: 3.0.0.0";

    /** Peers whose starting height is more than this many blocks behind the tip are dropped. */
    private long heightWindow = 1_000;
}
