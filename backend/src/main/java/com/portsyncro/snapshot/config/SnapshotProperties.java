package com.portsyncro.snapshot.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Daily snapshot capture. Under portsyncro.snapshot.
 */
@ConfigurationProperties(prefix = "portsyncro.snapshot")
@Getter
@Setter
public class SnapshotProperties {

    /** When false the daily job does nothing; on-demand capture still works. */
    private boolean dailyEnabled = true;

    /** Cron of the daily capture, evaluated in portsyncro.time-zone. */
    private String dailyCron = "0 55 23 * * *";
}
