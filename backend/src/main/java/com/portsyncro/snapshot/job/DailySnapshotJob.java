package com.portsyncro.snapshot.job;

import com.portsyncro.domain.Portfolio;
import com.portsyncro.domain.PortfolioRepository;
import com.portsyncro.snapshot.SnapshotService;
import com.portsyncro.snapshot.config.SnapshotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * End-of-day capture for every stored portfolio. One failing portfolio does not stop the others.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DailySnapshotJob {

    private final PortfolioRepository portfolioRepository;
    private final SnapshotService snapshotService;
    private final SnapshotProperties snapshotProperties;

    @Scheduled(cron = "${portsyncro.snapshot.daily-cron:0 55 23 * * *}", zone = "${portsyncro.time-zone:Asia/Jakarta}")
    public void runScheduled() {
        if (!snapshotProperties.isDailyEnabled()) {
            return;
        }
        int captured = 0;
        int failed = 0;
        for (Portfolio portfolio : portfolioRepository.findAll()) {
            try {
                snapshotService.capture(portfolio.getUserId());
                captured++;
            } catch (RuntimeException e) {
                failed++;
                log.warn("Daily snapshot failed for {}", portfolio.getUserId(), e);
            }
        }
        log.info("Daily snapshot run: {} captured, {} failed", captured, failed);
    }
}
