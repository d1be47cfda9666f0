package com.workoutapi.refresh.scheduler;

import com.workoutapi.refresh.exception.RefreshInProgressException;
import com.workoutapi.refresh.service.ExerciseRefreshService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "refresh.schedule.enabled", havingValue = "true", matchIfMissing = true)
public class RefreshScheduler {

    private final ExerciseRefreshService refreshService;

    /**
     * Refresh every exercise on the configured cron (hourly by default)
     */
    @Scheduled(cron = "${refresh.schedule.cron:0 0 * * * *}", zone = "UTC")
    public void scheduledRefresh() {
        log.info("⏰ Triggering scheduled exercise refresh...");
        try {
            refreshService.refreshAll();
        } catch (RefreshInProgressException e) {
            log.info("⏭️ Previous refresh still running, skipping this tick");
        } catch (Exception e) {
            log.error("💥 Scheduled refresh could not run", e);
        }
    }

}
