package com.workoutapi.refresh;

import com.workoutapi.refresh.model.RefreshRun;
import com.workoutapi.refresh.service.ExerciseRefreshService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * One-shot mode: runs a single batch at startup and reports its exit status
 * (0 if no exercise failed, 1 otherwise) through {@link ExitCodeGenerator}.
 * {@link RefreshApplication} then exits the JVM.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "refresh.run-once", havingValue = "true")
public class RefreshRunner implements ApplicationRunner, ExitCodeGenerator {

    private final ExerciseRefreshService refreshService;

    private volatile int exitCode = 1;

    @Override
    public void run(ApplicationArguments args) {
        RefreshRun run = refreshService.refreshAll();
        exitCode = run.getExitStatus();
        log.info("🚪 One-shot refresh finished with exit status {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
