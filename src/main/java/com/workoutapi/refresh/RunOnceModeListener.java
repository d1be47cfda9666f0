package com.workoutapi.refresh;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.Map;

/**
 * When {@code refresh.run-once=true}, turns the process into a plain batch job:
 * no embedded web server and no hourly schedule competing with the startup run.
 * The overrides take precedence over every other property source.
 */
@Slf4j
public class RunOnceModeListener implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

    static final String PROPERTY_SOURCE_NAME = "refreshRunOnceOverrides";

    static final Map<String, Object> OVERRIDES = Map.of(
            "spring.main.web-application-type", "none",
            "refresh.schedule.enabled", "false");

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
        ConfigurableEnvironment environment = event.getEnvironment();
        if (!environment.getProperty("refresh.run-once", Boolean.class, false)) {
            return;
        }
        environment.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, OVERRIDES));
        log.info("🚪 One-shot mode: web server and scheduler disabled");
    }
}
