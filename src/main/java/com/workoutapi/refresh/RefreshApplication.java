package com.workoutapi.refresh;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.context.ConfigurableApplicationContext;

// Redis is connected per run by the refresh session, never as an app-wide bean
@SpringBootApplication(exclude = RedisAutoConfiguration.class)
public class RefreshApplication {

	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(RefreshApplication.class);
		application.addListeners(new RunOnceModeListener());
		ConfigurableApplicationContext context = application.run(args);

		// One-shot mode: RefreshRunner already ran the batch, exit with its status
		if (context.getEnvironment().getProperty("refresh.run-once", Boolean.class, false)) {
			System.exit(SpringApplication.exit(context));
		}
	}

}
