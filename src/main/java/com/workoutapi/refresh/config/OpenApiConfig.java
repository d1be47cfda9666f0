package com.workoutapi.refresh.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

        @Bean
        public OpenAPI refreshWorkerOpenAPI() {
                return new OpenAPI()
                                .info(new Info()
                                                .title("Exercise Refresh Worker")
                                                .description(
                                                                "### Exercise Refresh Worker\n\n" +
                                                                                "Re-validates every exercise exposed by the Workout API. "
                                                                                +
                                                                                "Runs are bounded in concurrency, retried with exponential backoff and made idempotent per exercise per UTC day through Redis.\n\n"
                                                                                +
                                                                                "#### Admin operations:\n" +
                                                                                "- **Refresh**: trigger a full batch and receive the per-exercise results and run summary.\n"
                                                                                +
                                                                                "- **Idempotency stats**: inspect which store backs the run and how many keys it holds.\n")
                                                .version("v1.0.0")
                                                .license(new License()
                                                                .name("Apache 2.0")
                                                                .url("http://springdoc.org")))
                                .servers(List.of(
                                                new Server().url("http://localhost:8002")
                                                                .description("Local Development (HTTP)")));
        }
}
