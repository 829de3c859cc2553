package com.eyelevel.invoiceingestion.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("Invoice Ingestion Operations API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Operational endpoints for the invoice ingestion pipeline.

                                * **Scans:** Trigger a scan of the configured drop folder outside the polling schedule.
                                * **Queues:** Inspect per-queue waiting, active, delayed and failed counts.
                                * **Dead letters:** Browse jobs that exhausted their retries, for manual replay.
                                * **Import batches:** Cancel an in-flight multi-file import.
                                * **Templates:** Mark an extraction template as the default for its type.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
