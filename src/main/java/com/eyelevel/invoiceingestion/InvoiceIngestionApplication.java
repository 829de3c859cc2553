package com.eyelevel.invoiceingestion;

import com.eyelevel.invoiceingestion.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Invoice Ingestion Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app.ingestion" properties to
 *     {@link IngestionProperties}.</li>
 *     <li>{@link EnableScheduling}: Activates the source polling, stall detection, health and heartbeat loops.</li>
 *     <li>{@link EnableRetry}: Enables in-process retries of remote (FTP/SFTP) transfer operations.</li>
 *     <li>{@link EnableJpaRepositories}: Configures the base package for scanning Spring Data JPA repositories.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.invoiceingestion.repository")
@EnableConfigurationProperties(value = IngestionProperties.class)
@EnableRetry
public class InvoiceIngestionApplication {

    /**
     * Launches the application and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("Starting InvoiceIngestionApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(InvoiceIngestionApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "InvoiceIngestion"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Source:     {} (enabled: {})", env.getProperty("app.ingestion.source.kind", "LOCAL"),
                 env.getProperty("app.ingestion.source.enabled", "false"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
