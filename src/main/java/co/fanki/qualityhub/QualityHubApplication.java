package co.fanki.qualityhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * QualityHub Application.
 *
 * <p>Main entry point of the QualityHub API: multi-tenant management of
 * test suites, cases, plans, runs and requirements, with reports and AI
 * assisted test design.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
@EnableScheduling
public class QualityHubApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(QualityHubApplication.class, args);
    }

}
