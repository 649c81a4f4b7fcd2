package co.fanki.qualityhub.config;

import co.fanki.qualityhub.attachment.domain.StorageProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and readiness checks.
 *
 * <p>{@code /ready} answers 503 until both the database and the attachment
 * storage are usable.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
public class HealthCheckController {

    private static final Logger LOG = LoggerFactory.getLogger(
            HealthCheckController.class);

    private final DataSource dataSource;
    private final StorageProvider storageProvider;

    /**
     * Creates a new HealthCheckController.
     *
     * @param theDataSource the data source for database connectivity checks
     * @param theStorageProvider the attachment storage
     */
    public HealthCheckController(final DataSource theDataSource,
            final StorageProvider theStorageProvider) {
        this.dataSource = theDataSource;
        this.storageProvider = theStorageProvider;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Readiness check endpoint.
     *
     * @return status map with one entry per dependency
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        final boolean databaseHealthy = checkDatabaseHealth();
        final boolean storageHealthy = storageProvider.isAvailable();

        final Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", databaseHealthy && storageHealthy
                ? "ready" : "not_ready");
        status.put("database", databaseHealthy ? "connected" : "disconnected");
        status.put("storage", storageHealthy ? "available" : "unavailable");

        if (databaseHealthy && storageHealthy) {
            return ResponseEntity.ok(status);
        }
        return ResponseEntity.status(503).body(status);
    }

    private boolean checkDatabaseHealth() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(5);
        } catch (final SQLException e) {
            LOG.warn("Database readiness check failed: {}", e.getMessage());
            return false;
        }
    }

}
