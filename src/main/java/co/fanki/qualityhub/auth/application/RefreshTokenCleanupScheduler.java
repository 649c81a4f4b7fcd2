package co.fanki.qualityhub.auth.application;

import co.fanki.qualityhub.auth.domain.RefreshTokenRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Scheduled component that purges expired refresh token records.
 *
 * <p>Opt-in via {@code auth.token-cleanup.enabled=true}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(
        name = "auth.token-cleanup.enabled",
        havingValue = "true",
        matchIfMissing = false)
public class RefreshTokenCleanupScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(
            RefreshTokenCleanupScheduler.class);

    private final RefreshTokenRepository refreshTokenRepository;

    /**
     * Creates a new RefreshTokenCleanupScheduler.
     *
     * @param theRefreshTokenRepository the refresh token repository
     */
    public RefreshTokenCleanupScheduler(
            final RefreshTokenRepository theRefreshTokenRepository) {
        this.refreshTokenRepository = theRefreshTokenRepository;
    }

    /** Deletes every refresh token whose expiry has passed. */
    @Scheduled(cron = "${auth.token-cleanup.cron:0 0 3 * * *}")
    public void purgeExpiredTokens() {
        LOG.info("Starting expired refresh token cleanup");
        try {
            final int deleted = refreshTokenRepository.deleteExpired(
                    Instant.now());
            LOG.info("Refresh token cleanup complete. Deleted: {}", deleted);
        } catch (final RuntimeException e) {
            LOG.error("Refresh token cleanup failed: {}", e.getMessage(), e);
        }
    }

}
