package co.fanki.qualityhub.dashboard.domain;

import co.fanki.qualityhub.run.domain.TestResultStatus;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.List;

/**
 * What happened lately in a project: executions, runs started or finished
 * and milestones completed, newest first.
 *
 * @param totalToday events since the start of the UTC day
 * @param testsExecutedToday results executed today
 * @param passedToday results passed today
 * @param failedToday results failed today
 * @param recentActivity the latest events
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ActivityFeed(
        long totalToday,
        long testsExecutedToday,
        long passedToday,
        long failedToday,
        List<ActivityItem> recentActivity
) {

    /** Actor of events no user triggered. */
    public static final String SYSTEM_USER = "system";

    /**
     * One event of the feed.
     *
     * @param id unique within the feed
     * @param type the kind of event
     * @param title case, run or milestone name
     * @param status the result status, only for executions
     * @param userId who caused it, {@link #SYSTEM_USER} when nobody did
     * @param userName the user's name, when known
     * @param timestamp when it happened
     * @param entityId the case, run or milestone ID
     * @param testRunId the run, only for executions
     */
    public record ActivityItem(
            String id,
            ActivityType type,
            String title,
            TestResultStatus status,
            String userId,
            String userName,
            Instant timestamp,
            String entityId,
            String testRunId
    ) {}

    public enum ActivityType {

        TEST_EXECUTION("test_execution"),
        TEST_RUN_STARTED("test_run_started"),
        TEST_RUN_COMPLETED("test_run_completed"),
        MILESTONE_COMPLETED("milestone_completed");

        private final String value;

        ActivityType(final String theValue) {
            this.value = theValue;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

}
