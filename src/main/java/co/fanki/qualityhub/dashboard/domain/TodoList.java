package co.fanki.qualityhub.dashboard.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Work waiting in a project, most urgent first.
 *
 * @param totalItems number of items
 * @param urgentCount critical and high priority items
 * @param items the items
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record TodoList(
        int totalItems,
        long urgentCount,
        List<TodoItem> items
) {

    /** Priority first, then earliest due date; items without one go last. */
    public static final Comparator<TodoItem> URGENCY = Comparator
            .comparing(TodoItem::priority)
            .thenComparing(TodoItem::dueDate,
                    Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * Sorts the items by urgency and counts the urgent ones.
     *
     * @param items the unsorted items, not modified
     * @return the list
     */
    public static TodoList of(final List<TodoItem> items) {
        final List<TodoItem> sorted = items.stream()
                .sorted(URGENCY)
                .toList();
        final long urgent = sorted.stream()
                .filter(item -> item.priority().isUrgent())
                .count();
        return new TodoList(sorted.size(), urgent, sorted);
    }

    /**
     * One thing to do.
     *
     * @param id unique within the list
     * @param type the kind of item
     * @param title run or milestone name, or a fixed label
     * @param description what is pending
     * @param priority how urgent it is
     * @param dueDate the milestone due date, may be null
     * @param entityId the run, milestone or project ID
     * @param progress run progress, may be null
     * @param remainingCount results or tests pending, may be null
     */
    public record TodoItem(
            String id,
            TodoItemType type,
            String title,
            String description,
            TodoPriority priority,
            Instant dueDate,
            String entityId,
            Integer progress,
            Long remainingCount
    ) {}

    public enum TodoItemType {

        ASSIGNED_TEST_RUN("assigned_test_run"),
        OVERDUE_MILESTONE("overdue_milestone"),
        UPCOMING_MILESTONE("upcoming_milestone"),
        BLOCKED_TEST("blocked_test"),
        FAILED_TEST_REVIEW("failed_test_review");

        private final String value;

        TodoItemType(final String theValue) {
            this.value = theValue;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

    /** Declared from most to least urgent; the order is the sort order. */
    public enum TodoPriority {

        CRITICAL("critical"),
        HIGH("high"),
        MEDIUM("medium"),
        LOW("low");

        private final String value;

        TodoPriority(final String theValue) {
            this.value = theValue;
        }

        public boolean isUrgent() {
            return this == CRITICAL || this == HIGH;
        }

        @JsonValue
        public String value() {
            return value;
        }
    }

}
