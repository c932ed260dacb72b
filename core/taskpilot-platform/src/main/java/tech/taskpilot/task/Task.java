package tech.taskpilot.task;

import java.time.Instant;

/**
 * A to-do item owned by exactly one user.
 *
 * <p>Calendar fields are set together by scheduling, or not at all.
 */
public class Task {

    public static final int DEFAULT_PRIORITY = 3;
    public static final String DEFAULT_TIME_ESTIMATE = "1hr";

    public long id;

    public String userId;

    public String title;

    public String project;

    /** 1 (lowest) to 5 (highest). */
    public int priority = DEFAULT_PRIORITY;

    public Energy energy = Energy.MEDIUM;

    public String timeEstimate = DEFAULT_TIME_ESTIMATE;

    public String notes;

    public Instant dueDate;

    public boolean completed;

    public Instant completedAt;

    public Instant createdAt;

    public Instant updatedAt;

    // Calendar linkage

    public String calendarEventId;

    public String calendarEventUrl;

    public Instant scheduledStart;

    /** Minutes. */
    public Integer scheduledDuration;
}
