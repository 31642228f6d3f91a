package io.github.riemr.trainer.optimization.constraint;

/**
 * Closed set of reasons a request can be declined, each with its message template.
 */
public enum RejectionKind {
    NO_TIME_SPECIFIED("Request has no start/end time specified"),
    NO_PREFERRED_DATE("Request lists preferred times but no preferred start date"),
    WINDOW_TOO_SHORT("Preferred time window %s is shorter than the requested duration (%d minutes)"),
    NO_ACCEPTABLE_TIME("No preferred time satisfies the client's availability constraints"),
    DAY_OFF("Requested day (%s) is marked as a day off in your preferences"),
    OUTSIDE_WORK_HOURS("Requested time %s is outside work hours (%s - %s)"),
    DAILY_LIMIT("Maximum sessions per day limit reached (%d sessions) for %s"),
    CONFLICT_EXISTING_BOOKING("Direct time conflict with existing booking at %s - %s"),
    CONFLICT_APPROVED_REQUEST("Direct time conflict with other approved request at %s - %s"),
    BREAK_BEFORE("Insufficient break time (%d minutes required) before existing session ending at %s"),
    BREAK_AFTER("Insufficient break time (%d minutes required) after existing session starting at %s"),
    NO_AVAILABLE_SLOT("No available time slot covers %s - %s"),
    RESULT_LIMIT_REACHED("Schedule entry limit reached (%d entries)");

    private final String template;

    RejectionKind(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
