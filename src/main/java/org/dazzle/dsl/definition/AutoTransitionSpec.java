package org.dazzle.dsl.definition;

import java.time.Duration;
import java.util.Objects;

/**
 * Time-based trigger of a transition: {@code auto after 7 days [or manual]}.
 *
 * @param delayValue  The delay amount
 * @param delayUnit   The delay unit
 * @param allowManual Whether a manual transition may pre-empt the timer
 */
public record AutoTransitionSpec(int delayValue, DelayUnit delayUnit, boolean allowManual) {

    public AutoTransitionSpec {
        Objects.requireNonNull(delayUnit, "Delay unit cannot be null");
        if (delayValue < 0) {
            throw new IllegalArgumentException("Delay cannot be negative: " + delayValue);
        }
    }

    public enum DelayUnit {
        MINUTES,
        HOURS,
        DAYS;

        public static DelayUnit fromDsl(String word) {
            return switch (word) {
                case "minute", "minutes" -> MINUTES;
                case "hour", "hours" -> HOURS;
                case "day", "days" -> DAYS;
                default -> null;
            };
        }
    }

    public Duration delay() {
        return switch (delayUnit) {
            case MINUTES -> Duration.ofMinutes(delayValue);
            case HOURS -> Duration.ofHours(delayValue);
            case DAYS -> Duration.ofDays(delayValue);
        };
    }
}
