package io.kudos;

import java.util.Objects;

/**
 * Outcome of {@link ScheduleValidator#validate}: either a ready-to-store draft or the reason
 * the request was rejected.
 */
public sealed interface ValidationResult permits ValidationResult.Valid, ValidationResult.Invalid {

    static Valid valid(ScheduleDraft draft) {
        return new Valid(draft);
    }

    static Invalid invalid(String reason) {
        return new Invalid(reason);
    }

    /**
     * Whether the request passed validation.
     */
    boolean isValid();

    /**
     * Request accepted; {@code draft.nextRun()} holds the first occurrence.
     *
     * @param draft the draft to pass to {@link io.kudos.spi.ScheduleStore#createSchedule}
     */
    record Valid(ScheduleDraft draft) implements ValidationResult {
        public Valid {
            Objects.requireNonNull(draft, "draft");
        }

        @Override
        public boolean isValid() {
            return true;
        }
    }

    /**
     * Request rejected.
     *
     * @param reason human-readable reason, safe to return to the caller
     */
    record Invalid(String reason) implements ValidationResult {
        public Invalid {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isValid() {
            return false;
        }
    }
}
