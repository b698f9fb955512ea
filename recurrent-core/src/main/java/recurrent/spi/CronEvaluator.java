package recurrent.spi;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Evaluates cron expressions.
 *
 * <p>Expressions passed in always have six fields, seconds first;
 * {@link recurrent.schedule.CronSyntax} converts the five-field form before
 * evaluation.
 *
 * @see recurrent.spring.SpringCronEvaluator
 */
@FunctionalInterface
public interface CronEvaluator {

    /**
     * Returns the first occurrence strictly after {@code from}, evaluated in {@code zone}.
     *
     * @param cronExpression six-field cron expression
     * @param from           search origin (exclusive)
     * @param zone           time zone the expression is evaluated in
     * @return the next occurrence, or empty if the expression never fires again
     * @throws recurrent.schedule.CronFormatException if the expression cannot be parsed
     */
    Optional<Instant> nextOccurrence(String cronExpression, Instant from, ZoneId zone);
}
