package recurrent.spi;

import recurrent.schedule.RecurringJobDefinition;

import java.time.Instant;

/**
 * Creates a background job instance for a due firing of a recurring job.
 */
@FunctionalInterface
public interface JobTrigger {

    /**
     * @param definition the recurring definition being fired
     * @param firedAt    the due instant
     * @return the created job id, recorded as the definition's last job id
     */
    String trigger(RecurringJobDefinition definition, Instant firedAt);
}
