package recurrent.spi;

import recurrent.model.JobInvocation;

/**
 * Serializes the invocation descriptor stored in a recurring job's {@code Job} field.
 *
 * @see recurrent.schedule.JsonJobPayloadCodec
 */
public interface JobPayloadCodec {

    String serialize(JobInvocation job);

    /**
     * @throws IllegalArgumentException if the payload is malformed
     */
    JobInvocation deserialize(String payload);
}
