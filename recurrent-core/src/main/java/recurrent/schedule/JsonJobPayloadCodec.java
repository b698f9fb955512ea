package recurrent.schedule;

import recurrent.model.JobInvocation;
import recurrent.spi.JobPayloadCodec;
import recurrent.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Stores a {@link JobInvocation} as a compact JSON object:
 * {@code {"t":"<type>","m":"<method>","a":"<arguments object>"}}. The arguments
 * entry is itself an encoded JSON object and is left out when there are no arguments.
 */
public final class JsonJobPayloadCodec implements JobPayloadCodec {
  private static final String TYPE = "t";
  private static final String METHOD = "m";
  private static final String ARGUMENTS = "a";

  private final JsonCodec jsonCodec;

  public JsonJobPayloadCodec() {
    this(JsonCodec.getDefault());
  }

  public JsonJobPayloadCodec(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public String serialize(JobInvocation job) {
    Objects.requireNonNull(job, "job");
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put(TYPE, job.type());
    fields.put(METHOD, job.method());
    if (!job.arguments().isEmpty()) {
      fields.put(ARGUMENTS, jsonCodec.toJson(job.arguments()));
    }
    return jsonCodec.toJson(fields);
  }

  @Override
  public JobInvocation deserialize(String payload) {
    Map<String, String> fields = jsonCodec.parseObject(payload);
    String type = fields.get(TYPE);
    String method = fields.get(METHOD);
    if (type == null || method == null) {
      throw new IllegalArgumentException("Job payload must contain '" + TYPE + "' and '" + METHOD + "' entries");
    }
    String arguments = fields.get(ARGUMENTS);
    return new JobInvocation(type, method,
        arguments == null ? Map.of() : jsonCodec.parseObject(arguments));
  }
}
