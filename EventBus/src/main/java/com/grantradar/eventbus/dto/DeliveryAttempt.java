package com.grantradar.eventbus.dto;

import com.grantradar.eventbus.exception.EventSerializationException;
import com.grantradar.eventbus.util.Dates;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * An envelope plus the failure history it carries between deliveries.
 *
 * The history lives in the stream record rather than in worker memory, so a
 * requeue appends a new immutable attempt built by {@link #failed}.
 */
@Value
@Builder(toBuilder = true)
public class DeliveryAttempt {

    public static final String RETRY_COUNT = "retry_count";
    public static final String LAST_ERROR = "last_error";
    public static final String LAST_RETRY_AT = "last_retry_at";
    public static final String FIRST_FAILURE_AT = "first_failure_at";

    public static final int MAX_ERROR_LENGTH = 1024;

    StreamEnvelope envelope;
    int retryCount;
    String lastError;
    Instant lastRetryAt;
    Instant firstFailureAt;

    public static DeliveryAttempt fromFields(Map<String, String> fields) {
        StreamEnvelope envelope = StreamEnvelope.fromFields(fields);
        try {
            String count = fields.get(RETRY_COUNT);
            return DeliveryAttempt.builder()
                    .envelope(envelope)
                    .retryCount(StringUtils.isBlank(count) ? 0 : Integer.parseInt(count.trim()))
                    .lastError(fields.get(LAST_ERROR))
                    .lastRetryAt(Dates.parseIso(fields.get(LAST_RETRY_AT)))
                    .firstFailureAt(Dates.parseIso(fields.get(FIRST_FAILURE_AT)))
                    .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new EventSerializationException("Invalid retry metadata: " + e.getMessage(), e);
        }
    }

    /**
     * The attempt that follows this one failing with the given error.
     */
    public DeliveryAttempt failed(String error, Instant at) {
        return toBuilder()
                .retryCount(retryCount + 1)
                .lastError(StringUtils.abbreviate(StringUtils.defaultString(error), MAX_ERROR_LENGTH))
                .lastRetryAt(at)
                .firstFailureAt(firstFailureAt != null ? firstFailureAt : at)
                .build();
    }

    public Map<String, String> toFields() {
        Map<String, String> fields = envelope.toFields();
        if (retryCount > 0) {
            fields.put(RETRY_COUNT, String.valueOf(retryCount));
            fields.put(LAST_ERROR, StringUtils.defaultString(lastError));
            fields.put(LAST_RETRY_AT, Dates.formatIso(lastRetryAt));
            if (firstFailureAt != null) {
                fields.put(FIRST_FAILURE_AT, Dates.formatIso(firstFailureAt));
            }
        }
        return fields;
    }
}
