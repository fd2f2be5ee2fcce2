package io.clinicqueue.noshow;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NoShowSweepPayload(
        @JsonProperty("grace_minutes") int graceMinutes
) {
}
