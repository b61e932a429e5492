package com.autoposter.controller.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public final class SchedulerRequests {

    private SchedulerRequests() {
    }

    public record SetEnabledRequest(
            @NotNull
            Boolean enabled
    ) {
    }

    public record SetIntervalRequest(
            @NotNull
            @Min(1)
            Long intervalMinutes
    ) {
    }
}
