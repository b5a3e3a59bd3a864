package com.omnioracle.api.dto;

import jakarta.validation.constraints.NotNull;

public record ActiveRequest(@NotNull(message = "ACTIVE_REQUIRED") Boolean active) {}
