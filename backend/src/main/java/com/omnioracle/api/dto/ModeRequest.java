package com.omnioracle.api.dto;

import com.omnioracle.domain.OracleMode;
import jakarta.validation.constraints.NotNull;

public record ModeRequest(@NotNull(message = "MODE_REQUIRED") OracleMode mode) {}
