package com.compliantvault.vaultservice.dto;

import jakarta.validation.constraints.NotBlank;

public record SettingUpdateRequest(
        @NotBlank String value
) {}
