package com.storefront.authservice.dto;

import jakarta.validation.constraints.NotNull;

public record StatusChangeRequest(@NotNull(message = "active is required") Boolean active) {
}
