package com.storefront.authservice.dto;

import com.storefront.authservice.entity.UserRole;
import jakarta.validation.constraints.NotNull;

public record RoleChangeRequest(@NotNull(message = "role is required") UserRole role) {
}
