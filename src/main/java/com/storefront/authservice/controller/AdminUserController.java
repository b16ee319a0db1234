package com.storefront.authservice.controller;

import com.storefront.authservice.SecurityConfig.IdentityAuthentication;
import com.storefront.authservice.dto.RoleChangeRequest;
import com.storefront.authservice.dto.StatusChangeRequest;
import com.storefront.authservice.dto.UserSummary;
import com.storefront.authservice.service.UserAdminService;
import com.storefront.authservice.utils.ResponseMessage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Admin endpoints. Access is enforced in the security chain: ADMIN (or SUPERADMIN) for all,
 * SUPERADMIN alone for role changes.
 */
@RestController
@RequestMapping("/api/admin/users")
@RequiredArgsConstructor
@Tag(name = "User administration")
@SecurityRequirement(name = "bearerAuth")
public class AdminUserController {

    private final UserAdminService userAdminService;

    @GetMapping
    @Operation(summary = "List accounts")
    public Page<UserSummary> list(@PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC)
                                  Pageable pageable) {
        return userAdminService.listUsers(pageable);
    }

    @GetMapping("/{id}")
    public UserSummary get(@PathVariable UUID id) {
        return userAdminService.getUser(id);
    }

    @PatchMapping("/{id}/role")
    @ResponseMessage("Role updated; takes effect at the user's next login")
    @Operation(summary = "Change an account's role (superadmin only)")
    public UserSummary changeRole(@PathVariable UUID id,
                                  @Valid @RequestBody RoleChangeRequest request,
                                  IdentityAuthentication authentication) {
        return userAdminService.changeRole(id, request.role(), authentication.getIdentity());
    }

    @PatchMapping("/{id}/status")
    @ResponseMessage("Status updated")
    @Operation(summary = "Activate or deactivate an account")
    public UserSummary setStatus(@PathVariable UUID id,
                                 @Valid @RequestBody StatusChangeRequest request,
                                 IdentityAuthentication authentication) {
        return userAdminService.setActive(id, request.active(), authentication.getIdentity());
    }

    @PostMapping("/{id}/unlock")
    @ResponseMessage("Account unlocked")
    public UserSummary unlock(@PathVariable UUID id, IdentityAuthentication authentication) {
        return userAdminService.unlock(id, authentication.getIdentity());
    }
}
