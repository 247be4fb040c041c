package com.Quartermaster.inventory_backend.dto.request;

import com.Quartermaster.inventory_backend.enums.Role;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Partial update: only non-null fields are applied.
 */
@Data
public class UserUpdateRequest {

    @Size(min = 1, max = 100, message = "Username must be between 1 and 100 characters")
    private String username;

    private String fullName;

    private Role role;

    @Size(min = 8, message = "Password must be at least 8 characters")
    private String password;

    private Boolean isActive;
}
