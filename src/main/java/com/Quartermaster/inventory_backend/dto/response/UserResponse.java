package com.Quartermaster.inventory_backend.dto.response;

import com.Quartermaster.inventory_backend.enums.Role;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserResponse {
    private Long id;
    private String username;
    private String fullName;
    private Role role;
    private boolean isActive;
    private LocalDateTime createdDate;
    private LocalDateTime lastLogin;
}
