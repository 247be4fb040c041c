package com.Quartermaster.inventory_backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuthResponse {
    private UserResponse user;
    private String token;
    @Builder.Default
    private String tokenType = "bearer";

    @Override
    public String toString() {
        return "AuthResponse{" +
                "user=" + (user != null ? user.getUsername() : "null") +
                ", token=" + (token != null ? "***" : "null") +
                '}';
    }
}
