package com.Quartermaster.inventory_backend.controller;

import com.Quartermaster.inventory_backend.dto.request.ChangePasswordRequest;
import com.Quartermaster.inventory_backend.dto.request.LoginRequest;
import com.Quartermaster.inventory_backend.dto.response.ApiResponse;
import com.Quartermaster.inventory_backend.dto.response.AuthResponse;
import com.Quartermaster.inventory_backend.dto.response.UserResponse;
import com.Quartermaster.inventory_backend.service.AuthService;
import com.Quartermaster.inventory_backend.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;
    private final UserService userService;

    @PostMapping("/login")
    public ResponseEntity<ApiResponse<AuthResponse>> login(@Valid @RequestBody LoginRequest request) {
        AuthResponse authResponse = authService.login(request);
        return ResponseEntity.ok(ApiResponse.success(authResponse, "Login successful"));
    }

    @GetMapping("/me")
    public ResponseEntity<ApiResponse<UserResponse>> getCurrentUser() {
        return ResponseEntity.ok(ApiResponse.success(authService.getCurrentUser()));
    }

    @PostMapping("/change-password")
    public ResponseEntity<ApiResponse<Void>> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
        authService.changePassword(userService.getCurrentUser(), request);
        return ResponseEntity.ok(ApiResponse.success(null, "Password changed successfully"));
    }
}
