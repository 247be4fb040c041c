package com.Quartermaster.inventory_backend.service;

import com.Quartermaster.inventory_backend.config.JwtTokenProvider;
import com.Quartermaster.inventory_backend.dto.request.ChangePasswordRequest;
import com.Quartermaster.inventory_backend.dto.request.LoginRequest;
import com.Quartermaster.inventory_backend.dto.response.AuthResponse;
import com.Quartermaster.inventory_backend.dto.response.UserResponse;
import com.Quartermaster.inventory_backend.enums.Operation;
import com.Quartermaster.inventory_backend.exception.ApiException;
import com.Quartermaster.inventory_backend.exception.PermissionDeniedException;
import com.Quartermaster.inventory_backend.exception.UnauthorizedException;
import com.Quartermaster.inventory_backend.model.User;
import com.Quartermaster.inventory_backend.repository.UserRepository;
import com.Quartermaster.inventory_backend.security.AccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;
    private final UserService userService;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional
    public AuthResponse login(LoginRequest request) {
        log.info("Login attempt for username: {}", request.getUsername());

        User user = userRepository.findByUsername(request.getUsername().trim())
                .orElseThrow(() -> new UnauthorizedException("Invalid username or password"));

        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            log.warn("Wrong password for username: {}", user.getUsername());
            throw new UnauthorizedException("Invalid username or password");
        }

        if (!user.isActive()) {
            log.warn("Login refused for inactive account: {}", user.getUsername());
            throw new ApiException("User account is inactive", HttpStatus.FORBIDDEN,
                    PermissionDeniedException.ACCOUNT_DISABLED, Map.of("username", user.getUsername()));
        }

        user.setLastLogin(LocalDateTime.now(clock));
        userRepository.save(user);

        String token = jwtTokenProvider.generateToken(user);
        log.info("Login successful: {}", user.getUsername());

        return AuthResponse.builder()
                .user(userService.mapToUserResponse(user))
                .token(token)
                .build();
    }

    @Transactional
    public void changePassword(User actor, ChangePasswordRequest request) {
        accessPolicy.enforce(actor, Operation.MANAGE_OWN_ACCOUNT);
        User user = userRepository.findById(actor.getId())
                .orElseThrow(() -> new UnauthorizedException("User not found"));

        if (!passwordEncoder.matches(request.getCurrentPassword(), user.getPassword())) {
            log.warn("Current password incorrect for user ID: {}", user.getId());
            throw new ApiException("Current password is incorrect", HttpStatus.BAD_REQUEST, "WRONG_PASSWORD");
        }

        user.setPassword(passwordEncoder.encode(request.getNewPassword()));
        userRepository.save(user);
        log.info("Password changed for user ID: {}", user.getId());
    }

    public UserResponse getCurrentUser() {
        return userService.mapToUserResponse(userService.getCurrentUser());
    }
}
