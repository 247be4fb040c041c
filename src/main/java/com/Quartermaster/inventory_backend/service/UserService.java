package com.Quartermaster.inventory_backend.service;

import com.Quartermaster.inventory_backend.dto.request.ResetPasswordRequest;
import com.Quartermaster.inventory_backend.dto.request.UserCreateRequest;
import com.Quartermaster.inventory_backend.dto.request.UserUpdateRequest;
import com.Quartermaster.inventory_backend.dto.response.UserResponse;
import com.Quartermaster.inventory_backend.enums.Operation;
import com.Quartermaster.inventory_backend.exception.CannotDeactivateSelfException;
import com.Quartermaster.inventory_backend.exception.DuplicateUsernameException;
import com.Quartermaster.inventory_backend.exception.ResourceNotFoundException;
import com.Quartermaster.inventory_backend.exception.UnauthorizedException;
import com.Quartermaster.inventory_backend.model.User;
import com.Quartermaster.inventory_backend.repository.UserRepository;
import com.Quartermaster.inventory_backend.security.AccessPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<UserResponse> getAllUsers(User actor) {
        accessPolicy.enforce(actor, Operation.MANAGE_USERS);
        return userRepository.findAllByOrderByCreatedDateDesc()
                .stream()
                .map(this::mapToUserResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public UserResponse getUserById(User actor, Long id) {
        accessPolicy.enforce(actor, Operation.MANAGE_USERS);
        return mapToUserResponse(findUser(id));
    }

    @Transactional
    public UserResponse createUser(User actor, UserCreateRequest request) {
        accessPolicy.enforce(actor, Operation.MANAGE_USERS);

        String username = request.getUsername().trim();
        if (userRepository.existsByUsername(username)) {
            throw new DuplicateUsernameException(username);
        }

        User user = User.builder()
                .username(username)
                .password(passwordEncoder.encode(request.getPassword()))
                .fullName(request.getFullName().trim())
                .role(request.getRole())
                .active(true)
                .createdDate(LocalDateTime.now(clock))
                .build();

        User savedUser = saveCheckingUsername(user);
        log.info("User created with ID: {} (username: {}, role: {})",
                savedUser.getId(), savedUser.getUsername(), savedUser.getRole().getValue());
        return mapToUserResponse(savedUser);
    }

    @Transactional
    public UserResponse updateUser(User actor, Long id, UserUpdateRequest request) {
        accessPolicy.enforce(actor, Operation.MANAGE_USERS);
        User user = findUser(id);

        if (request.getUsername() != null) {
            String username = request.getUsername().trim();
            if (userRepository.existsByUsernameAndIdNot(username, id)) {
                throw new DuplicateUsernameException(username);
            }
            user.setUsername(username);
        }
        if (request.getFullName() != null) {
            user.setFullName(request.getFullName().trim());
        }
        if (request.getRole() != null) {
            user.setRole(request.getRole());
        }
        if (request.getPassword() != null && !request.getPassword().isBlank()) {
            user.setPassword(passwordEncoder.encode(request.getPassword()));
        }
        if (request.getIsActive() != null) {
            if (!request.getIsActive() && Objects.equals(actor.getId(), id)) {
                throw new CannotDeactivateSelfException();
            }
            user.setActive(request.getIsActive());
        }

        User updatedUser = saveCheckingUsername(user);
        log.info("User updated with ID: {}", id);
        return mapToUserResponse(updatedUser);
    }

    @Transactional
    public void deactivateUser(User actor, Long id) {
        accessPolicy.enforce(actor, Operation.MANAGE_USERS);
        if (Objects.equals(actor.getId(), id)) {
            throw new CannotDeactivateSelfException();
        }
        User user = findUser(id);
        user.setActive(false);
        userRepository.save(user);
        log.info("User deactivated with ID: {}", id);
    }

    @Transactional
    public UserResponse activateUser(User actor, Long id) {
        accessPolicy.enforce(actor, Operation.MANAGE_USERS);
        User user = findUser(id);
        user.setActive(true);
        User activatedUser = userRepository.save(user);
        log.info("User activated with ID: {}", id);
        return mapToUserResponse(activatedUser);
    }

    /**
     * Sets a new password without the old one. Quartermaster-assisted recovery.
     */
    @Transactional
    public void resetPassword(User actor, Long id, ResetPasswordRequest request) {
        accessPolicy.enforce(actor, Operation.MANAGE_USERS);
        User user = findUser(id);
        user.setPassword(passwordEncoder.encode(request.getNewPassword()));
        userRepository.save(user);
        log.info("Password reset for user ID: {} by user {}", id, actor.getId());
    }

    public User getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !authentication.isAuthenticated()
                || !(authentication.getPrincipal() instanceof User user)) {
            throw new UnauthorizedException("User not authenticated");
        }
        return user;
    }

    public UserResponse mapToUserResponse(User user) {
        if (user == null) return null;

        return UserResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .fullName(user.getFullName())
                .role(user.getRole())
                .isActive(user.isActive())
                .createdDate(user.getCreatedDate())
                .lastLogin(user.getLastLogin())
                .build();
    }

    // username is the only unique column; the index settles races the exists check misses
    private User saveCheckingUsername(User user) {
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            log.warn("Username {} taken concurrently", user.getUsername());
            throw new DuplicateUsernameException(user.getUsername());
        }
    }

    private User findUser(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("User", "id", id));
    }
}
