package com.Quartermaster.inventory_backend.config;

import com.Quartermaster.inventory_backend.enums.Role;
import com.Quartermaster.inventory_backend.model.User;
import com.Quartermaster.inventory_backend.repository.UserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataInitializerTest {

    @Mock private UserRepository userRepository;
    @Mock private PasswordEncoder passwordEncoder;

    private final DefaultQuartermasterConfig defaults = new DefaultQuartermasterConfig();
    private DataInitializer initializer;

    @BeforeEach
    void setUp() {
        initializer = new DataInitializer(userRepository, passwordEncoder, defaults,
                Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void emptyStoreGetsDefaultQuartermaster() {
        when(userRepository.count()).thenReturn(0L);
        when(passwordEncoder.encode("ChangeMe123!")).thenReturn("hashed");

        initializer.createDefaultQuartermasterIfEmpty();

        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        User created = captor.getValue();
        assertThat(created.getUsername()).isEqualTo("admin");
        assertThat(created.getPassword()).isEqualTo("hashed");
        assertThat(created.getRole()).isEqualTo(Role.QUARTERMASTER);
        assertThat(created.isActive()).isTrue();
    }

    @Test
    void existingUsersAreLeftAlone() {
        when(userRepository.count()).thenReturn(3L);

        initializer.createDefaultQuartermasterIfEmpty();

        verify(userRepository, never()).save(any());
    }

    @Test
    void disabledBootstrapDoesNothing() {
        defaults.setEnabled(false);

        initializer.createDefaultQuartermasterIfEmpty();

        verifyNoInteractions(userRepository, passwordEncoder);
    }
}
