package com.Quartermaster.inventory_backend.config;

import com.Quartermaster.inventory_backend.enums.Role;
import com.Quartermaster.inventory_backend.model.User;
import com.Quartermaster.inventory_backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.LocalDateTime;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataInitializer {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final DefaultQuartermasterConfig defaultQuartermasterConfig;
    private final Clock clock;

    @Bean
    CommandLineRunner initDatabase() {
        return args -> createDefaultQuartermasterIfEmpty();
    }

    void createDefaultQuartermasterIfEmpty() {
        if (!defaultQuartermasterConfig.isEnabled()) {
            log.info("Default quartermaster bootstrap disabled");
            return;
        }
        if (userRepository.count() > 0) {
            log.debug("Users already present, skipping default quartermaster");
            return;
        }

        User quartermaster = User.builder()
                .username(defaultQuartermasterConfig.getUsername())
                .password(passwordEncoder.encode(defaultQuartermasterConfig.getPassword()))
                .fullName(defaultQuartermasterConfig.getFullName())
                .role(Role.QUARTERMASTER)
                .active(true)
                .createdDate(LocalDateTime.now(clock))
                .build();

        userRepository.save(quartermaster);
        log.warn("=========================================");
        log.warn("Default quartermaster account created: {}", quartermaster.getUsername());
        log.warn("Change these credentials after first login!");
        log.warn("=========================================");
    }
}
