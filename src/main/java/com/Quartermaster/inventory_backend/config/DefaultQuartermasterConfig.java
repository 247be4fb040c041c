package com.Quartermaster.inventory_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "inventory.quartermaster.default")
@Data
public class DefaultQuartermasterConfig {
    private String username = "admin";
    private String password = "ChangeMe123!";
    private String fullName = "Default Quartermaster";
    private boolean enabled = true;
}
