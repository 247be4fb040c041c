package com.Quartermaster.inventory_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "inventory.jwt")
@Data
public class JwtProperties {
    // HS256 needs at least 32 bytes of key material
    private String secret = "change-this-secret-before-deploying-the-inventory-server";
    private long expirationMs = 2_592_000_000L; // 30 days
}
