package com.resourcelocator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings under {@code resource-locator.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "resource-locator")
public class ResourceLocatorProperties {

    @Valid
    private Cache cache = new Cache();

    @Valid
    private Token token = new Token();

    @Valid
    private Storage storage = new Storage();

    /** Regex with one capture group extracting the owner id from a logical name. */
    @NotBlank
    private String ownerPattern = "^[^/]+/(.+)$";

    /** Zone used for day-of-week and hour when a request carries no local time. */
    @NotNull
    private ZoneId zone = ZoneId.of("UTC");

    /** Named value maps for categorical vector dimensions. */
    private Map<String, Map<String, Double>> vectorMaps = new LinkedHashMap<>();

    /** Catalog entries registered at startup. */
    @Valid
    private List<CatalogEntry> resources = new ArrayList<>();

    @Data
    public static class Cache {
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);

        @Positive
        private long maximumSize = 10_000;
    }

    @Data
    public static class Token {
        @NotNull
        private Duration defaultLifetime = Duration.ofSeconds(60);

        @NotNull
        private Duration maxLifetime = Duration.ofHours(1);

        /** Base64 HMAC key. Blank means a random key per process. */
        private String secret;
    }

    @Data
    public static class Storage {
        /** {@code memory} or {@code jpa}. */
        @NotBlank
        private String type = "memory";

        @NotNull
        private Duration timeout = Duration.ofSeconds(2);

        /** Audit events kept by the in-memory adapter before the oldest are dropped. */
        @Positive
        private int memoryAuditRetention = 10_000;
    }

    @Data
    public static class CatalogEntry {
        @NotBlank
        private String logicalName;

        @NotBlank
        private String protocol;

        @NotBlank
        private String address;

        private String encryptedCredentials;

        private String capability = "READ";

        /** Policy expression in its JSON form. */
        @NotBlank
        private String policy;

        private String description;
    }
}
