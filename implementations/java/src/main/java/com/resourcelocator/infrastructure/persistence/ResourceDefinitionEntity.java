package com.resourcelocator.infrastructure.persistence;

import jakarta.persistence.*;
import lombok.*;

/**
 * Row of the {@code connections} table. The required policy is stored as JSON.
 */
@Entity
@Table(name = "connections")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResourceDefinitionEntity {
    @Id
    @Column(name = "logical_name", length = 512)
    private String logicalName;

    @Column(nullable = false)
    private String protocol;

    @Column(nullable = false, length = 2048)
    private String address;

    @Column(name = "encrypted_credentials", length = 4096)
    private String encryptedCredentials;

    @Column(nullable = false, length = 32)
    private String capability;

    @Column(name = "required_policy", nullable = false, columnDefinition = "TEXT")
    private String requiredPolicy;

    @Column(length = 1024)
    private String description;
}
