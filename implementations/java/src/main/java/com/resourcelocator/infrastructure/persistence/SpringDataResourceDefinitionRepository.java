package com.resourcelocator.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Spring Data JPA repository for the {@code connections} table, keyed by logical name.
 */
@Repository
public interface SpringDataResourceDefinitionRepository extends JpaRepository<ResourceDefinitionEntity, String> {
}
