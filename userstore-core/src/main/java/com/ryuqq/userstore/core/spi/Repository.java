package com.ryuqq.userstore.core.spi;

import java.util.Optional;

/**
 * Generic keyed storage capability.
 *
 * <p>Entities are keyed by a numeric identifier. At most one entity is stored
 * per identifier.</p>
 *
 * @param <T> the stored entity type
 * @author User Store Team
 * @since 1.0.0
 */
public interface Repository<T> {

    /**
     * Looks up the entity stored under the given identifier.
     *
     * <p>An absent entry is an expected outcome, not an error.</p>
     *
     * @param id the entity identifier
     * @return the stored entity, or {@link Optional#empty()} if none exists
     */
    Optional<T> getById(long id);

    /**
     * Inserts the entity under its identifier.
     *
     * <p>An existing entry with the same identifier is silently overwritten.</p>
     *
     * @param entity the entity to store
     * @throws IllegalArgumentException if entity is null
     */
    void add(T entity);
}
