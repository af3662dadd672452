package com.fxmodules.core.repo;

import com.fxmodules.core.entity.Entity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage capabilities for entity records, implemented by storage adapters.
 *
 * <p>Adapters map records to rows through {@link Entity#columns()} and
 * {@link Entity#values(Map)}, and are expected to call {@link Entity#validate(Object)}
 * before writing. A record that does not exist is reported as an empty result, never as
 * an exception, so callers can tell "not found" apart from invalid input.
 */
public interface Repo {

    /**
     * Persists a new record.
     *
     * @param entity entity handle
     * @param data record to store
     * @return the stored record, as the storage sees it
     */
    Map<String, Object> save(Entity entity, Map<String, Object> data);

    /**
     * Updates records matching {@code params} with {@code data}.
     *
     * @param entity entity handle
     * @param data new column values
     * @param params match criteria, column name to value
     * @return number of updated records
     */
    int update(Entity entity, Map<String, Object> data, Map<String, Object> params);

    /**
     * Deletes records matching {@code params}.
     *
     * @param entity entity handle
     * @param params match criteria, column name to value
     * @return number of deleted records
     */
    int delete(Entity entity, Map<String, Object> params);

    /**
     * Finds one record.
     *
     * @param entity entity handle
     * @param params match criteria
     * @return the first match, or empty if nothing matches
     */
    Optional<Map<String, Object>> find(Entity entity, Map<String, Object> params);

    List<Map<String, Object>> findAll(Entity entity);

    List<Map<String, Object>> findAll(Entity entity, Map<String, Object> params);
}
