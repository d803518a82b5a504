package com.bubblegrade.repository;

import com.bubblegrade.model.ScanResult;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Storage of grading records. Implementations store and hand out independent copies so that a
 * caller mutating a record never changes the stored state behind the repository's back.
 *
 * @throws com.bubblegrade.exception.PersistenceException from any operation on storage failure
 */
public interface ScanRepository {

    void create(ScanResult scan);

    Optional<ScanResult> get(UUID id);

    void update(ScanResult scan);

    /**
     * Applies {@code change} to the stored record atomically with respect to other changes of the
     * same scan. An exception thrown by {@code change} leaves the stored record untouched.
     *
     * @return the changed record, or empty when no scan has the given id
     */
    Optional<ScanResult> modify(UUID id, UnaryOperator<ScanResult> change);
}
