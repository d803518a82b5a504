package com.bubblegrade.repository;

import com.bubblegrade.exception.PersistenceException;
import com.bubblegrade.model.ScanResult;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InMemoryScanRepository implements ScanRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScanRepository.class);

    private final Map<UUID, ScanResult> scans = new ConcurrentHashMap<>();

    @Override
    public void create(ScanResult scan) {
        ScanResult previous = scans.putIfAbsent(scan.getId(), scan.copy());
        if (previous != null) {
            throw new PersistenceException("Scan " + scan.getId() + " already exists");
        }
        log.debug("Stored scan {}", scan.getId());
    }

    @Override
    public Optional<ScanResult> get(UUID id) {
        return Optional.ofNullable(scans.get(id)).map(ScanResult::copy);
    }

    @Override
    public void update(ScanResult scan) {
        ScanResult replaced = scans.computeIfPresent(scan.getId(), (id, current) -> scan.copy());
        if (replaced == null) {
            throw new PersistenceException("Scan " + scan.getId() + " does not exist");
        }
    }

    @Override
    public Optional<ScanResult> modify(UUID id, UnaryOperator<ScanResult> change) {
        ScanResult changed = scans.computeIfPresent(id, (key, current) -> change.apply(current.copy()).copy());
        return Optional.ofNullable(changed).map(ScanResult::copy);
    }
}
