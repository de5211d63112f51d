package com.neohoods.bridge.services.mapping;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neohoods.bridge.exceptions.CodedError;
import com.neohoods.bridge.exceptions.CodedErrorException;
import com.neohoods.bridge.model.MappingEntry;
import com.neohoods.bridge.services.matrix.MatrixIds;

import lombok.extern.slf4j.Slf4j;

/**
 * In-memory table of external numbers to Matrix users.
 * <p>
 * One read/write lock guards both the entries (keyed by canonical number) and the alt-number index, so readers never
 * see an entry whose alternate numbers are half installed.
 */
@Service
@Slf4j
public class IdentityMappingService {

    private final Map<String, MappingEntry> entriesByNumber = new TreeMap<>();
    private final Map<String, String> altNumberIndex = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public IdentityMappingService(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Resolves a number, alternate number or Matrix user id to a Matrix user id.
     */
    public Optional<String> resolve(String identifier) {
        if (!StringUtils.hasText(identifier)) {
            return Optional.empty();
        }
        String key = identifier.trim();
        if (MatrixIds.isUserId(key)) {
            return Optional.of(key);
        }

        lock.readLock().lock();
        try {
            MappingEntry entry = entriesByNumber.get(key);
            if (entry != null && StringUtils.hasText(entry.getMatrixId())) {
                log.debug("Identifier {} resolved to {}", key, entry.getMatrixId());
                return Optional.of(entry.getMatrixId());
            }
            String canonical = altNumberIndex.get(key);
            if (canonical != null) {
                MappingEntry owner = entriesByNumber.get(canonical);
                if (owner != null && StringUtils.hasText(owner.getMatrixId())) {
                    log.debug("Alternate number {} resolved to {} through {}", key, owner.getMatrixId(), canonical);
                    return Optional.of(owner.getMatrixId());
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        log.debug("Identifier {} could not be resolved to a Matrix user", key);
        return Optional.empty();
    }

    /**
     * Turns a Matrix user id into the identifier shown to the softphone: the canonical number of the owning entry,
     * else its display name, else the Matrix id itself. Alternate numbers are never returned.
     */
    public String reverseResolve(String matrixId) {
        if (matrixId == null) {
            return null;
        }
        String wanted = matrixId.trim();
        lock.readLock().lock();
        try {
            for (MappingEntry entry : entriesByNumber.values()) {
                if (MatrixIds.sameUser(entry.getMatrixId(), wanted)) {
                    if (StringUtils.hasText(entry.getNumber())) {
                        return entry.getNumber();
                    }
                    if (StringUtils.hasText(entry.getDisplayName())) {
                        return entry.getDisplayName();
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return wanted;
    }

    /**
     * Finds the entry whose Matrix id has the given localpart (case-insensitive).
     */
    public Optional<MappingEntry> findByLocalpart(String localpart) {
        String wanted = MatrixIds.normalizeLocalpart(localpart);
        if (wanted.isEmpty()) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return entriesByNumber.values().stream()
                    .filter(entry -> wanted.equals(MatrixIds.normalizeLocalpart(entry.getMatrixId())))
                    .findFirst()
                    .map(MappingEntry::copy);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores an entry under its canonical number, replacing any previous one.
     * The previous alternate numbers are retracted before the new ones are installed; an alternate number claimed
     * by another entry moves to this one.
     */
    public MappingEntry upsert(MappingEntry entry) {
        if (entry == null || !StringUtils.hasText(entry.getNumber())) {
            throw new CodedErrorException(CodedError.INVALID_MAPPING);
        }
        MappingEntry stored = normalize(entry);

        lock.writeLock().lock();
        try {
            MappingEntry previous = entriesByNumber.get(stored.getNumber());
            if (previous != null) {
                for (String alt : previous.getAltNumbers()) {
                    if (stored.getNumber().equals(altNumberIndex.get(alt))) {
                        altNumberIndex.remove(alt);
                    }
                }
            }
            for (String alt : stored.getAltNumbers()) {
                String owner = altNumberIndex.get(alt);
                if (owner != null && !owner.equals(stored.getNumber())) {
                    MappingEntry other = entriesByNumber.get(owner);
                    if (other != null) {
                        MappingEntry retracted = other.copy();
                        retracted.getAltNumbers().remove(alt);
                        entriesByNumber.put(owner, retracted);
                    }
                    log.info("Alternate number {} moved from {} to {}", alt, owner, stored.getNumber());
                }
                altNumberIndex.put(alt, stored.getNumber());
            }
            // a canonical number shadows any alternate number with the same value
            String shadowedOwner = altNumberIndex.remove(stored.getNumber());
            if (shadowedOwner != null && entriesByNumber.containsKey(shadowedOwner)) {
                MappingEntry retracted = entriesByNumber.get(shadowedOwner).copy();
                retracted.getAltNumbers().remove(stored.getNumber());
                entriesByNumber.put(shadowedOwner, retracted);
            }
            entriesByNumber.put(stored.getNumber(), stored);
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Mapping stored for number {} -> {} (alternate numbers {})", stored.getNumber(),
                stored.getMatrixId(), stored.getAltNumbers());
        return stored.copy();
    }

    public List<MappingEntry> list() {
        lock.readLock().lock();
        try {
            List<MappingEntry> entries = new ArrayList<>(entriesByNumber.size());
            for (MappingEntry entry : entriesByNumber.values()) {
                entries.add(entry.copy());
            }
            return entries;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Looks an entry up by canonical number, then by alternate number.
     *
     * @throws CodedErrorException {@link CodedError#MAPPING_NOT_FOUND} when neither matches
     */
    public MappingEntry lookup(String key) {
        String wanted = key == null ? "" : key.trim();
        lock.readLock().lock();
        try {
            MappingEntry entry = entriesByNumber.get(wanted);
            if (entry == null) {
                String canonical = altNumberIndex.get(wanted);
                entry = canonical == null ? null : entriesByNumber.get(canonical);
            }
            if (entry != null) {
                return entry.copy();
            }
        } finally {
            lock.readLock().unlock();
        }
        throw new CodedErrorException(CodedError.MAPPING_NOT_FOUND, Map.of("number", wanted));
    }

    /**
     * Upserts every entry of a batch. Entries without a number are skipped.
     *
     * @return the number of entries stored
     */
    public int bulkLoad(Collection<MappingEntry> entries) {
        int loaded = 0;
        for (MappingEntry entry : entries) {
            if (entry == null || !StringUtils.hasText(entry.getNumber())) {
                log.warn("Skipping mapping without number: {}", entry);
                continue;
            }
            upsert(entry);
            loaded++;
        }
        return loaded;
    }

    public int loadFromFile(Path file) throws IOException {
        List<MappingEntry> entries = objectMapper.readValue(Files.readAllBytes(file),
                new TypeReference<List<MappingEntry>>() {
                });
        int loaded = bulkLoad(entries);
        log.info("Loaded {} of {} mappings from {}", loaded, entries.size(), file);
        return loaded;
    }

    private MappingEntry normalize(MappingEntry entry) {
        String number = entry.getNumber().trim();
        Set<String> altNumbers = new LinkedHashSet<>();
        if (entry.getAltNumbers() != null) {
            for (String alt : entry.getAltNumbers()) {
                if (StringUtils.hasText(alt) && !alt.trim().equals(number)) {
                    altNumbers.add(alt.trim());
                }
            }
        }
        return entry.toBuilder()
                .number(number)
                .matrixId(entry.getMatrixId() == null ? null : entry.getMatrixId().trim())
                .altNumbers(altNumbers)
                .updatedAt(clock.instant())
                .build();
    }
}
