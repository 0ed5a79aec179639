package com.largomodo.romcatalog.dat;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable lookup index over a batch of reference records.
 * <p>
 * Keys: primary hash (CRC32), secondary hash (SHA-1) and serial. Hashes are compared
 * case-insensitively; serials ignore case and spaces. When two records share a key the
 * first inserted record keeps it and later duplicates are discarded.
 * <p>
 * All state is built in the constructor and published through final fields holding
 * unmodifiable maps, so one instance can serve any number of concurrent readers.
 */
public final class HashIndex {

    private static final Logger log = LoggerFactory.getLogger(HashIndex.class);

    private final List<ReferenceRecord> records;
    private final Map<String, ReferenceRecord> byPrimary;
    private final Map<String, ReferenceRecord> bySecondary;
    private final Map<String, ReferenceRecord> bySerial;
    private final Set<Long> lengths;
    private final boolean allLengthsKnown;

    public HashIndex(List<ReferenceRecord> source) {
        if (source == null) {
            throw new IllegalArgumentException("source records must not be null");
        }
        Map<String, ReferenceRecord> primary = new HashMap<>();
        Map<String, ReferenceRecord> secondary = new HashMap<>();
        Map<String, ReferenceRecord> serial = new HashMap<>();
        int duplicates = 0;

        for (ReferenceRecord record : source) {
            duplicates += putFirst(primary, normalizeHash(record.primaryHash()), record);
            duplicates += putFirst(secondary, normalizeHash(record.secondaryHash()), record);
            duplicates += putFirst(serial, normalizeSerial(record.serial()), record);
        }
        if (duplicates > 0) {
            log.debug("Discarded {} duplicate index keys (first record wins)", duplicates);
        }

        this.records = Collections.unmodifiableList(new ArrayList<>(source));
        this.byPrimary = Collections.unmodifiableMap(primary);
        this.bySecondary = Collections.unmodifiableMap(secondary);
        this.bySerial = Collections.unmodifiableMap(serial);
        this.lengths = source.stream()
                .map(ReferenceRecord::expectedLength)
                .filter(length -> length != null)
                .collect(Collectors.toUnmodifiableSet());
        this.allLengthsKnown = source.stream().allMatch(record -> record.expectedLength() != null);
    }

    private static int putFirst(Map<String, ReferenceRecord> map, String key, ReferenceRecord record) {
        if (key == null) {
            return 0;
        }
        return map.putIfAbsent(key, record) == null ? 0 : 1;
    }

    static String normalizeHash(String hash) {
        if (hash == null) {
            return null;
        }
        String trimmed = hash.trim();
        return trimmed.isEmpty() ? null : trimmed.toLowerCase(Locale.ROOT);
    }

    // Hyphens stay: they are structurally significant in serials (SLUS-00123)
    static String normalizeSerial(String serial) {
        if (serial == null) {
            return null;
        }
        String normalized = serial.toUpperCase(Locale.ROOT).replace(" ", "");
        return normalized.isEmpty() ? null : normalized;
    }

    public Optional<ReferenceRecord> findByPrimaryHash(String hash) {
        String key = normalizeHash(hash);
        return key == null ? Optional.empty() : Optional.ofNullable(byPrimary.get(key));
    }

    public Optional<ReferenceRecord> findBySecondaryHash(String hash) {
        String key = normalizeHash(hash);
        return key == null ? Optional.empty() : Optional.ofNullable(bySecondary.get(key));
    }

    public Optional<ReferenceRecord> findBySerial(String serial) {
        String key = normalizeSerial(serial);
        return key == null ? Optional.empty() : Optional.ofNullable(bySerial.get(key));
    }

    /**
     * Match computed hashes: primary first, then secondary.
     * <p>
     * A primary hit is only accepted when the record's expected length (if known)
     * equals the hashed data size; CRC32 alone is too weak to ignore a size mismatch.
     */
    public Optional<ReferenceRecord> match(FileHashes hashes) {
        Optional<ReferenceRecord> primary = findByPrimaryHash(hashes.crc32());
        if (primary.isPresent()) {
            Long expected = primary.get().expectedLength();
            if (expected == null || expected == hashes.dataSize()) {
                return primary;
            }
        }
        return findBySecondaryHash(hashes.sha1());
    }

    /**
     * Cheap pre-filter for repair attempts: false only when every record declares a length
     * and none declares this one.
     */
    public boolean mayHaveLength(long length) {
        return !allLengthsKnown || lengths.contains(length);
    }

    public int recordCount() {
        return records.size();
    }

    public int primaryHashCount() {
        return byPrimary.size();
    }

    public int secondaryHashCount() {
        return bySecondary.size();
    }

    public int serialCount() {
        return bySerial.size();
    }
}
