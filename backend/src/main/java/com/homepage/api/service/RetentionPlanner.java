package com.homepage.api.service;

import com.homepage.api.model.BackupRecord;
import com.homepage.api.model.BackupWarning;
import com.homepage.api.model.RetentionPolicy;
import com.homepage.api.model.RetentionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Grandfather-father-son retention over the backup catalog.
 * Keeps the newest backup of each of the N most recent days, ISO weeks and months,
 * and always the newest backup overall. Buckets are recomputed on every pass.
 */
@Slf4j
@Component
public class RetentionPlanner {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private final BackupCatalog catalog;
    private final ZoneId zone;

    @Autowired
    public RetentionPlanner(BackupCatalog catalog, Clock clock) {
        this.catalog = catalog;
        this.zone = clock.getZone();
    }

    /**
     * Compute the filenames to keep.
     *
     * @param records Backups in any order
     * @param policy Number of day, week and month buckets to keep
     * @return Filenames to keep; everything else may be deleted
     */
    public Set<String> plan(List<BackupRecord> records, RetentionPolicy policy) {
        Set<String> keep = new LinkedHashSet<>();
        if (records.isEmpty()) {
            return keep;
        }

        List<BackupRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(BackupRecord::getCreatedAt).reversed());

        keepNewestPerBucket(sorted, this::dayKey, policy.getDays(), keep);
        keepNewestPerBucket(sorted, this::isoWeekKey, policy.getWeeks(), keep);
        keepNewestPerBucket(sorted, this::monthKey, policy.getMonths(), keep);

        // a zero policy must never wipe the catalog
        keep.add(sorted.get(0).getFilename());

        return keep;
    }

    /**
     * Delete every record not in {@code keep}. A failed deletion is reported and the pass continues.
     */
    public RetentionResult apply(Set<String> keep, List<BackupRecord> records) {
        RetentionResult.RetentionResultBuilder result = RetentionResult.builder().kept(Set.copyOf(keep));

        for (BackupRecord record : records) {
            if (keep.contains(record.getFilename())) {
                continue;
            }
            Optional<BackupWarning> warning = catalog.deleteQuietly(record.getFilename());
            if (warning.isPresent()) {
                result.warning(warning.get());
            } else {
                log.info("[Cleanup] Deleted redundant backup: {}", record.getFilename());
                result.deletedFile(record.getFilename());
            }
        }

        return result.build();
    }

    /**
     * Plan and apply against the current catalog contents.
     */
    public RetentionResult cleanup(RetentionPolicy policy) {
        List<BackupRecord> backups = catalog.list();
        if (backups.isEmpty()) {
            return RetentionResult.empty();
        }

        log.info("[Cleanup] Running retention cleanup (total backups: {}, policy: {})", backups.size(), policy);
        Set<String> keep = plan(backups, policy);
        RetentionResult result = apply(keep, backups);

        log.info("[Cleanup] Retention applied: kept {}, deleted {}, failed {}",
                result.getKept().size(), result.getDeleted().size(), result.getWarnings().size());
        return result;
    }

    /**
     * Records must already be sorted newest first, so the first member of a bucket is its newest.
     */
    private void keepNewestPerBucket(List<BackupRecord> sortedNewestFirst,
                                     Function<BackupRecord, String> bucketKey,
                                     int bucketCount,
                                     Set<String> keep) {
        if (bucketCount <= 0) {
            return;
        }

        TreeMap<String, List<String>> buckets = new TreeMap<>(Comparator.reverseOrder());
        for (BackupRecord record : sortedNewestFirst) {
            buckets.computeIfAbsent(bucketKey.apply(record), k -> new ArrayList<>()).add(record.getFilename());
        }

        int taken = 0;
        for (Map.Entry<String, List<String>> bucket : buckets.entrySet()) {
            if (taken++ >= bucketCount) {
                break;
            }
            keep.add(bucket.getValue().get(0));
        }
    }

    String dayKey(BackupRecord record) {
        return localDate(record).format(DAY_FORMAT);
    }

    String isoWeekKey(BackupRecord record) {
        LocalDate date = localDate(record);
        return String.format("%04d-%02d",
                date.get(IsoFields.WEEK_BASED_YEAR),
                date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
    }

    String monthKey(BackupRecord record) {
        return localDate(record).format(MONTH_FORMAT);
    }

    private LocalDate localDate(BackupRecord record) {
        return record.getCreatedAt().atZone(zone).toLocalDate();
    }
}
