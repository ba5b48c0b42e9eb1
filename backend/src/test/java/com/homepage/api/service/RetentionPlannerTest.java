package com.homepage.api.service;

import com.homepage.api.model.BackupRecord;
import com.homepage.api.model.BackupWarning;
import com.homepage.api.model.RetentionPolicy;
import com.homepage.api.model.RetentionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("RetentionPlanner")
@ExtendWith(MockitoExtension.class)
class RetentionPlannerTest {

    @Mock private BackupCatalog catalog;

    private RetentionPlanner planner;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-10T12:00:00Z"), ZoneOffset.UTC);
        planner = new RetentionPlanner(catalog, clock);
    }

    @Nested
    @DisplayName("plan")
    class Plan {

        @Test
        @DisplayName("should keep the newest backup of each of the most recent days")
        void shouldKeepRecentDays() {
            List<BackupRecord> records = dailyBackups(1, 10);

            Set<String> keep = planner.plan(records, new RetentionPolicy(3, 0, 0));

            assertThat(keep).containsExactlyInAnyOrder(name(8), name(9), name(10));
        }

        @Test
        @DisplayName("should union day, ISO week and month buckets")
        void shouldUnionBuckets() {
            List<BackupRecord> records = dailyBackups(1, 10);

            Set<String> keep = planner.plan(records, new RetentionPolicy(3, 2, 1));

            // 2024-01-01 is a Monday: week buckets are Jan 1-7 and Jan 8-14
            assertThat(keep).containsExactlyInAnyOrder(name(7), name(8), name(9), name(10));
        }

        @Test
        @DisplayName("should keep only the newest backup of a day with several backups")
        void shouldKeepNewestWithinBucket() {
            List<BackupRecord> records = List.of(
                    record("backup_20240110_010000.sql", "2024-01-10T01:00:00Z"),
                    record("backup_20240110_230000.sql", "2024-01-10T23:00:00Z"),
                    record("backup_20240109_120000.sql", "2024-01-09T12:00:00Z"));

            Set<String> keep = planner.plan(records, new RetentionPolicy(1, 0, 0));

            assertThat(keep).containsExactly("backup_20240110_230000.sql");
        }

        @Test
        @DisplayName("should always keep the newest backup under a zero policy")
        void shouldNeverKeepNothing() {
            List<BackupRecord> records = dailyBackups(1, 5);

            Set<String> keep = planner.plan(records, new RetentionPolicy(0, 0, 0));

            assertThat(keep).containsExactly(name(5));
        }

        @Test
        @DisplayName("should return empty plan for empty catalog")
        void shouldHandleEmptyCatalog() {
            assertThat(planner.plan(List.of(), new RetentionPolicy(7, 4, 12))).isEmpty();
        }

        @Test
        @DisplayName("should clamp negative thresholds to zero")
        void shouldClampNegativePolicy() {
            RetentionPolicy policy = new RetentionPolicy(-1, -5, 2);

            assertThat(policy.getDays()).isZero();
            assertThat(policy.getWeeks()).isZero();
            assertThat(policy.getMonths()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("week key should follow ISO week numbering across year boundaries")
    void shouldUseIsoWeeks() {
        // Sunday 2023-01-01 belongs to ISO week 52 of 2022
        assertThat(planner.isoWeekKey(record("a.sql", "2023-01-01T12:00:00Z"))).isEqualTo("2022-52");
        assertThat(planner.isoWeekKey(record("b.sql", "2024-12-30T12:00:00Z"))).isEqualTo("2025-01");
        assertThat(planner.monthKey(record("c.sql", "2024-02-29T12:00:00Z"))).isEqualTo("2024-02");
        assertThat(planner.dayKey(record("d.sql", "2024-02-29T23:59:59Z"))).isEqualTo("2024-02-29");
    }

    @Nested
    @DisplayName("cleanup")
    class Cleanup {

        @Test
        @DisplayName("should delete everything outside the plan")
        void shouldDeleteRedundant() {
            when(catalog.list()).thenReturn(dailyBackups(1, 5));
            when(catalog.deleteQuietly(name(1))).thenReturn(Optional.empty());
            when(catalog.deleteQuietly(name(2))).thenReturn(Optional.empty());

            RetentionResult result = planner.cleanup(new RetentionPolicy(3, 0, 0));

            assertThat(result.getKept()).containsExactlyInAnyOrder(name(3), name(4), name(5));
            assertThat(result.getDeleted()).containsExactlyInAnyOrder(name(1), name(2));
            assertThat(result.getWarnings()).isEmpty();
            verify(catalog, never()).deleteQuietly(name(5));
        }

        @Test
        @DisplayName("should continue after a failed deletion and report it")
        void shouldContinueAfterFailure() {
            when(catalog.list()).thenReturn(dailyBackups(1, 4));
            when(catalog.deleteQuietly(name(1))).thenReturn(Optional.of(BackupWarning.cleanup("Failed to delete " + name(1))));
            when(catalog.deleteQuietly(name(2))).thenReturn(Optional.empty());
            when(catalog.deleteQuietly(name(3))).thenReturn(Optional.empty());

            RetentionResult result = planner.cleanup(new RetentionPolicy(1, 0, 0));

            assertThat(result.getDeleted()).containsExactlyInAnyOrder(name(2), name(3));
            assertThat(result.getWarnings()).hasSize(1);
            assertThat(result.getWarnings().get(0).getMessage()).contains(name(1));
        }

        @Test
        @DisplayName("should do nothing for an empty catalog")
        void shouldSkipEmptyCatalog() {
            when(catalog.list()).thenReturn(List.of());

            RetentionResult result = planner.cleanup(new RetentionPolicy(7, 4, 12));

            assertThat(result.getKept()).isEmpty();
            assertThat(result.getDeleted()).isEmpty();
        }
    }

    private static List<BackupRecord> dailyBackups(int fromDay, int toDay) {
        List<BackupRecord> records = new ArrayList<>();
        for (int day = fromDay; day <= toDay; day++) {
            Instant at = LocalDate.of(2024, 1, day).atTime(3, 0).toInstant(ZoneOffset.UTC);
            records.add(BackupRecord.builder().filename(name(day)).sizeBytes(100).createdAt(at).build());
        }
        return records;
    }

    private static String name(int day) {
        return String.format("backup_202401%02d_030000.sql", day);
    }

    private static BackupRecord record(String filename, String createdAt) {
        return BackupRecord.builder().filename(filename).sizeBytes(1).createdAt(Instant.parse(createdAt)).build();
    }
}
