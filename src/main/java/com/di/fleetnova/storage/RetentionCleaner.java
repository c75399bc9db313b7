package com.di.fleetnova.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Purges {@code YYYY/MM/DD} day partitions older than the retention horizon and
 * removes month/year directories left empty. Never throws: failures are logged
 * and the run continues.
 */
@Slf4j
@Component
public class RetentionCleaner {

    /**
     * @return number of day directories deleted
     */
    public int cleanup(Path root, LocalDate today, int daysToKeep) {
        LocalDate cutoff = today.minusDays(daysToKeep);
        if (!Files.isDirectory(root)) {
            return 0;
        }
        int deleted = 0;
        try {
            for (Path year : subdirs(root)) {
                for (Path month : subdirs(year)) {
                    for (Path day : subdirs(month)) {
                        LocalDate date = dayOf(year, month, day);
                        if (date != null && date.isBefore(cutoff)) {
                            if (deleteTree(day)) {
                                deleted++;
                            }
                        }
                    }
                    deleteIfEmpty(month);
                }
                deleteIfEmpty(year);
            }
        } catch (IOException | RuntimeException e) {
            log.error("[CLEANUP] Cleanup of {} failed: {}", root, e.getMessage(), e);
        }
        log.info("[CLEANUP] {}: deleted {} day partition(s) before {}", root, deleted, cutoff);
        return deleted;
    }

    private static List<Path> subdirs(Path dir) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isDirectory).sorted().toList();
        }
    }

    private static LocalDate dayOf(Path year, Path month, Path day) {
        try {
            return LocalDate.of(
                    Integer.parseInt(year.getFileName().toString()),
                    Integer.parseInt(month.getFileName().toString()),
                    Integer.parseInt(day.getFileName().toString()));
        } catch (NumberFormatException | DateTimeException e) {
            log.debug("[CLEANUP] Ignoring non-partition directory {}", day);
            return null;
        }
    }

    private static boolean deleteTree(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
            log.debug("[CLEANUP] Deleted {}", dir);
            return true;
        } catch (IOException e) {
            log.warn("[CLEANUP] Could not delete {}: {}", dir, e.getMessage());
            return false;
        }
    }

    private static void deleteIfEmpty(Path dir) {
        try (Stream<Path> s = Files.list(dir)) {
            if (s.findAny().isEmpty()) {
                Files.delete(dir);
            }
        } catch (IOException e) {
            log.warn("[CLEANUP] Could not remove empty directory {}: {}", dir, e.getMessage());
        }
    }
}
