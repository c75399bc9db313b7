package com.di.fleetnova.storage;

import com.di.fleetnova.exception.PersistenceException;
import com.di.fleetnova.util.JsonMappers;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * File-based storage for raw snapshots and transformed tables.
 *
 * <ul>
 *   <li>raw payloads: pretty-printed JSON, {@code {name}.json}</li>
 *   <li>tables: Snappy-compressed Parquet, {@code {name}.parquet}, columns named after the
 *   snake_case JSON properties of the row type</li>
 * </ul>
 * Files are written to a temporary sibling and moved into place, so readers never see
 * a half-written table. Reading a table that does not exist yields an empty list.
 */
@Slf4j
@Component
public class LocalFileStore {

    public static final String RAW_SUFFIX   = ".json";
    public static final String TABLE_SUFFIX = ".parquet";

    private final ObjectMapper rawMapper   = JsonMappers.raw();
    private final ObjectMapper tableMapper = JsonMappers.tables();
    private final ParquetTableCodec codec  = new ParquetTableCodec(tableMapper);

    public Path writeRaw(JsonNode payload, String name, Path dir) {
        Path target = dir.resolve(name + RAW_SUFFIX);
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, name, ".tmp");
            rawMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), payload);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            return target;
        } catch (IOException e) {
            throw new PersistenceException("Failed to write raw snapshot " + target, e);
        }
    }

    public Path writeTable(Collection<?> rows, String name, Path dir) {
        return writeTableTo(rows, tablePath(name, dir));
    }

    /** Writes a table to an explicit file path (Parquet regardless of the file name). */
    public Path writeTableTo(Collection<?> rows, Path target) {
        Path dir = target.toAbsolutePath().getParent();
        try {
            Files.createDirectories(dir);
            List<ObjectNode> nodes = new ArrayList<>(rows.size());
            for (Object row : rows) {
                nodes.add(tableMapper.valueToTree(row));
            }
            Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
            try {
                codec.write(nodes, tmp);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.debug("Wrote {} row(s) to {}", rows.size(), target);
            return target;
        } catch (IOException | IllegalArgumentException e) {
            throw new PersistenceException("Failed to write table " + target, e);
        }
    }

    public <T> List<T> readTable(String name, Path dir, Class<T> type) {
        Path source = tablePath(name, dir);
        if (!Files.isRegularFile(source)) {
            return new ArrayList<>();
        }
        try {
            List<T> rows = new ArrayList<>();
            for (ObjectNode node : codec.read(source)) {
                rows.add(tableMapper.treeToValue(node, type));
            }
            return rows;
        } catch (IOException e) {
            throw new PersistenceException("Failed to read table " + source, e);
        }
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> readRows(String name, Path dir) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<?, ?> row : readTable(name, dir, Map.class)) {
            rows.add((Map<String, Object>) row);
        }
        return rows;
    }

    public boolean tableExists(String name, Path dir) {
        return Files.isRegularFile(tablePath(name, dir));
    }

    /** Logical names of the tables in {@code dir} starting with {@code prefix}, sorted. */
    public List<String> listTables(Path dir, String prefix) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(f -> f.startsWith(prefix) && f.endsWith(TABLE_SUFFIX))
                    .map(f -> f.substring(0, f.length() - TABLE_SUFFIX.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new PersistenceException("Failed to list " + dir, e);
        }
    }

    public static Path tablePath(String name, Path dir) {
        return dir.resolve(name + TABLE_SUFFIX);
    }
}
