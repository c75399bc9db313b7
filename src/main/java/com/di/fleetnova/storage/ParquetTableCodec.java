package com.di.fleetnova.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.avro.Schema;
import org.apache.avro.SchemaBuilder;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.LocalInputFile;
import org.apache.parquet.io.LocalOutputFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes JSON-shaped rows as a Snappy Parquet file and reads them back.
 *
 * <p>The schema is inferred from the rows. Each column is a nullable Avro union; the
 * type is the narrowest of {@link ColumnType} that holds every non-null value. Integer
 * and decimal numbers widen to double; any other mix, and nested objects or arrays,
 * are stored as JSON text and parsed back on read. Column names that are not valid
 * Avro names are rewritten and the original is kept in the field property
 * {@value #COLUMN_PROP}.
 */
final class ParquetTableCodec {

    static final String COLUMN_PROP      = "fleetnova.column";
    static final String JSON_PROP        = "fleetnova.json";
    static final String PLACEHOLDER_PROP = "fleetnova.placeholder";

    private static final String RECORD_NAME = "Row";
    private static final String NAMESPACE   = "com.di.fleetnova";
    private static final String PLACEHOLDER = "_empty";

    private final ObjectMapper mapper;

    ParquetTableCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    enum ColumnType {
        BOOLEAN, LONG, DOUBLE, STRING, JSON;

        static ColumnType of(JsonNode value) {
            if (value.isBoolean()) {
                return BOOLEAN;
            }
            if (value.isIntegralNumber() && value.canConvertToLong()) {
                return LONG;
            }
            if (value.isNumber()) {
                return DOUBLE;
            }
            if (value.isTextual()) {
                return STRING;
            }
            return JSON;
        }

        ColumnType widen(ColumnType other) {
            if (other == null || other == this) {
                return this;
            }
            if ((this == LONG && other == DOUBLE) || (this == DOUBLE && other == LONG)) {
                return DOUBLE;
            }
            return JSON;
        }
    }

    void write(List<ObjectNode> rows, Path target) throws IOException {
        Map<String, ColumnType> columns = inferColumns(rows);
        Schema schema = schemaFor(columns);
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter.<GenericRecord>builder(new LocalOutputFile(target))
                .withSchema(schema)
                .withCompressionCodec(CompressionCodecName.SNAPPY)
                .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                .build()) {
            for (ObjectNode row : rows) {
                writer.write(toRecord(row, schema, columns));
            }
        }
    }

    List<ObjectNode> read(Path source) throws IOException {
        List<ObjectNode> rows = new ArrayList<>();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader.<GenericRecord>builder(new LocalInputFile(source))
                .withDataModel(GenericData.get())
                .build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                rows.add(toNode(record));
            }
        }
        return rows;
    }

    /** Column names in first-seen order with the type that fits all their values. */
    static Map<String, ColumnType> inferColumns(List<ObjectNode> rows) {
        Map<String, ColumnType> columns = new LinkedHashMap<>();
        for (ObjectNode row : rows) {
            row.fields().forEachRemaining(e -> {
                JsonNode value = e.getValue();
                ColumnType seen = columns.get(e.getKey());
                if (value == null || value.isNull() || value.isMissingNode()) {
                    columns.putIfAbsent(e.getKey(), null);
                } else {
                    columns.put(e.getKey(), ColumnType.of(value).widen(seen));
                }
            });
        }
        // all-null columns still need a type
        columns.replaceAll((name, type) -> type == null ? ColumnType.STRING : type);
        return columns;
    }

    static Schema schemaFor(Map<String, ColumnType> columns) {
        SchemaBuilder.FieldAssembler<Schema> fields = SchemaBuilder.record(RECORD_NAME).namespace(NAMESPACE).fields();
        if (columns.isEmpty()) {
            // Parquet rejects a message type with no fields
            return fields.name(PLACEHOLDER).prop(PLACEHOLDER_PROP, "true").type().optional().booleanType()
                    .endRecord();
        }
        Set<String> used = new HashSet<>();
        for (Map.Entry<String, ColumnType> column : columns.entrySet()) {
            SchemaBuilder.FieldBuilder<Schema> field = fields.name(fieldName(column.getKey(), used))
                    .prop(COLUMN_PROP, column.getKey());
            if (column.getValue() == ColumnType.JSON) {
                field.prop(JSON_PROP, "true");
            }
            SchemaBuilder.BaseTypeBuilder<SchemaBuilder.FieldAssembler<Schema>> type = field.type().optional();
            fields = switch (column.getValue()) {
                case BOOLEAN -> type.booleanType();
                case LONG -> type.longType();
                case DOUBLE -> type.doubleType();
                case STRING, JSON -> type.stringType();
            };
        }
        return fields.endRecord();
    }

    /** A valid, unique Avro field name for {@code column}. */
    static String fieldName(String column, Set<String> used) {
        StringBuilder name = new StringBuilder(column.length() + 1);
        for (char c : column.toCharArray()) {
            name.append((c < 128 && Character.isLetterOrDigit(c)) || c == '_' ? c : '_');
        }
        if (name.length() == 0 || Character.isDigit(name.charAt(0))) {
            name.insert(0, '_');
        }
        String base = name.toString();
        String candidate = base;
        for (int n = 1; !used.add(candidate); n++) {
            candidate = base + "_" + n;
        }
        return candidate;
    }

    private GenericRecord toRecord(ObjectNode row, Schema schema, Map<String, ColumnType> columns)
            throws JsonProcessingException {
        GenericRecord record = new GenericData.Record(schema);
        for (Schema.Field field : schema.getFields()) {
            String column = field.getProp(COLUMN_PROP);
            if (column == null) {
                continue;
            }
            JsonNode value = row.get(column);
            if (value == null || value.isNull()) {
                continue;
            }
            record.put(field.pos(), switch (columns.get(column)) {
                case BOOLEAN -> value.booleanValue();
                case LONG -> value.longValue();
                case DOUBLE -> value.doubleValue();
                case STRING -> value.textValue();
                case JSON -> mapper.writeValueAsString(value);
            });
        }
        return record;
    }

    private ObjectNode toNode(GenericRecord record) throws JsonProcessingException {
        ObjectNode node = mapper.createObjectNode();
        for (Schema.Field field : record.getSchema().getFields()) {
            if (field.getProp(PLACEHOLDER_PROP) != null) {
                continue;
            }
            String column = field.getProp(COLUMN_PROP) != null ? field.getProp(COLUMN_PROP) : field.name();
            Object value = record.get(field.pos());
            if (value == null) {
                node.putNull(column);
            } else if (field.getProp(JSON_PROP) != null) {
                node.set(column, mapper.readTree(value.toString()));
            } else if (value instanceof Boolean b) {
                node.put(column, b);
            } else if (value instanceof Long l) {
                node.put(column, l);
            } else if (value instanceof Double d) {
                node.put(column, d);
            } else {
                node.put(column, value.toString());
            }
        }
        return node;
    }
}
