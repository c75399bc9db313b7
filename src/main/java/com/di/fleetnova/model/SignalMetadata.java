package com.di.fleetnova.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Catalog entry describing one raw signal id.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SignalMetadata {

    private String signalId;
    private String friendlyName;
    private String unit;
    private String objectCode;
    private String nameCode;
    private String groupName;
    private String subGroup;

    /**
     * Builds a catalog entry from a flattened signal definition. Attribute names
     * follow the data source ({@code friendly_name}, {@code unit}, ...).
     */
    public static SignalMetadata fromRecord(SignalRecord record) {
        Map<String, Object> attrs = record.getAttributes();
        return SignalMetadata.builder()
                .signalId(record.getSignalId())
                .friendlyName(text(attrs, "friendly_name"))
                .unit(text(attrs, "unit"))
                .objectCode(text(attrs, "object_code"))
                .nameCode(text(attrs, "name_code"))
                .groupName(text(attrs, "group_name"))
                .subGroup(text(attrs, "sub_group"))
                .build();
    }

    private static String text(Map<String, Object> attrs, String key) {
        if (attrs == null) return null;
        Object v = attrs.get(key);
        return v != null ? String.valueOf(v) : null;
    }
}
