package com.di.fleetnova.transform;

import com.di.fleetnova.model.Observation;
import com.di.fleetnova.model.SignalMetadata;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Left-joins observations against the signal catalog to attach friendly names.
 * The output always has exactly as many rows as the input.
 */
@Slf4j
public class MetadataEnricher {

    /**
     * Catalog reduced to at most one entry per signal id: entries without a
     * friendly name are dropped, then the first entry per id wins.
     */
    public static Map<String, SignalMetadata> dedupCatalog(Collection<SignalMetadata> catalog) {
        Map<String, SignalMetadata> byId = new LinkedHashMap<>();
        if (catalog == null) {
            return byId;
        }
        for (SignalMetadata meta : catalog) {
            if (meta == null || meta.getSignalId() == null || meta.getFriendlyName() == null) continue;
            byId.putIfAbsent(meta.getSignalId(), meta);
        }
        return byId;
    }

    /**
     * Catalog maintenance: existing entries first, then incoming ones, one entry per
     * signal id. The first entry wins, except that a named entry replaces an entry
     * without a friendly name.
     */
    public static List<SignalMetadata> mergeCatalog(Collection<SignalMetadata> existing,
                                                    Collection<SignalMetadata> incoming) {
        Map<String, SignalMetadata> byId = new LinkedHashMap<>();
        for (Collection<SignalMetadata> source : List.of(nullToEmpty(existing), nullToEmpty(incoming))) {
            for (SignalMetadata meta : source) {
                if (meta == null || meta.getSignalId() == null) continue;
                SignalMetadata current = byId.get(meta.getSignalId());
                if (current == null || (current.getFriendlyName() == null && meta.getFriendlyName() != null)) {
                    byId.put(meta.getSignalId(), meta);
                }
            }
        }
        return new ArrayList<>(byId.values());
    }

    private static Collection<SignalMetadata> nullToEmpty(Collection<SignalMetadata> c) {
        return c != null ? c : List.of();
    }

    public List<Observation> enrich(List<Observation> observations, Collection<SignalMetadata> catalog) {
        if (observations == null || observations.isEmpty()) {
            return List.of();
        }
        Map<String, SignalMetadata> byId = dedupCatalog(catalog);

        List<Observation> out = new ArrayList<>(observations.size());
        int unmatched = 0;
        for (Observation obs : observations) {
            SignalMetadata meta = byId.get(obs.getSignalId());
            if (meta == null) {
                unmatched++;
                out.add(obs.toBuilder().friendlyName(null).build());
            } else {
                out.add(obs.toBuilder().friendlyName(meta.getFriendlyName()).build());
            }
        }
        if (unmatched > 0) {
            log.debug("[ENRICH] {} of {} observation(s) without catalog entry", unmatched, out.size());
        }
        return out;
    }
}
