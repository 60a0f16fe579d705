package com.example.demo.pdfform.catalog;

import com.example.demo.pdfform.model.CatalogEntry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-only index over the catalog rows. Safe for concurrent readers; every lookup is side-effect free.
 */
public final class FormsCatalog {
    private final List<CatalogEntry> entries;
    private final Map<String, CatalogEntry> byCode;

    FormsCatalog(List<CatalogEntry> entries) {
        this.entries = List.copyOf(entries);
        Map<String, CatalogEntry> index = new LinkedHashMap<>();
        for (CatalogEntry entry : this.entries) {
            index.put(normalize(entry.getFormCode()), entry);
        }
        this.byCode = Collections.unmodifiableMap(index);
    }

    public List<CatalogEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Look up a form by code, ignoring case and surrounding whitespace.
     */
    public Optional<CatalogEntry> byCode(String formCode) {
        if (formCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byCode.get(normalize(formCode)));
    }

    /**
     * All forms of a region (case-insensitive). Empty when none match.
     */
    public List<CatalogEntry> byRegion(String region) {
        if (region == null) {
            return List.of();
        }
        String wanted = normalize(region);
        return entries.stream()
                .filter(entry -> normalize(entry.getRegion()).equals(wanted))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Distinct regions present in the catalog. No ordering is promised.
     */
    public Set<String> regions() {
        Set<String> regions = new LinkedHashSet<>();
        for (CatalogEntry entry : entries) {
            regions.add(entry.getRegion());
        }
        return Collections.unmodifiableSet(regions);
    }

    public List<CatalogEntry> pdfForms() {
        return entries.stream()
                .filter(CatalogEntry::isPdf)
                .collect(Collectors.toUnmodifiableList());
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
    }
}
