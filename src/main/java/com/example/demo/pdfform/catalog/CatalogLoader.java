package com.example.demo.pdfform.catalog;

import com.example.demo.pdfform.aspect.LogExecutionTime;
import com.example.demo.pdfform.config.CacheConfiguration;
import com.example.demo.pdfform.exception.CatalogException;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.model.CatalogEntry;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Builds a {@link FormsCatalog} from the delimited catalog source.
 *
 * Column order is fixed: region, form_name, form_code, description, format,
 * direct_source_url, info_url, online_available, notes. The first row is a header.
 * A single malformed row fails the whole load; no partial catalog is ever returned.
 */
@Slf4j
@Component
public class CatalogLoader {
    static final int COLUMN_COUNT = 9;

    private final CsvMapper csvMapper = new CsvMapper();

    @LogExecutionTime("Loading Forms Catalog")
    @Cacheable(value = CacheConfiguration.FORMS_CATALOG_CACHE, key = "#source.toAbsolutePath().normalize().toString()")
    public FormsCatalog load(Path source) {
        log.info("Loading forms catalog from {}", source);
        try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
            return parse(reader, source.toString());
        } catch (NoSuchFileException e) {
            throw new CatalogException(ErrorCode.NOT_FOUND, Stage.LOAD_CATALOG,
                    "Catalog source not found: " + source, e);
        } catch (IOException e) {
            throw new CatalogException(ErrorCode.MALFORMED_SOURCE, Stage.LOAD_CATALOG,
                    "Failed to read catalog source " + source + ": " + e.getMessage(), e);
        }
    }

    public FormsCatalog parse(Reader reader, String sourceName) throws IOException {
        List<String[]> rows;
        try (MappingIterator<String[]> iterator = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .without(CsvParser.Feature.ALLOW_TRAILING_COMMA)
                .readValues(reader)) {
            rows = iterator.readAll();
        } catch (RuntimeJsonMappingException e) {
            throw new CatalogException(ErrorCode.MALFORMED_SOURCE, Stage.LOAD_CATALOG,
                    "Failed to parse catalog " + sourceName + ": " + e.getMessage(), e);
        }

        if (rows.size() < 2) {
            throw new CatalogException(ErrorCode.MALFORMED_SOURCE, Stage.LOAD_CATALOG,
                    "Catalog " + sourceName + " is empty or missing header");
        }

        List<CatalogEntry> entries = new ArrayList<>(rows.size() - 1);
        Set<String> seenCodes = new HashSet<>();
        for (int i = 1; i < rows.size(); i++) {
            String[] row = rows.get(i);
            int lineNumber = i + 1;
            if (row.length < COLUMN_COUNT) {
                throw new CatalogException(ErrorCode.MALFORMED_SOURCE, Stage.LOAD_CATALOG,
                        "Row " + lineNumber + " of " + sourceName + " has " + row.length
                                + " columns, expected " + COLUMN_COUNT);
            }
            CatalogEntry entry = toEntry(row);
            String code = FormsCatalog.normalize(entry.getFormCode());
            if (!code.isEmpty() && !seenCodes.add(code)) {
                throw new CatalogException(ErrorCode.MALFORMED_SOURCE, Stage.LOAD_CATALOG,
                        "Row " + lineNumber + " of " + sourceName + " repeats form code " + entry.getFormCode());
            }
            entries.add(entry);
        }

        log.info("Loaded {} forms from {}", entries.size(), sourceName);
        return new FormsCatalog(entries);
    }

    private CatalogEntry toEntry(String[] row) {
        return CatalogEntry.builder()
                .region(row[0].trim())
                .formName(row[1].trim())
                .formCode(row[2].trim())
                .description(row[3].trim())
                .format(row[4].trim())
                .sourceUrl(row[5].trim())
                .infoUrl(row[6].trim())
                .onlineAvailable(parseBoolean(row[7]))
                .notes(row[8].trim())
                .build();
    }

    static boolean parseBoolean(String value) {
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
            case "1":
            case "yes":
            case "y":
                return true;
            default:
                return false;
        }
    }
}
