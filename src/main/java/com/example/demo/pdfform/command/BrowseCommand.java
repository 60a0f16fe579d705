package com.example.demo.pdfform.command;

import com.example.demo.pdfform.catalog.CatalogLoader;
import com.example.demo.pdfform.catalog.FormsCatalog;
import com.example.demo.pdfform.config.PdfFormProperties;
import com.example.demo.pdfform.event.BrowseEventData;
import com.example.demo.pdfform.event.EventPublisher;
import com.example.demo.pdfform.event.EventType;
import com.example.demo.pdfform.exception.CatalogException;
import com.example.demo.pdfform.exception.ErrorCode;
import com.example.demo.pdfform.exception.PdfFormException;
import com.example.demo.pdfform.exception.Stage;
import com.example.demo.pdfform.model.CatalogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lists catalog regions and forms.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BrowseCommand {
    private final CatalogLoader catalogLoader;
    private final EventPublisher events;
    private final PdfFormProperties properties;

    public BrowseResult browse(String region) {
        return browse(properties.catalogFilePath(), region);
    }

    /**
     * Every form of the catalog, or only those of {@code region} when it is given.
     * A region without forms is an error.
     */
    public BrowseResult browse(Path catalogPath, String region) {
        String wantedRegion = region == null || region.isBlank() ? null : region.trim();
        BrowseEventData data = BrowseEventData.builder()
                .catalogPath(catalogPath.toString())
                .region(wantedRegion)
                .build();
        events.emit(EventType.BROWSE_STARTED, data);

        String stage = Stage.LOAD_CATALOG;
        try {
            FormsCatalog catalog = catalogLoader.load(catalogPath);
            List<String> regions = new ArrayList<>(catalog.regions());
            Collections.sort(regions);

            stage = Stage.FILTER_FORMS;
            List<CatalogEntry> forms = catalog.entries();
            if (wantedRegion != null) {
                forms = catalog.byRegion(wantedRegion);
                if (forms.isEmpty()) {
                    throw new CatalogException(ErrorCode.NOT_FOUND, Stage.FILTER_FORMS,
                            "No forms found for region: " + wantedRegion);
                }
            }

            events.emit(EventType.BROWSE_COMPLETED, data.toBuilder()
                    .regionCount(regions.size())
                    .formCount(forms.size())
                    .build());
            log.info("Browsed {} forms across {} regions", forms.size(), regions.size());
            return BrowseResult.builder()
                    .catalogPath(catalogPath.toString())
                    .region(wantedRegion)
                    .regions(regions)
                    .forms(forms)
                    .build();
        } catch (RuntimeException e) {
            PdfFormException failure = CommandFailures.asFormException(e, stage);
            events.emitError(EventType.BROWSE_ERROR, failure, data.toBuilder().stage(failure.getStage()).build());
            throw failure;
        }
    }
}
