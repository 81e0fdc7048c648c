package com.tcgptracker.seed;

import com.tcgptracker.config.TrackerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs the catalog seed import at startup when {@code tracker.seed.enabled} is set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogSeedRunner implements ApplicationRunner {

    private final CatalogSeedImporter importer;
    private final TrackerProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getSeed().isEnabled()) {
            log.debug("Catalog seed import disabled");
            return;
        }
        String location = properties.getSeed().getLocation();
        SeedReport report = importer.importFrom(location);
        log.info("Catalog seed import from {} created {} rows: {}", location, report.getTotal(), report);
    }
}
