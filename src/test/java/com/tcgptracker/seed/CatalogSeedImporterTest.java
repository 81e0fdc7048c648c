package com.tcgptracker.seed;

import com.tcgptracker.catalog.CardRepository;
import com.tcgptracker.catalog.PackRepository;
import com.tcgptracker.catalog.PokemonSet;
import com.tcgptracker.catalog.PokemonSetRepository;
import com.tcgptracker.catalog.RarityProbabilityRepository;
import com.tcgptracker.admin.ProbabilitySumValidator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the catalog seed import.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
class CatalogSeedImporterTest {

    @Autowired
    private CatalogSeedImporter importer;

    @Autowired
    private PokemonSetRepository setRepository;

    @Autowired
    private PackRepository packRepository;

    @Autowired
    private CardRepository cardRepository;

    @Autowired
    private RarityProbabilityRepository probabilityRepository;

    @Autowired
    private ProbabilitySumValidator sumValidator;

    @Test
    void testImportBundledCatalog() {
        SeedReport report = importer.importFrom(new ClassPathResource("seed/catalog.json"));

        assertEquals(10, report.getRarities());
        assertEquals(1, report.getGenerations());
        assertEquals(2, report.getPackTypes());
        assertEquals(8, report.getProbabilities());
        assertEquals(2, report.getSets());
        assertEquals(4, report.getPacks());
        assertEquals(25, report.getCards());

        PokemonSet apex = setRepository.findByNumber("A1").orElseThrow();
        assertEquals("Genetic Apex", apex.getName());
        assertEquals(18, cardRepository.countByPokemonSetId(apex.getId()));
        assertEquals(4, packRepository.findAvailable(LocalDate.of(2025, 1, 1)).size());
        assertEquals(8, probabilityRepository.findByGenerationName("G1").size());
    }

    @Test
    void testImportBundledCatalog_ProbabilitiesSumToOne() {
        importer.importFrom(new ClassPathResource("seed/catalog.json"));

        assertTrue(sumValidator.validate("G1").isEmpty());
    }

    @Test
    void testImport_Twice() {
        importer.importFrom(new ClassPathResource("seed/catalog.json"));

        SeedReport second = importer.importFrom(new ClassPathResource("seed/catalog.json"));

        assertEquals(0, second.getTotal());
        assertEquals(25, cardRepository.count());
    }

    @Test
    void testImport_SkipsUnknownReferences() {
        SeedDocument document = new SeedDocument();
        SeedDocument.SetSeed set = new SeedDocument.SetSeed();
        set.setNumber("X1");
        set.setName("Unknown");
        set.setReleaseDate(LocalDate.of(2025, 1, 1));
        set.setGeneration("G9");
        document.setSets(List.of(set));

        SeedReport report = importer.importDocument(document);

        assertEquals(0, report.getTotal());
        assertTrue(setRepository.findByNumber("X1").isEmpty());
    }
}
