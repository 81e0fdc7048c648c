package com.tcgptracker.seed;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tcgptracker.catalog.*;
import com.tcgptracker.common.exception.TrackerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Imports the catalog (rarities, generations, pack types, probabilities, sets, packs and
 * cards) from a JSON document.
 *
 * Rows are matched by natural key; existing rows are left as they are, so the import can
 * run on every startup (see {@link CatalogSeedRunner}).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogSeedImporter {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final RarityRepository rarityRepository;
    private final GenerationRepository generationRepository;
    private final PackTypeRepository packTypeRepository;
    private final RarityProbabilityRepository probabilityRepository;
    private final PokemonSetRepository setRepository;
    private final PackRepository packRepository;
    private final CardRepository cardRepository;

    @Transactional
    public SeedReport importFrom(String location) {
        return importFrom(resourceLoader.getResource(location));
    }

    @Transactional
    public SeedReport importFrom(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            return importDocument(objectMapper.readValue(in, SeedDocument.class));
        } catch (IOException e) {
            throw new TrackerException("Failed to read catalog seed " + resource.getDescription(), e);
        }
    }

    @Transactional
    public SeedReport importDocument(SeedDocument document) {
        Counter counter = new Counter();

        for (SeedDocument.RaritySeed seed : document.getRarities()) {
            if (!rarityRepository.existsById(seed.getName())) {
                rarityRepository.save(new Rarity(seed.getName(), seed.getDisplayName(), seed.getSortOrder(),
                    seed.getImageName(), seed.getRepeatCount()));
                counter.rarities++;
            }
        }

        for (SeedDocument.GenerationSeed seed : document.getGenerations()) {
            Generation generation = generationRepository.findById(seed.getName()).orElseGet(() -> {
                Generation created = new Generation(seed.getName(), seed.getDisplayName());
                created.setDescription(seed.getDescription());
                counter.generations++;
                return generationRepository.save(created);
            });
            for (SeedDocument.PackTypeSeed packTypeSeed : seed.getPackTypes()) {
                importPackType(generation, packTypeSeed, counter);
            }
        }

        for (SeedDocument.SetSeed seed : document.getSets()) {
            importSet(seed, counter);
        }

        return counter.toReport();
    }

    private void importPackType(Generation generation, SeedDocument.PackTypeSeed seed, Counter counter) {
        PackType packType = packTypeRepository.findByGenerationNameAndName(generation.getName(), seed.getName())
            .orElseGet(() -> {
                PackType created = new PackType(generation, seed.getName(), seed.getDisplayName(),
                    seed.getSlotCount(), seed.getOccurrenceProbability());
                created.setDescription(seed.getDescription());
                counter.packTypes++;
                return packTypeRepository.save(created);
            });

        for (SeedDocument.ProbabilitySeed probabilitySeed : seed.getProbabilities()) {
            Optional<Rarity> rarity = rarityRepository.findById(probabilitySeed.getRarity());
            if (rarity.isEmpty()) {
                log.warn("Skipping probability for {} - {}: rarity {} not found",
                    generation.getName(), seed.getName(), probabilitySeed.getRarity());
                continue;
            }
            boolean exists = probabilityRepository.findByGenerationNameAndPackTypeIdAndRarityName(
                generation.getName(), packType.getId(), rarity.get().getName()).isPresent();
            if (exists) {
                continue;
            }
            RarityProbability row = new RarityProbability(rarity.get(), generation, packType);
            row.setSlotProbabilities(probabilitySeed.getSlots());
            probabilityRepository.save(row);
            counter.probabilities++;
        }
    }

    private void importSet(SeedDocument.SetSeed seed, Counter counter) {
        Generation setGeneration = null;
        if (seed.getGeneration() != null) {
            setGeneration = generationRepository.findById(seed.getGeneration()).orElse(null);
            if (setGeneration == null) {
                log.warn("Skipping set {}: generation {} not found", seed.getNumber(), seed.getGeneration());
                return;
            }
        }

        Optional<PokemonSet> existing = setRepository.findByNumber(seed.getNumber());
        PokemonSet set;
        if (existing.isPresent()) {
            set = existing.get();
        } else {
            set = new PokemonSet(seed.getNumber(), seed.getName(), seed.getReleaseDate());
            set.setAvailableUntil(seed.getAvailableUntil());
            set.setGeneration(setGeneration);
            set = setRepository.save(set);
            counter.sets++;
        }

        Map<String, Pack> packs = new HashMap<>();
        for (SeedDocument.PackSeed packSeed : seed.getPacks()) {
            Pack pack = importPack(set, setGeneration, packSeed, counter);
            if (pack != null) {
                packs.put(pack.getName(), pack);
            }
        }

        for (SeedDocument.CardSeed cardSeed : seed.getCards()) {
            if (cardRepository.existsByPokemonSetIdAndNumber(set.getId(), cardSeed.getNumber())) {
                continue;
            }
            Optional<Rarity> rarity = rarityRepository.findById(cardSeed.getRarity());
            if (rarity.isEmpty()) {
                log.warn("Skipping card {} {}: rarity {} not found",
                    seed.getNumber(), cardSeed.getNumber(), cardSeed.getRarity());
                continue;
            }
            Card card = new Card(set, cardSeed.getNumber(), cardSeed.getName(), rarity.get());
            for (String packName : cardSeed.getPacks()) {
                Pack pack = packs.get(packName);
                if (pack == null) {
                    log.warn("Card {} {} refers to unknown pack {}", seed.getNumber(), cardSeed.getNumber(), packName);
                    continue;
                }
                card.addPack(pack);
            }
            cardRepository.save(card);
            counter.cards++;
        }
    }

    private Pack importPack(PokemonSet set, Generation setGeneration, SeedDocument.PackSeed seed, Counter counter) {
        Optional<Pack> existing = packRepository.findByPokemonSetNumberAndName(set.getNumber(), seed.getName());
        if (existing.isPresent()) {
            return existing.get();
        }
        Generation generation = seed.getGeneration() != null
            ? generationRepository.findById(seed.getGeneration()).orElse(null)
            : setGeneration;
        if (generation == null) {
            log.warn("Skipping pack {} of set {}: no rarity generation", seed.getName(), set.getNumber());
            return null;
        }
        counter.packs++;
        return packRepository.save(new Pack(set, seed.getName(), generation));
    }

    private static class Counter {
        int rarities;
        int generations;
        int packTypes;
        int probabilities;
        int sets;
        int packs;
        int cards;

        SeedReport toReport() {
            return new SeedReport(rarities, generations, packTypes, probabilities, sets, packs, cards);
        }
    }
}
