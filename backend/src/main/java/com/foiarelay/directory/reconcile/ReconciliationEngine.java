package com.foiarelay.directory.reconcile;

import com.foiarelay.directory.extract.ContactExtractor;
import com.foiarelay.directory.model.CanonicalRecord;
import com.foiarelay.directory.model.RegistryRecord;
import com.foiarelay.directory.model.ScrapedRecord;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges a scrape run with registry attributes into canonical directory records.
 *
 * <p>The scraped set drives the output: one record per scraped unit id, in scrape order,
 * and registry-only units are dropped. Descriptive fields prefer the registry value and
 * fall back to the scraped one; the email always comes from the scrape.
 */
@Component
public class ReconciliationEngine {
    private final ContactExtractor contactExtractor;
    private final Clock clock;

    public ReconciliationEngine(ContactExtractor contactExtractor, Clock clock) {
        this.contactExtractor = contactExtractor;
        this.clock = clock;
    }

    public List<CanonicalRecord> reconcile(List<ScrapedRecord> scraped, List<RegistryRecord> registry) {
        return reconcile(scraped, registry, clock.instant());
    }

    public List<CanonicalRecord> reconcile(List<ScrapedRecord> scraped, List<RegistryRecord> registry, Instant reconciledAt) {
        if (scraped == null || scraped.isEmpty()) {
            return List.of();
        }
        Map<String, RegistryRecord> registryById = new HashMap<>();
        if (registry != null) {
            for (RegistryRecord record : registry) {
                if (record != null && record.unitId() != null) {
                    registryById.putIfAbsent(record.unitId(), record);
                }
            }
        }

        Map<String, ScrapedRecord> drivingSet = new LinkedHashMap<>();
        for (ScrapedRecord record : scraped) {
            if (record != null && record.unitId() != null && !record.unitId().isBlank()) {
                drivingSet.putIfAbsent(record.unitId(), record);
            }
        }

        List<CanonicalRecord> canonical = new ArrayList<>(drivingSet.size());
        for (ScrapedRecord scrape : drivingSet.values()) {
            canonical.add(merge(scrape, registryById.get(scrape.unitId()), reconciledAt));
        }
        return List.copyOf(canonical);
    }

    CanonicalRecord merge(ScrapedRecord scrape, RegistryRecord registry, Instant reconciledAt) {
        boolean known = registry != null;
        return new CanonicalRecord(
            scrape.unitId(),
            prefer(known ? registry.title() : null, scrape.displayName()),
            prefer(known ? registry.abbreviation() : null, null),
            prefer(known ? registry.parentAgencyName() : null, null),
            prefer(known ? registry.parentAbbreviation() : null, null),
            emailsFor(scrape),
            prefer(known ? registry.website() : null, scrape.sourceUrl()),
            prefer(known ? registry.postalAddress() : null, scrape.postalAddressText()),
            prefer(known ? registry.phone() : null, scrape.phone()),
            prefer(known ? registry.foiaOfficerName() : null, scrape.foiaOfficerName()),
            reconciledAt
        );
    }

    private List<String> emailsFor(ScrapedRecord scrape) {
        if (!scrape.hasEmail()) {
            return List.of();
        }
        String email = scrape.extractedEmail().trim();
        if (contactExtractor.isSharedIntakeAddress(email)) {
            return List.of();
        }
        return List.of(email);
    }

    private String prefer(String registryValue, String scrapedValue) {
        if (registryValue != null && !registryValue.isBlank()) {
            return registryValue.trim();
        }
        if (scrapedValue != null && !scrapedValue.isBlank()) {
            return scrapedValue.trim();
        }
        return "";
    }
}
