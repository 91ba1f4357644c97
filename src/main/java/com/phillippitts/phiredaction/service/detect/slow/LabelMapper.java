package com.phillippitts.phiredaction.service.detect.slow;

import com.phillippitts.phiredaction.domain.PhiLabel;
import com.phillippitts.phiredaction.service.metrics.RedactionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps free-text context-model labels onto the closed {@link PhiLabel} set.
 *
 * <p>Model vocabularies differ (spaCy-style "PER"/"GPE"/"FAC", clinical "ID"/"SSN"), so the
 * mapping is an explicit table. Labels outside the table are dropped and counted, both in
 * Micrometer and in an in-memory diagnostic map exposed through {@link #unmappedCounts()}.
 */
@Component
public class LabelMapper {

    private static final Logger LOG = LogManager.getLogger(LabelMapper.class);

    private static final Map<String, PhiLabel> TABLE = Map.ofEntries(
            Map.entry("PERSON", PhiLabel.PERSON),
            Map.entry("PER", PhiLabel.PERSON),
            Map.entry("NAME", PhiLabel.PERSON),
            Map.entry("ORG", PhiLabel.ORGANIZATION),
            Map.entry("ORGANIZATION", PhiLabel.ORGANIZATION),
            Map.entry("FAC", PhiLabel.INSTITUTION),
            Map.entry("HOSPITAL", PhiLabel.INSTITUTION),
            Map.entry("INSTITUTION", PhiLabel.INSTITUTION),
            Map.entry("GPE", PhiLabel.ADDRESS),
            Map.entry("LOC", PhiLabel.ADDRESS),
            Map.entry("ADDRESS", PhiLabel.ADDRESS),
            Map.entry("DATE", PhiLabel.DATE_OF_BIRTH),
            Map.entry("DOB", PhiLabel.DATE_OF_BIRTH),
            Map.entry("AGE", PhiLabel.AGE),
            Map.entry("ID", PhiLabel.RECORD_NUMBER),
            Map.entry("IDENTIFIER", PhiLabel.RECORD_NUMBER),
            Map.entry("MRN", PhiLabel.RECORD_NUMBER),
            Map.entry("SSN", PhiLabel.NATIONAL_ID),
            Map.entry("PHONE", PhiLabel.PHONE),
            Map.entry("EMAIL", PhiLabel.EMAIL),
            Map.entry("HANDLE", PhiLabel.HANDLE)
    );

    private final RedactionMetrics metrics;
    private final Map<String, AtomicLong> unmapped = new ConcurrentHashMap<>();

    public LabelMapper(RedactionMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Maps a model label.
     *
     * @param modelLabel free-text label, case-insensitive
     * @return mapped label, or empty when the label has no PHI meaning (counted)
     */
    public Optional<PhiLabel> map(String modelLabel) {
        if (modelLabel == null || modelLabel.isBlank()) {
            recordUnmapped("<blank>");
            return Optional.empty();
        }
        String key = modelLabel.trim().toUpperCase(Locale.ROOT);
        PhiLabel label = TABLE.get(key);
        if (label == null) {
            recordUnmapped(key);
            return Optional.empty();
        }
        return Optional.of(label);
    }

    /**
     * Diagnostic counts of dropped labels since startup.
     */
    public Map<String, Long> unmappedCounts() {
        Map<String, Long> copy = new ConcurrentHashMap<>();
        unmapped.forEach((k, v) -> copy.put(k, v.get()));
        return copy;
    }

    private void recordUnmapped(String key) {
        long n = unmapped.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        metrics.incrementUnmappedLabel(key);
        if (n == 1) {
            LOG.info("Dropping context-model label with no PHI mapping: {}", key);
        }
    }
}
