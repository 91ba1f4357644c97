package com.phillippitts.phiredaction.service.detect.slow;

import com.phillippitts.phiredaction.config.properties.ContextModelProperties;
import com.phillippitts.phiredaction.exception.DetectorExceptionBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.ClassPathResource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bundled context model: a given-name lexicon combined with contextual cues.
 *
 * <p>Recognizes:
 * <ul>
 *   <li>PER: a lexicon given name followed by up to two capitalized surname tokens, or an
 *       honorific followed by capitalized tokens</li>
 *   <li>FAC / ORG: capitalized phrases ending in an institution or organization suffix</li>
 *   <li>DATE: dates following a birth cue ("born on", "date of birth", "DOB")</li>
 *   <li>GPE: capitalized place names following a residence cue ("lives in")</li>
 * </ul>
 *
 * <p>Unlike the fast lane this model sees the whole buffer, so names split across chunk
 * boundaries are found.
 */
public class LexiconContextModel implements ContextModel {

    private static final Logger LOG = LogManager.getLogger(LexiconContextModel.class);

    static final String MODEL_NAME = "lexicon";

    private static final Pattern WORD = Pattern.compile("[A-Za-z][A-Za-z'-]{0,40}");
    private static final Pattern HONORIFIC_NAME = Pattern.compile(
            "\\b(?:Dr|Mr|Mrs|Ms|Miss|Prof|Nurse)\\.?\\s{1,3}([A-Z][a-z'-]{1,30}(?:\\s{1,3}[A-Z][a-z'-]{1,30}){0,2})");
    private static final Pattern INSTITUTION = Pattern.compile(
            "\\b((?:[A-Z][A-Za-z&'-]{0,30}\\s{1,3}){1,4}"
                    + "(?:Hospital|Clinic|Medical Center|Health Center|Institute|Hospice|Pharmacy|Infirmary))\\b");
    private static final Pattern ORGANIZATION = Pattern.compile(
            "\\b((?:[A-Z][A-Za-z&'-]{0,30}\\s{1,3}){1,4}"
                    + "(?:University|College|Inc|Corp|Corporation|LLC|Company|Group|Associates|Foundation))\\b");
    private static final Pattern BIRTH_DATE = Pattern.compile(
            "\\b(?:born(?:\\s{1,3}on)?|date\\s{1,3}of\\s{1,3}birth|DOB)\\s{0,3}:?\\s{0,3}"
                    + "((?:January|February|March|April|May|June|July|August|September|October|November|December)"
                    + "\\s{1,3}\\d{1,2}(?:st|nd|rd|th)?,?\\s{1,3}\\d{4}|\\d{1,2}[/.-]\\d{1,2}[/.-]\\d{2,4})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern RESIDENCE = Pattern.compile(
            "\\b(?:lives|living|resides|residing|moved)\\s{1,3}(?:in|to)\\s{1,3}([A-Z][a-z]{1,30}(?:\\s{1,3}[A-Z][a-z]{1,30}){0,2})");

    /** Capitalized words that start sentences or phrases but never begin a proper name. */
    private static final Set<String> LEADING_STOPWORDS = Set.of(
            "the", "a", "an", "at", "in", "to", "from", "and", "or", "call", "visit", "visited",
            "we", "i", "he", "she", "they", "our", "my", "his", "her", "their", "went", "saw", "see");

    private final ContextModelProperties props;
    private volatile Set<String> givenNames = Set.of();
    private volatile boolean healthy = false;

    public LexiconContextModel(ContextModelProperties props) {
        this.props = props;
    }

    @Override
    public void initialize() {
        String resource = props.getLexiconResource();
        ClassPathResource lexicon = new ClassPathResource(resource);
        if (!lexicon.exists()) {
            healthy = false;
            throw DetectorExceptionBuilder.create("Given-name lexicon not found on classpath")
                    .detector(MODEL_NAME)
                    .metadata("resource", resource)
                    .buildUnavailable();
        }
        Set<String> names = new HashSet<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(lexicon.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String name = line.trim();
                if (!name.isEmpty() && !name.startsWith("#")) {
                    names.add(name.toLowerCase(Locale.ROOT));
                }
            }
        } catch (IOException e) {
            healthy = false;
            throw DetectorExceptionBuilder.create("Failed to read given-name lexicon")
                    .detector(MODEL_NAME)
                    .cause(e)
                    .metadata("resource", resource)
                    .buildUnavailable();
        }
        if (names.isEmpty()) {
            healthy = false;
            throw DetectorExceptionBuilder.create("Given-name lexicon is empty")
                    .detector(MODEL_NAME)
                    .metadata("resource", resource)
                    .buildUnavailable();
        }
        givenNames = Set.copyOf(names);
        healthy = true;
        LOG.info("Lexicon context model loaded {} given names from {}", names.size(), resource);
    }

    @Override
    public List<ModelAnnotation> annotate(String text) {
        if (!healthy) {
            throw DetectorExceptionBuilder.create("Lexicon context model is not initialized")
                    .detector(MODEL_NAME)
                    .buildUnavailable();
        }
        // keyed by span so that rules proposing the same span keep only the first label
        Map<Long, ModelAnnotation> found = new LinkedHashMap<>();
        findLexiconNames(text, found);
        findGroup(HONORIFIC_NAME, "PER", props.getCueScore(), text, found);
        findGroup(INSTITUTION, "FAC", props.getCueScore(), text, found);
        findGroup(ORGANIZATION, "ORG", props.getCueScore(), text, found);
        findGroup(BIRTH_DATE, "DATE", props.getCueScore(), text, found);
        findGroup(RESIDENCE, "GPE", props.getCueScore(), text, found);
        return new ArrayList<>(found.values());
    }

    private void findLexiconNames(String text, Map<Long, ModelAnnotation> found) {
        Matcher m = WORD.matcher(text);
        List<int[]> words = new ArrayList<>();
        while (m.find()) {
            words.add(new int[]{m.start(), m.end()});
        }
        for (int i = 0; i < words.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            int[] w = words.get(i);
            if (!isCapitalized(text, w[0]) || !givenNames.contains(lower(text, w))) {
                continue;
            }
            int end = w[1];
            int j = i + 1;
            // surname tokens: capitalized, adjacent (whitespace only), not another sentence start
            while (j < words.size() && j <= i + 2) {
                int[] next = words.get(j);
                if (!isCapitalized(text, next[0]) || !onlyWhitespace(text, end, next[0])
                        || LEADING_STOPWORDS.contains(lower(text, next))) {
                    break;
                }
                end = next[1];
                j++;
            }
            put(found, new ModelAnnotation("PER", w[0], end, props.getPersonScore()));
            i = j - 1;
        }
    }

    private void findGroup(Pattern pattern, String label, double score, String text,
                           Map<Long, ModelAnnotation> found) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            int start = skipLeadingStopwords(text, m.start(1), m.end(1));
            if (start < m.end(1)) {
                put(found, new ModelAnnotation(label, start, m.end(1), score));
            }
        }
    }

    private int skipLeadingStopwords(String text, int start, int end) {
        Matcher w = WORD.matcher(text).region(start, end);
        int pos = start;
        while (w.find() && w.start() == pos && LEADING_STOPWORDS.contains(
                text.substring(w.start(), w.end()).toLowerCase(Locale.ROOT))) {
            pos = w.end();
            while (pos < end && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }
        return pos;
    }

    private static void put(Map<Long, ModelAnnotation> found, ModelAnnotation a) {
        found.putIfAbsent(((long) a.start() << 32) | a.end(), a);
    }

    private static boolean isCapitalized(String text, int index) {
        return Character.isUpperCase(text.charAt(index));
    }

    private static boolean onlyWhitespace(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!Character.isWhitespace(text.charAt(i))) {
                return false;
            }
        }
        return to > from;
    }

    private static String lower(String text, int[] word) {
        return text.substring(word[0], word[1]).toLowerCase(Locale.ROOT);
    }

    @Override
    public String getModelName() {
        return MODEL_NAME;
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public void close() {
        healthy = false;
        givenNames = Set.of();
    }
}
