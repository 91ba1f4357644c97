package com.phillippitts.phiredaction.service.detect.fast;

import com.phillippitts.phiredaction.domain.PhiLabel;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Fixed grammars recognized by the fast lane, with the confidence attached to each.
 *
 * <p>Quantifiers are bounded or possessive where the grammar allows it; the scan deadline in
 * {@link DeadlineCharSequence} covers whatever backtracking remains.
 */
final class PhiPatterns {

    /**
     * One pattern family member.
     *
     * @param label      label assigned to matches
     * @param pattern    compiled grammar
     * @param group      capture group holding the PHI span (0 for the whole match)
     * @param confidence fixed confidence for this grammar
     */
    record Rule(PhiLabel label, Pattern pattern, int group, double confidence) {}

    static final double EMAIL_CONFIDENCE = 0.95;
    static final double PHONE_CONFIDENCE = 0.8;
    static final double BARE_PHONE_CONFIDENCE = 0.6;
    static final double SSN_CONFIDENCE = 0.9;
    static final double BARE_SSN_CONFIDENCE = 0.5;
    static final double MRN_CONFIDENCE = 0.85;
    static final double MRN_SHAPE_CONFIDENCE = 0.6;
    static final double DATE_CONFIDENCE = 0.7;
    static final double AGE_CONFIDENCE = 0.75;
    static final double STREET_CONFIDENCE = 0.75;
    static final double ZIP_CONFIDENCE = 0.6;
    static final double HANDLE_CONFIDENCE = 0.7;

    private static final int CI = Pattern.CASE_INSENSITIVE;

    static final List<Rule> RULES = List.of(
            new Rule(PhiLabel.EMAIL,
                    Pattern.compile("\\b[A-Za-z0-9._%+-]++@(?:[A-Za-z0-9-]++\\.)+[A-Za-z]{2,24}\\b"),
                    0, EMAIL_CONFIDENCE),

            new Rule(PhiLabel.PHONE,
                    Pattern.compile("(?<![\\d-])(?:\\+?1[-.\\s]?)?(?:\\(\\d{3}\\)\\s?|\\d{3}[-.\\s])\\d{3}[-.\\s]\\d{4}(?![\\d-])"),
                    0, PHONE_CONFIDENCE),
            new Rule(PhiLabel.PHONE,
                    Pattern.compile("(?<!\\d)\\d{10}(?!\\d)"),
                    0, BARE_PHONE_CONFIDENCE),

            new Rule(PhiLabel.NATIONAL_ID,
                    Pattern.compile("(?<![\\d-])\\d{3}-\\d{2}-\\d{4}(?![\\d-])"),
                    0, SSN_CONFIDENCE),
            new Rule(PhiLabel.NATIONAL_ID,
                    Pattern.compile("\\b(?:SSN|social security(?: number)?)\\s{0,3}[:#]?\\s{0,3}(\\d{9})\\b", CI),
                    1, SSN_CONFIDENCE),
            new Rule(PhiLabel.NATIONAL_ID,
                    Pattern.compile("(?<!\\d)\\d{9}(?!\\d)"),
                    0, BARE_SSN_CONFIDENCE),

            new Rule(PhiLabel.RECORD_NUMBER,
                    Pattern.compile("\\b(?:MRN|medical record(?: number)?)\\s{0,3}[:#]?\\s{0,3}([A-Z0-9]{4,20})\\b", CI),
                    1, MRN_CONFIDENCE),
            new Rule(PhiLabel.RECORD_NUMBER,
                    Pattern.compile("\\b[A-Z]{2,4}\\d{4,12}\\b"),
                    0, MRN_SHAPE_CONFIDENCE),

            new Rule(PhiLabel.DATE_OF_BIRTH,
                    Pattern.compile("\\b\\d{1,2}[/-]\\d{1,2}[/-]\\d{4}\\b"),
                    0, DATE_CONFIDENCE),
            new Rule(PhiLabel.DATE_OF_BIRTH,
                    Pattern.compile("\\b\\d{4}[/-]\\d{1,2}[/-]\\d{1,2}\\b"),
                    0, DATE_CONFIDENCE),

            new Rule(PhiLabel.AGE,
                    Pattern.compile("\\b(?:age|aged)\\s{1,3}(\\d{1,3})\\b", CI),
                    1, AGE_CONFIDENCE),
            new Rule(PhiLabel.AGE,
                    Pattern.compile("\\b(\\d{1,3})[-\\s]?(?:years?[-\\s]old|y\\.?o\\b)", CI),
                    1, AGE_CONFIDENCE),

            new Rule(PhiLabel.ADDRESS,
                    Pattern.compile("\\b\\d{1,6}\\s{1,3}(?:[A-Z][A-Za-z]{0,30}\\s{1,3}){1,4}"
                            + "(?:Street|St|Avenue|Ave|Road|Rd|Drive|Dr|Lane|Ln|Boulevard|Blvd|Court|Ct|Way|Place|Pl)\\b"),
                    0, STREET_CONFIDENCE),
            new Rule(PhiLabel.ADDRESS,
                    Pattern.compile("(?<![\\d-])\\d{5}(?:-\\d{4})?(?![\\d-])"),
                    0, ZIP_CONFIDENCE),

            new Rule(PhiLabel.HANDLE,
                    Pattern.compile("(?<![\\w@.])@[A-Za-z0-9_]{2,30}\\b"),
                    0, HANDLE_CONFIDENCE)
    );

    private PhiPatterns() {
        // Utility class - prevent instantiation
    }
}
