package com.phillippitts.phiredaction.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the bundled lexicon-based context model.
 */
@ConfigurationProperties(prefix = "phi.context-model")
@Validated
public class ContextModelProperties {

    /** Classpath location of the given-name lexicon, one name per line. */
    @NotBlank
    private String lexiconResource = "phi/given-names.txt";

    /** Score attached to person names found through the lexicon. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double personScore = 0.9;

    /** Score attached to cue-based findings (honorifics, "born on", institution suffixes). */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double cueScore = 0.85;

    public String getLexiconResource() {
        return lexiconResource;
    }

    public void setLexiconResource(String lexiconResource) {
        this.lexiconResource = lexiconResource;
    }

    public double getPersonScore() {
        return personScore;
    }

    public void setPersonScore(double personScore) {
        this.personScore = personScore;
    }

    public double getCueScore() {
        return cueScore;
    }

    public void setCueScore(double cueScore) {
        this.cueScore = cueScore;
    }
}
