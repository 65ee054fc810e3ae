package com.phillippitts.jobverdict.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "location.validation")
public class LocationValidationProperties {

    /** Gazetteer verdicts at or above this confidence skip LLM adjudication (0..1). */
    @Min(0)
    @Max(1)
    private final double gazetteerConfidenceThreshold;

    /** Characters of the job description sent to the adjudicator. */
    @Min(100)
    private final int excerptLength;

    /** Classpath location of the gazetteer tables. */
    @NotBlank
    private final String gazetteerResource;

    @ConstructorBinding
    public LocationValidationProperties(Double gazetteerConfidenceThreshold, Integer excerptLength,
                                        String gazetteerResource) {
        double t = gazetteerConfidenceThreshold == null ? 0.8 : gazetteerConfidenceThreshold;
        if (t < 0.0 || t > 1.0) {
            throw new IllegalArgumentException("location.validation.gazetteer-confidence-threshold must be in [0,1]");
        }
        this.gazetteerConfidenceThreshold = t;
        this.excerptLength = excerptLength == null ? 1000 : excerptLength;
        this.gazetteerResource = gazetteerResource == null || gazetteerResource.isBlank()
                ? "gazetteer.json" : gazetteerResource;
    }

    public static LocationValidationProperties defaults() {
        return new LocationValidationProperties(null, null, null);
    }

    public double getGazetteerConfidenceThreshold() {
        return gazetteerConfidenceThreshold;
    }

    public int getExcerptLength() {
        return excerptLength;
    }

    public String getGazetteerResource() {
        return gazetteerResource;
    }
}
