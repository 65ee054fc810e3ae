package com.phillippitts.jobverdict.service.location;

import com.phillippitts.jobverdict.domain.LocationAnalysis;

/**
 * Checks a job's declared location against its description.
 *
 * <p>Implementations never throw for bad model output or transport failures; they return a
 * conservative {@link com.phillippitts.jobverdict.domain.ValidationMethod#ERROR_FALLBACK} verdict instead.
 */
public interface LocationValidator {

    LocationAnalysis validate(String metadataLocation, String jobDescription);
}
