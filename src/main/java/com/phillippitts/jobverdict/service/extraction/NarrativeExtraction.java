package com.phillippitts.jobverdict.service.extraction;

import com.phillippitts.jobverdict.domain.ContentType;

import java.util.Objects;

/**
 * Narrative or rationale text pulled from a response.
 *
 * @param contentType kind of content that was actually found
 * @param text        the extracted text, trimmed
 * @param mismatch    true when the content kind contradicts the match level it was requested for
 */
public record NarrativeExtraction(ContentType contentType, String text, boolean mismatch) {

    public NarrativeExtraction {
        Objects.requireNonNull(contentType, "contentType must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
