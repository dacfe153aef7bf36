package com.norma.orchestration.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a piece of evidence came from.
 *
 * @param documentName document code, e.g. "SP 63.13330.2018"
 * @param locator      page, table or clause inside the document
 * @param domain       subject area of the document, usually its title
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceRef(
        @JsonProperty("document_name") String documentName,
        @JsonProperty("locator") String locator,
        @JsonProperty("domain") String domain
) {

    public SourceRef {
        if (documentName == null || documentName.isBlank()) {
            throw new IllegalArgumentException("document_name is required for a source");
        }
        documentName = documentName.trim();
    }
}
