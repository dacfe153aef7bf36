package com.norma.search;

import java.util.List;

/**
 * @param keywords          search terms, most specific first
 * @param expectedDocuments document codes the results are restricted to; empty means no filter
 */
public record SearchRequest(List<String> keywords, List<String> expectedDocuments) {

    public SearchRequest {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        expectedDocuments = expectedDocuments == null ? List.of() : List.copyOf(expectedDocuments);
    }
}
