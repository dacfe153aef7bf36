package com.norma.search;

import java.util.List;

public interface DocumentSearchClient {

    /**
     * Returns matching pages in rank order, possibly none.
     *
     * @throws com.norma.orchestration.exception.ToolException when the backend fails
     */
    List<DocumentReference> search(SearchRequest request);
}
