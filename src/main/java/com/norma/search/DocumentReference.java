package com.norma.search;

/**
 * One page returned by the search backend.
 *
 * @param id         backend id of the page
 * @param docCode    document code, e.g. "SP 63.13330.2018"
 * @param title      document title, used as the subject area of the source
 * @param pageNumber page inside the document
 * @param snippet    short preview of the matched text
 * @param text       full page text
 */
public record DocumentReference(
        String id,
        String docCode,
        String title,
        int pageNumber,
        String snippet,
        String text
) {

    public String locator() {
        return pageNumber > 0 ? "page " + pageNumber : null;
    }
}
