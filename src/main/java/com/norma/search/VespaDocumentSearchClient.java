package com.norma.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.norma.config.NormaAgentProperties;
import com.norma.orchestration.exception.ToolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Full-text search over normative document pages indexed in Vespa.
 */
@Component
@Slf4j
public class VespaDocumentSearchClient implements DocumentSearchClient {

    private static final int PREVIEW_LENGTH = 300;

    private final RestClient restClient;
    private final NormaAgentProperties properties;

    public VespaDocumentSearchClient(@Qualifier("searchRestClient") RestClient restClient,
                                     NormaAgentProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Override
    public List<DocumentReference> search(SearchRequest request) {
        if (request.keywords().isEmpty()) {
            throw new ToolException("Search needs at least one keyword");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("yql", buildYql(properties.getSearch().getSchema(), request.expectedDocuments()));
        body.put("query", String.join(" ", request.keywords()));
        body.put("ranking", "bm25");
        body.put("hits", properties.getSearch().getHits());
        body.put("timeout", properties.getSearch().getTimeout().toSeconds() + "s");

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/search/")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new ToolException("Search backend request failed: " + ex.getMessage(), ex);
        }
        List<DocumentReference> documents = readHits(response);
        log.info("Search for {} (documents={}) returned {} pages.", request.keywords(),
                request.expectedDocuments(), documents.size());
        return documents;
    }

    static String buildYql(String schema, List<String> expectedDocuments) {
        StringBuilder yql = new StringBuilder("select id,title,doc_code,page_number,snippet,text from ")
                .append(schema)
                .append(" where userQuery()");
        Set<String> codes = new LinkedHashSet<>();
        for (String document : expectedDocuments) {
            if (document == null || document.isBlank()) {
                continue;
            }
            String code = document.trim();
            codes.add(code);
            // Codes are indexed both with and without the space after the series prefix
            codes.add(code.replaceFirst("^(\\S+)\\s+(\\d)", "$1$2"));
        }
        if (!codes.isEmpty()) {
            List<String> conditions = new ArrayList<>();
            for (String code : codes) {
                conditions.add("doc_code contains \"" + escape(code) + "\"");
            }
            yql.append(" and (").append(String.join(" or ", conditions)).append(")");
        }
        return yql.toString();
    }

    private static String escape(String literal) {
        return literal.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private List<DocumentReference> readHits(JsonNode response) {
        if (response == null) {
            throw new ToolException("Search backend returned an empty body");
        }
        JsonNode root = response.path("root");
        if (root.has("errors")) {
            throw new ToolException("Search backend reported errors: " + root.path("errors"));
        }
        List<DocumentReference> documents = new ArrayList<>();
        for (JsonNode hit : root.path("children")) {
            JsonNode fields = hit.path("fields");
            String docCode = fields.path("doc_code").asText("");
            if (docCode.isBlank()) {
                continue;
            }
            String text = fields.path("text").asText("");
            String snippet = fields.path("snippet").asText(text);
            if (snippet.length() > PREVIEW_LENGTH) {
                snippet = snippet.substring(0, PREVIEW_LENGTH) + "...";
            }
            documents.add(new DocumentReference(
                    fields.path("id").asText(""),
                    docCode,
                    fields.path("title").asText(""),
                    fields.path("page_number").asInt(0),
                    snippet,
                    text));
        }
        return documents;
    }
}
