package com.norma.orchestration.tool;

import com.norma.orchestration.exception.ToolException;
import com.norma.orchestration.model.EvidenceReport;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.ResultStatus;
import com.norma.orchestration.model.SourceRef;
import com.norma.orchestration.model.StepResult;
import com.norma.orchestration.model.StepTool;
import com.norma.orchestration.service.OrchestrationPromptService;
import com.norma.orchestration.service.StructuredOutputService;
import com.norma.search.DocumentReference;
import com.norma.search.DocumentSearchClient;
import com.norma.search.SearchRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Searches the document base and asks the evidence analyzer to extract facts from the hits.
 * The cited source is always one of the retrieved documents.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SearchStepHandler implements StepToolHandler {

    private final DocumentSearchClient searchClient;
    private final StructuredOutputService structuredOutputService;
    private final OrchestrationPromptService promptService;

    @Override
    public StepTool tool() {
        return StepTool.SEARCH;
    }

    @Override
    public StepResult execute(StepContext context) {
        PlanStep step = context.step();
        List<String> keywords = step.keywords();
        if (keywords.isEmpty()) {
            throw new ToolException("Search step " + step.number() + " has no keywords");
        }
        List<DocumentReference> documents = searchClient.search(new SearchRequest(keywords, step.expectedDocuments()));
        if (documents.isEmpty()) {
            return StepResult.notFound("No pages matched " + keywords);
        }

        EvidenceReport report = structuredOutputService.request(
                promptService.evidenceRequest(context, documents),
                EvidenceReport.class,
                SearchStepHandler::validate);
        ResultStatus status = ResultStatus.from(report.status());
        if (status == ResultStatus.NOT_FOUND) {
            return StepResult.notFound(StringUtils.hasText(report.summary())
                    ? report.summary()
                    : "Retrieved pages do not contain the requested facts");
        }

        DocumentReference cited = matchRetrieved(report.documentName(), documents).orElseGet(() -> {
            log.warn("Evidence cites '{}', which was not retrieved; using top hit {} instead.",
                    report.documentName(), documents.get(0).docCode());
            return documents.get(0);
        });
        String locator = StringUtils.hasText(report.locator()) ? report.locator() : cited.locator();
        SourceRef source = new SourceRef(cited.docCode(), locator,
                StringUtils.hasText(cited.title()) ? cited.title() : null);
        return status == ResultStatus.SUCCESS
                ? StepResult.success(source, report.structuredOutput(), report.summary())
                : StepResult.partial(source, report.structuredOutput(), report.summary());
    }

    private static void validate(EvidenceReport report) {
        ResultStatus status = ResultStatus.from(report.status());
        if (status == ResultStatus.ERROR) {
            throw new IllegalArgumentException("evidence status must be success, partial or not_found");
        }
    }

    static Optional<DocumentReference> matchRetrieved(String documentName, List<DocumentReference> documents) {
        if (!StringUtils.hasText(documentName)) {
            return Optional.empty();
        }
        String wanted = compact(documentName);
        Optional<DocumentReference> exact = documents.stream()
                .filter(document -> compact(document.docCode()).equals(wanted))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return documents.stream()
                .filter(document -> {
                    String code = compact(document.docCode());
                    return !code.isEmpty() && (wanted.contains(code) || code.contains(wanted));
                })
                .findFirst();
    }

    private static String compact(String value) {
        return value == null ? "" : value.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }
}
