package com.norma.orchestration;

public final class OrchestrationConstants {

    private OrchestrationConstants() {
        // Private constructor to prevent instantiation
    }

    // Language model request purposes
    public static final String PURPOSE_PLAN = "plan";
    public static final String PURPOSE_REPLAN = "replan";
    public static final String PURPOSE_EVIDENCE = "evidence-analysis";
    public static final String PURPOSE_FINALIZE = "finalize";
    public static final String RETRY_SUFFIX = "-retry";

    // Step parameter keys
    public static final String PARAM_KEYWORDS = "keywords";
    public static final String PARAM_EXPECTED_DOCUMENTS = "expected_documents";
    public static final String PARAM_EXPRESSION = "expression";
    public static final String PARAM_OUTPUT_VARIABLE = "output_variable";
    public static final String PARAM_INPUT_VARIABLES = "input_variables";

    // Scratchpad keys
    public static final String SCRATCHPAD_PRIORITY_DOCUMENTS = "priority_documents";
    public static final String SCRATCHPAD_QUERY_DOMAIN = "query_domain";
    public static final String SCRATCHPAD_REJECTED_SOURCES = "rejected_sources";
    public static final String SCRATCHPAD_SEARCH_HYPOTHESES = "search_hypotheses";

    // Prefix for rejected keyword sets inside rejected_sources
    public static final String REJECTED_KEYWORDS_PREFIX = "keywords:";

    // Default messages
    public static final String INVALID_JSON_RETRY_PROMPT = "\nYour last response was invalid JSON or did not match the schema. Return only valid JSON.";
    public static final String TOOL_FAILED_MESSAGE = "Tool failed: ";
    public static final String CANCELLED_REASON = "Session cancelled by operator.";

    public static final String PLANNER_SYSTEM_PROMPT = """
            You are the planner of an assistant that answers questions about building codes and
            design standards. Break the question into search and calculation steps.

            Available tools:
            - search: find pages in the normative document base. Parameters: "keywords" (list of
              search terms, most specific first) and "expected_documents" (document codes that
              most likely contain the answer).
            - calculate: evaluate a formula. Parameters: "expression" (arithmetic over named
              variables; functions floor, ceil, sqrt, pow, min, max, abs, round; constant pi),
              "output_variable", and "input_variables" (numbers or references such as
              "{step_1.structured_output.cover_min}" or "{scratchpad.cover_min}").

            Name every fact you expect to collect with a snake_case key and list the keys the
            final answer needs in "required_facts".

            Return JSON only:
            {
              "goal": "what the final answer must state",
              "query_domain": "subject area of the question",
              "priority_documents": ["..."],
              "required_facts": ["..."],
              "requires_calculation": false,
              "calculation": {"expression": "...", "output_variable": "...", "input_variables": {}},
              "search_hypotheses": [{"hypothesis": "...", "keywords": ["..."], "expected_documents": ["..."]}],
              "steps": [
                {"step_number": 1, "action": "...", "tool": "search|calculate", "parameters": {}}
              ]
            }
            Omit "calculation" when no computation is needed. Use at most %d steps.
            """;

    public static final String PLANNER_USER_TEMPLATE = """
            Question: {query}
            """;

    public static final String REPLANNER_SYSTEM_PROMPT = """
            You are the planner of an assistant that answers questions about building codes.
            Earlier steps did not finish the goal. Produce the remaining steps only, using the
            strategy you are given:
            - REFINE_AND_RESTRICT_SEARCH: narrow the search to the priority documents and more specific terms.
            - CHANGE_KEYWORDS: search again with different keywords.
            - FORM_NEW_HYPOTHESIS: assume the answer is stated elsewhere and search there.
            - FORM_CALCULATION_STEP: add one calculate step over the facts already collected.

            Never reuse a document or keyword set listed as rejected.

            Return JSON only, with the same schema as the initial plan:
            {"goal": "...", "steps": [{"step_number": 1, "action": "...", "tool": "search|calculate", "parameters": {}}]}
            Use at most %d steps.
            """;

    public static final String REPLANNER_USER_TEMPLATE = """
            Question: {query}
            Goal: {goal}
            Strategy: {strategy}
            Strategy details: {details}
            Completed steps:
            {completed}
            Known facts:
            {scratchpad}
            Rejected sources and keyword sets:
            {rejected}
            """;

    public static final String EVIDENCE_SYSTEM_PROMPT = """
            You read pages retrieved from normative documents and extract the facts a step asks
            for. Quote numbers exactly as printed and keep their units in the key or summary.
            Cite only one of the documents you were given.

            Return JSON only:
            {
              "status": "success|partial|not_found",
              "document_name": "code of the document the facts come from",
              "locator": "page, table or clause",
              "structured_output": {"snake_case_fact": 20},
              "summary": "one or two sentences"
            }
            Use "partial" when only some of the requested facts are present and "not_found"
            when none are.
            """;

    public static final String EVIDENCE_USER_TEMPLATE = """
            Task: {action}
            Facts already known:
            {scratchpad}
            Retrieved pages:
            {documents}
            """;

    public static final String FINALIZER_SYSTEM_PROMPT = """
            You write the final answer for an engineer. Use only the facts and step results you
            are given and do not introduce other sources.

            Return JSON only:
            {"answer": "the answer text", "limitations": ["..."]}
            """;

    public static final String FINALIZER_USER_TEMPLATE = """
            Question: {query}
            Goal: {goal}
            Facts:
            {scratchpad}
            Successful steps:
            {steps}
            """;
}
