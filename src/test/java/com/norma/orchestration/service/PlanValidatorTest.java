package com.norma.orchestration.service;

import com.norma.orchestration.exception.PlanValidationException;
import com.norma.orchestration.model.CalculationTemplate;
import com.norma.orchestration.model.PlanDraft;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.StepTool;
import com.norma.orchestration.state.Plan;
import com.norma.orchestration.tool.StepToolHandler;
import com.norma.orchestration.tool.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PlanValidatorTest {

    private PlanValidator validator;

    @BeforeEach
    void setUp() {
        StepToolHandler search = mock(StepToolHandler.class);
        when(search.tool()).thenReturn(StepTool.SEARCH);
        StepToolHandler calculate = mock(StepToolHandler.class);
        when(calculate.tool()).thenReturn(StepTool.CALCULATE);
        validator = new PlanValidator(new ToolRegistry(List.of(search, calculate)));
    }

    @Test
    void testStepsAreOrderedFilteredAndRenumbered() {
        List<PlanStep> steps = validator.toSteps(List.of(
                new PlanDraft.StepDraft(3, "Calc", "calculation", null, null, null, "a + 1", "b", null),
                new PlanDraft.StepDraft(1, "Find", "search_documents", null, List.of("cover"), List.of("SP 63"), null, null, null),
                new PlanDraft.StepDraft(2, "Browse", "browser", Map.of("url", "x"), null, null, null, null, null),
                new PlanDraft.StepDraft(4, "Empty search", "search", Map.of(), null, null, null, null, null)));

        assertEquals(2, steps.size());
        assertEquals(1, steps.get(0).number());
        assertEquals(StepTool.SEARCH, steps.get(0).tool());
        assertEquals(List.of("cover"), steps.get(0).keywords());
        assertEquals(List.of("SP 63"), steps.get(0).expectedDocuments());
        assertEquals(2, steps.get(1).number());
        assertEquals("a + 1", steps.get(1).parameters().get("expression"));
    }

    @Test
    void testLegacySemanticKeywordsParameter() {
        List<PlanStep> steps = validator.toSteps(List.of(new PlanDraft.StepDraft(1, "Find", "search",
                Map.of("semantic_keywords", List.of("cover")), null, null, null, null, null)));

        assertEquals(List.of("cover"), steps.get(0).keywords());
    }

    @Test
    void testTemplateImpliesCalculation() {
        PlanDraft draft = new PlanDraft("Compute axis", null, null, List.of(" cover_mm ", ""), null,
                new CalculationTemplate("cover_mm + 8", "axis_mm", null), null,
                List.of(new PlanDraft.StepDraft(1, "Find", "search", Map.of("keywords", List.of("cover")),
                        null, null, null, null, null)));

        Plan plan = validator.buildPlan(draft);

        assertTrue(plan.isRequiresCalculation());
        assertEquals(List.of("cover_mm"), plan.getRequiredFacts());
        assertNotNull(plan.getCalculation());
    }

    @Test
    void testPlanWithoutGoalOrStepsIsInvalid() {
        assertThrows(PlanValidationException.class, () -> validator.buildPlan(null));
        assertThrows(PlanValidationException.class, () -> validator.buildPlan(
                new PlanDraft("goal", null, null, null, null, null, null, List.of())));
    }
}
