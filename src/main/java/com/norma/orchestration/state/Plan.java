package com.norma.orchestration.state;

import com.norma.orchestration.model.CalculationTemplate;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.StepTool;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered steps plus the goal they serve. The cursor always points at a pending step or is
 * {@code null} once every step is done.
 */
public class Plan {

    private final String goal;
    private final List<String> requiredFacts;
    private final boolean requiresCalculation;
    @Nullable
    private final CalculationTemplate calculation;
    private final List<PlanStep> steps;
    private int version;
    private int highestNumber;
    @Nullable
    private Integer cursor;

    private Plan(String goal, List<String> requiredFacts, boolean requiresCalculation,
                 @Nullable CalculationTemplate calculation, List<PlanStep> steps) {
        this.goal = goal;
        this.requiredFacts = List.copyOf(requiredFacts);
        this.requiresCalculation = requiresCalculation;
        this.calculation = calculation;
        this.steps = new ArrayList<>(steps);
        this.version = 1;
        this.highestNumber = steps.stream().mapToInt(PlanStep::number).max().orElse(0);
        this.cursor = firstPending();
    }

    public static Plan create(String goal, List<String> requiredFacts, boolean requiresCalculation,
                              @Nullable CalculationTemplate calculation, List<PlanStep> steps) {
        if (goal == null || goal.isBlank()) {
            throw new IllegalArgumentException("Plan goal must not be blank");
        }
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("Plan needs at least one step");
        }
        return new Plan(goal.trim(), requiredFacts == null ? List.of() : requiredFacts,
                requiresCalculation, calculation, steps);
    }

    public String getGoal() {
        return goal;
    }

    public List<String> getRequiredFacts() {
        return requiredFacts;
    }

    public boolean isRequiresCalculation() {
        return requiresCalculation;
    }

    @Nullable
    public CalculationTemplate getCalculation() {
        return calculation;
    }

    public List<PlanStep> getSteps() {
        return List.copyOf(steps);
    }

    public int getVersion() {
        return version;
    }

    @Nullable
    public Integer currentStepIndex() {
        return cursor;
    }

    @Nullable
    public PlanStep currentStep() {
        return cursor == null ? null : steps.get(cursor);
    }

    public boolean isExhausted() {
        return cursor == null;
    }

    public boolean hasPendingStep(StepTool tool) {
        return steps.stream().anyMatch(step -> !step.isDone() && step.tool() == tool);
    }

    public boolean hasPendingStep() {
        return steps.stream().anyMatch(step -> !step.isDone());
    }

    public int nextStepNumber() {
        return highestNumber + 1;
    }

    void completeCurrentStep() {
        if (cursor == null) {
            throw new IllegalStateException("Plan is exhausted");
        }
        steps.set(cursor, steps.get(cursor).markDone());
        cursor = firstPending();
    }

    /**
     * Drops every pending step and appends {@code newSteps} renumbered after the highest
     * number ever used in this plan. Done steps stay in place.
     */
    void replaceRemaining(List<PlanStep> newSteps) {
        int number = nextStepNumber();
        steps.removeIf(step -> !step.isDone());
        for (PlanStep step : newSteps) {
            steps.add(PlanStep.pending(number, step.action(), step.tool(), step.parameters()));
            highestNumber = number++;
        }
        version++;
        cursor = firstPending();
    }

    @Nullable
    private Integer firstPending() {
        for (int i = 0; i < steps.size(); i++) {
            if (!steps.get(i).isDone()) {
                return i;
            }
        }
        return null;
    }
}
