package com.norma.orchestration.tool;

import static com.norma.orchestration.OrchestrationConstants.*;

import com.norma.orchestration.exception.ToolException;
import com.norma.orchestration.model.ExecutionHistoryEntry;
import com.norma.orchestration.model.PlanStep;
import com.norma.orchestration.model.StepResult;
import com.norma.orchestration.model.StepTool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
@Slf4j
public class CalculateStepHandler implements StepToolHandler {

    private static final Pattern STEP_REFERENCE = Pattern.compile("\\{\\s*step_(\\d+)\\.structured_output\\.([\\w-]+)\\s*}");
    private static final Pattern SCRATCHPAD_REFERENCE = Pattern.compile("\\{\\s*scratchpad\\.([\\w-]+)\\s*}");
    private static final Pattern NUMBER = Pattern.compile("-?\\d+(?:[.,]\\d+)?(?:[eE][-+]?\\d+)?");

    private final ExpressionCalculator calculator;

    @Override
    public StepTool tool() {
        return StepTool.CALCULATE;
    }

    @Override
    public StepResult execute(StepContext context) {
        PlanStep step = context.step();
        Object expression = step.parameters().get(PARAM_EXPRESSION);
        Object outputVariable = step.parameters().get(PARAM_OUTPUT_VARIABLE);
        if (expression == null || expression.toString().isBlank()) {
            throw new ToolException("Calculate step " + step.number() + " has no expression");
        }
        if (outputVariable == null || outputVariable.toString().isBlank()) {
            throw new ToolException("Calculate step " + step.number() + " has no output variable");
        }

        Map<String, Double> values = new LinkedHashMap<>();
        context.scratchpad().forEach((key, value) -> {
            Double number = leadingNumber(value);
            if (number != null) {
                values.put(key, number);
            }
        });
        if (step.parameters().get(PARAM_INPUT_VARIABLES) instanceof Map<?, ?> inputs) {
            inputs.forEach((name, value) -> values.put(name.toString(), resolve(name.toString(), value, context)));
        }

        double result = calculator.evaluate(expression.toString(), values);
        String output = outputVariable.toString().trim();
        log.info("Calculated {} = {} for step {}.", output, result, step.number());
        return StepResult.success(null, Map.of(output, result), expression + " = " + result);
    }

    private double resolve(String name, Object value, StepContext context) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = value == null ? "" : value.toString().trim();
        Matcher stepReference = STEP_REFERENCE.matcher(text);
        if (stepReference.matches()) {
            int stepNumber = Integer.parseInt(stepReference.group(1));
            String key = stepReference.group(2);
            return requireNumber(name, text, findStepOutput(context.history(), stepNumber, key));
        }
        Matcher scratchpadReference = SCRATCHPAD_REFERENCE.matcher(text);
        if (scratchpadReference.matches()) {
            return requireNumber(name, text, context.scratchpad().get(scratchpadReference.group(1)));
        }
        if (context.scratchpad().containsKey(text)) {
            return requireNumber(name, text, context.scratchpad().get(text));
        }
        return requireNumber(name, text, text);
    }

    @Nullable
    private Object findStepOutput(List<ExecutionHistoryEntry> history, int stepNumber, String key) {
        for (int i = history.size() - 1; i >= 0; i--) {
            ExecutionHistoryEntry entry = history.get(i);
            if (entry.step().number() == stepNumber && entry.result().status().isUsable()) {
                return entry.result().structuredOutput().get(key);
            }
        }
        return null;
    }

    private double requireNumber(String name, String reference, @Nullable Object value) {
        Double number = toNumber(value);
        if (number == null) {
            throw new ToolException("Input '" + name + "' (" + reference + ") does not resolve to a number");
        }
        return number;
    }

    /**
     * Scratchpad facts count as inputs only when they are numbers or start with one, as in
     * {@code "20 mm"}.
     */
    @Nullable
    private static Double leadingNumber(@Nullable Object value) {
        if (value instanceof String text) {
            Matcher matcher = NUMBER.matcher(text.trim());
            return matcher.lookingAt() ? Double.parseDouble(matcher.group().replace(',', '.')) : null;
        }
        return toNumber(value);
    }

    @Nullable
    static Double toNumber(@Nullable Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            Matcher matcher = NUMBER.matcher(text);
            if (matcher.find()) {
                return Double.parseDouble(matcher.group().replace(',', '.'));
            }
        }
        return null;
    }
}
