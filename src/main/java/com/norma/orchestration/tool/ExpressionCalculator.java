package com.norma.orchestration.tool;

import com.norma.orchestration.exception.ToolException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates arithmetic formulas over named values with SpEL. Names in the formula are bound
 * to variables, so {@code floor(d / 2) + c} reads as {@code #floor(#d / 2.0) + #c}.
 */
@Component
public class ExpressionCalculator {

    private static final Pattern IDENTIFIER = Pattern.compile("(?<![#\\w.])([A-Za-z_][A-Za-z0-9_]*)(\\s*\\()?");
    private static final Pattern INTEGER_LITERAL = Pattern.compile("(?<![\\w.])(\\d+)(?![\\w.])");
    private static final Pattern ALLOWED = Pattern.compile("[\\w\\s.+\\-*/^%(),]*");

    private static final Map<String, Method> FUNCTIONS = new LinkedHashMap<>();
    private static final Map<String, Double> CONSTANTS = Map.of("pi", Math.PI, "e", Math.E);

    static {
        try {
            FUNCTIONS.put("floor", Math.class.getMethod("floor", double.class));
            FUNCTIONS.put("ceil", Math.class.getMethod("ceil", double.class));
            FUNCTIONS.put("sqrt", Math.class.getMethod("sqrt", double.class));
            FUNCTIONS.put("abs", Math.class.getMethod("abs", double.class));
            FUNCTIONS.put("round", Math.class.getMethod("round", double.class));
            FUNCTIONS.put("pow", Math.class.getMethod("pow", double.class, double.class));
            FUNCTIONS.put("min", Math.class.getMethod("min", double.class, double.class));
            FUNCTIONS.put("max", Math.class.getMethod("max", double.class, double.class));
        } catch (NoSuchMethodException ex) {
            throw new ExceptionInInitializerError(ex);
        }
    }

    private final ExpressionParser parser = new SpelExpressionParser();

    public double evaluate(String expression, Map<String, Double> values) {
        if (expression == null || expression.isBlank()) {
            throw new ToolException("Expression is empty");
        }
        String normalized = expression.replace("**", "^").trim();
        if (!ALLOWED.matcher(normalized).matches()) {
            throw new ToolException("Expression contains unsupported characters: " + expression);
        }
        normalized = INTEGER_LITERAL.matcher(normalized).replaceAll("$1.0");

        Set<String> missing = new LinkedHashSet<>();
        Matcher matcher = IDENTIFIER.matcher(normalized);
        StringBuilder rewritten = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            boolean call = matcher.group(2) != null;
            if (call && !FUNCTIONS.containsKey(name)) {
                throw new ToolException("Unknown function '" + name + "' in " + expression);
            }
            if (!call && !values.containsKey(name) && !CONSTANTS.containsKey(name)) {
                missing.add(name);
            }
            matcher.appendReplacement(rewritten, Matcher.quoteReplacement("#" + matcher.group()));
        }
        matcher.appendTail(rewritten);
        if (!missing.isEmpty()) {
            throw new ToolException("No value for " + missing + " in " + expression);
        }

        SimpleEvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding().build();
        FUNCTIONS.forEach(context::setVariable);
        CONSTANTS.forEach(context::setVariable);
        values.forEach(context::setVariable);
        try {
            Expression parsed = parser.parseExpression(rewritten.toString());
            Object result = parsed.getValue(context);
            if (!(result instanceof Number number)) {
                throw new ToolException("Expression did not produce a number: " + expression);
            }
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new ToolException("Expression produced " + value + ": " + expression);
            }
            return value;
        } catch (ExpressionException ex) {
            throw new ToolException("Cannot evaluate '" + expression + "': " + ex.getMessage(), ex);
        }
    }
}
