package com.norma.orchestration.tool;

import com.norma.orchestration.model.StepTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class ToolRegistry {

    private final Map<StepTool, StepToolHandler> handlers = new EnumMap<>(StepTool.class);

    public ToolRegistry(List<StepToolHandler> stepToolHandlers) {
        for (StepToolHandler handler : stepToolHandlers) {
            StepToolHandler previous = handlers.put(handler.tool(), handler);
            if (previous != null) {
                throw new IllegalStateException("Two handlers registered for tool " + handler.tool().wireName());
            }
        }
        log.info("Registered step tools: {}", handlers.keySet());
    }

    public boolean supports(StepTool tool) {
        return tool != null && handlers.containsKey(tool);
    }

    public Optional<StepToolHandler> find(StepTool tool) {
        return Optional.ofNullable(handlers.get(tool));
    }
}
