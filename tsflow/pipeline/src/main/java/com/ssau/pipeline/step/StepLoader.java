package com.ssau.pipeline.step;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import com.ssau.pipeline.exception.StepContractViolationException;

@Slf4j
public final class StepLoader {

    private StepLoader() {}

    public static Step load(String className) {
        String name = className.trim();
        Class<?> type;
        try {
            type = Class.forName(name, true, StepLoader.class.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new StepContractViolationException("step class not found: " + name, e);
        }

        if (!Step.class.isAssignableFrom(type)) {
            throw new StepContractViolationException(name + " doesn't seem to be a pipeline step");
        }

        try {
            Step step = (Step) type.getDeclaredConstructor().newInstance();
            log.debug("Loaded step {}", name);
            return step;
        } catch (ReflectiveOperationException e) {
            throw new StepContractViolationException("cannot instantiate step " + name
                + " (a public no-arg constructor is required)", e);
        }
    }

    /**
     * Loads a comma separated list of step classes, skipping blank entries.
     */
    public static List<Step> loadAll(String classNames) {
        List<Step> steps = new ArrayList<>();
        if (classNames == null) {
            return steps;
        }
        for (String name : classNames.split(",")) {
            if (!name.isBlank()) {
                steps.add(load(name));
            }
        }
        return steps;
    }
}
