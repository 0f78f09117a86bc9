package com.jeevo.validation.orchestrator;

import java.util.function.Function;
import java.util.function.Predicate;

public record Rule(
        String name,
        Predicate<HeuristicSignals> when,
        Function<HeuristicSignals, Verdict> outcome
) {}
