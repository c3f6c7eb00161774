package com.openforge.memoria.agent.parse;

public record ParsedSummary(
        String request,
        String investigated,
        String learned,
        String completed,
        String nextSteps,
        String notes
) {}
