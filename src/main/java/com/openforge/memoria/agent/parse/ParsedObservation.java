package com.openforge.memoria.agent.parse;

import java.util.List;

public record ParsedObservation(
        String type,
        String title,
        String subtitle,
        List<String> facts,
        String narrative,
        List<String> concepts,
        List<String> filesRead,
        List<String> filesModified
) {}
