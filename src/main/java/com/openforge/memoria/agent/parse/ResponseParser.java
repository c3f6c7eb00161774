package com.openforge.memoria.agent.parse;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts observation and summary blocks from a provider reply.
 *
 * Deliberately tolerant: text around the blocks is ignored, missing fields
 * become null, an unknown observation type is replaced by "change", and a
 * block without any content is dropped.
 */
@Slf4j
@Component
public class ResponseParser {

    private static final Pattern OBSERVATION_BLOCK =
            Pattern.compile("<observation>(.*?)</observation>", Pattern.DOTALL);
    private static final Pattern SUMMARY_BLOCK =
            Pattern.compile("<summary>(.*?)</summary>", Pattern.DOTALL);
    private static final Pattern SKIP_SUMMARY =
            Pattern.compile("<skip_summary\\b[^>]*/?>", Pattern.DOTALL);

    private static final Set<String> OBSERVATION_TYPES =
            Set.of("bugfix", "feature", "refactor", "change", "discovery", "decision");
    private static final String DEFAULT_TYPE = "change";

    public List<ParsedObservation> parseObservations(String text) {
        List<ParsedObservation> observations = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return observations;
        }
        Matcher matcher = OBSERVATION_BLOCK.matcher(text);
        while (matcher.find()) {
            String block = matcher.group(1);
            ParsedObservation observation = new ParsedObservation(
                    normalizeType(field(block, "type")),
                    field(block, "title"),
                    field(block, "subtitle"),
                    items(block, "facts", "fact"),
                    field(block, "narrative"),
                    items(block, "concepts", "concept"),
                    items(block, "files_read", "file"),
                    items(block, "files_modified", "file"));
            if (observation.title() == null && observation.narrative() == null && observation.facts().isEmpty()) {
                log.debug("[Parser] Dropping empty observation block");
                continue;
            }
            observations.add(observation);
        }
        return observations;
    }

    public Optional<ParsedSummary> parseSummary(String text) {
        if (text == null || text.isBlank() || SKIP_SUMMARY.matcher(text).find()) {
            return Optional.empty();
        }
        Matcher matcher = SUMMARY_BLOCK.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String block = matcher.group(1);
        ParsedSummary summary = new ParsedSummary(
                field(block, "request"),
                field(block, "investigated"),
                field(block, "learned"),
                field(block, "completed"),
                field(block, "next_steps"),
                field(block, "notes"));
        if (summary.request() == null && summary.learned() == null && summary.completed() == null) {
            log.debug("[Parser] Dropping empty summary block");
            return Optional.empty();
        }
        return Optional.of(summary);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static String field(String block, String name) {
        Matcher matcher = tag(name).matcher(block);
        if (!matcher.find()) return null;
        String value = matcher.group(1).trim();
        return value.isEmpty() ? null : value;
    }

    private static List<String> items(String block, String container, String item) {
        String inner = field(block, container);
        List<String> values = new ArrayList<>();
        if (inner == null) return values;
        Matcher matcher = tag(item).matcher(inner);
        while (matcher.find()) {
            String value = matcher.group(1).trim();
            if (!value.isEmpty()) values.add(value);
        }
        return values;
    }

    private static Pattern tag(String name) {
        return Pattern.compile("<" + name + ">(.*?)</" + name + ">", Pattern.DOTALL);
    }

    private static String normalizeType(String type) {
        if (type == null) return DEFAULT_TYPE;
        String lower = type.trim().toLowerCase(Locale.ROOT);
        return OBSERVATION_TYPES.contains(lower) ? lower : DEFAULT_TYPE;
    }
}
