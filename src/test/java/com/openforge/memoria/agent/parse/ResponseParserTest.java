package com.openforge.memoria.agent.parse;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseParserTest {

    private final ResponseParser parser = new ResponseParser();

    @Test
    void parsesObservationWithNestedLists() {
        String reply = """
                Here is what I saw.
                <observation>
                  <type>BugFix</type>
                  <title>Null check in loader</title>
                  <subtitle>Loader skipped empty files</subtitle>
                  <facts>
                    <fact>Loader returned null for empty files</fact>
                    <fact>Callers now get an empty list</fact>
                  </facts>
                  <narrative>The loader was fixed.</narrative>
                  <concepts><concept>problem-solution</concept></concepts>
                  <files_read><file>src/Loader.java</file></files_read>
                  <files_modified><file>src/Loader.java</file><file>src/LoaderTest.java</file></files_modified>
                </observation>
                """;

        List<ParsedObservation> observations = parser.parseObservations(reply);

        assertThat(observations).hasSize(1);
        ParsedObservation observation = observations.get(0);
        assertThat(observation.type()).isEqualTo("bugfix");
        assertThat(observation.title()).isEqualTo("Null check in loader");
        assertThat(observation.facts()).containsExactly(
                "Loader returned null for empty files", "Callers now get an empty list");
        assertThat(observation.concepts()).containsExactly("problem-solution");
        assertThat(observation.filesRead()).containsExactly("src/Loader.java");
        assertThat(observation.filesModified()).containsExactly("src/Loader.java", "src/LoaderTest.java");
    }

    @Test
    void unknownTypeBecomesChangeAndEmptyBlocksAreDropped() {
        String reply = """
                <observation><type>musing</type><title>Renamed config key</title></observation>
                <observation><type>feature</type></observation>
                <observation><title>Added retry</title></observation>
                """;

        List<ParsedObservation> observations = parser.parseObservations(reply);

        assertThat(observations).extracting(ParsedObservation::type).containsExactly("change", "change");
        assertThat(observations).extracting(ParsedObservation::title)
                .containsExactly("Renamed config key", "Added retry");
    }

    @Test
    void replyWithoutBlocksYieldsNothing() {
        assertThat(parser.parseObservations("Nothing worth recording.")).isEmpty();
        assertThat(parser.parseObservations(null)).isEmpty();
        assertThat(parser.parseSummary("plain text")).isEmpty();
    }

    @Test
    void parsesSummary() {
        String reply = """
                <summary>
                  <request>Fix the flaky upload test</request>
                  <investigated>Upload retry timing</investigated>
                  <learned>The mock server closed connections early</learned>
                  <completed>Test now waits for the server</completed>
                  <next_steps>Watch CI for a week</next_steps>
                  <notes></notes>
                </summary>
                """;

        Optional<ParsedSummary> summary = parser.parseSummary(reply);

        assertThat(summary).isPresent();
        assertThat(summary.get().request()).isEqualTo("Fix the flaky upload test");
        assertThat(summary.get().nextSteps()).isEqualTo("Watch CI for a week");
        assertThat(summary.get().notes()).isNull();
    }

    @Test
    void skipSummaryWins() {
        String reply = "<skip_summary reason=\"nothing happened\"/><summary><request>x</request></summary>";

        assertThat(parser.parseSummary(reply)).isEmpty();
    }
}
