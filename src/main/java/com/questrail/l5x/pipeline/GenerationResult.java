package com.questrail.l5x.pipeline;

import com.questrail.l5x.FailureKind;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link StateDiagramGenerator#generate}.
 *
 * <p>Exactly one of two shapes:</p>
 * <ul>
 *   <li>{@link Success} - the document was written; carries the statistics
 *       and the rendered diagram text</li>
 *   <li>{@link Failure} - nothing was written; carries a classification and a
 *       human-readable message</li>
 * </ul>
 */
public sealed interface GenerationResult
{
    boolean isSuccess();

    /**
     * @param states        all state ids in the graph, ascending
     * @param edgeCount     number of distinct transitions
     * @param sourceCount   number of states with outgoing transitions
     * @param programName   program holding the state-logic routine
     * @param routineName   routine holding the state-logic section
     * @param stateTag      tag the state names were read from; empty in
     *                      default-name mode
     * @param diagramText   the Mermaid text, without the markdown envelope
     * @param output        where the document was written
     * @param warnings      non-fatal conditions encountered along the way
     */
    record Success(
            List<Integer> states,
            int edgeCount,
            int sourceCount,
            String programName,
            String routineName,
            Optional<String> stateTag,
            String diagramText,
            Path output,
            List<String> warnings
    ) implements GenerationResult {

        public Success {
            states = List.copyOf(Objects.requireNonNull(states, "states"));
            Objects.requireNonNull(programName, "programName");
            Objects.requireNonNull(routineName, "routineName");
            Objects.requireNonNull(stateTag, "stateTag");
            Objects.requireNonNull(diagramText, "diagramText");
            Objects.requireNonNull(output, "output");
            warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        public String message() {
            return "Diagram generated successfully";
        }
    }

    /**
     * @param kind    failure classification
     * @param message short human-readable summary
     * @param detail  underlying cause, for diagnostics
     */
    record Failure(FailureKind kind, String message, String detail) implements GenerationResult {

        public Failure {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(detail, "detail");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
