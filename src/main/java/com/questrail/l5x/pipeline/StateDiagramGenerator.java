package com.questrail.l5x.pipeline;

import com.questrail.l5x.FailureKind;
import com.questrail.l5x.StateDiagramException;
import com.questrail.l5x.api.ControllerProject;
import com.questrail.l5x.config.StateDiagramConfig;
import com.questrail.l5x.graph.TransitionGraph;
import com.questrail.l5x.graph.TransitionGraphBuilder;
import com.questrail.l5x.naming.StateNameResolver;
import com.questrail.l5x.naming.StateNameTable;
import com.questrail.l5x.naming.StateTagResolutionException;
import com.questrail.l5x.naming.StateTagSelector;
import com.questrail.l5x.observability.NullProgressSink;
import com.questrail.l5x.observability.ProgressSink;
import com.questrail.l5x.output.MarkdownDiagramWriter;
import com.questrail.l5x.project.L5xProjectLoader;
import com.questrail.l5x.render.DiagramDocument;
import com.questrail.l5x.render.DiagramRenderer;
import com.questrail.l5x.section.LocatedSection;
import com.questrail.l5x.section.SectionFinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * StateDiagramGenerator
 * =============================================================================
 * Composition root and single entry point of the extraction pipeline.
 *
 * <pre>
 *   L5X file
 *     → L5xProjectLoader        (document provider)
 *       → SectionFinder         (section start)
 *         → StateTagSelector    (state-holder tag)
 *           → TransitionGraphBuilder (+ InstructionParser, end marker)
 *             → StateNameResolver
 *               → DiagramRenderer
 *                 → MarkdownDiagramWriter
 * </pre>
 *
 * <h2>Failure handling</h2>
 * {@link #generate} never throws for bad input. Pipeline-level failures come
 * back as {@link GenerationResult.Failure}; nothing is written in that case.
 * Stage-local failures (one unreadable rung, one missing bit description) are
 * absorbed inside their stage.
 *
 * <h2>Threading</h2>
 * One call processes one document synchronously. Instances hold no mutable
 * state and may be shared.
 */
public final class StateDiagramGenerator
{
    private static final Logger log = LoggerFactory.getLogger(StateDiagramGenerator.class);

    static final String NO_TRANSITIONS_WARNING = "Warning: No state transitions found";
    static final String DEFAULT_NAMES_WARNING = "Warning: No state tag resolved, using default state names";

    private final StateDiagramConfig config;
    private final ProgressSink progress;

    public StateDiagramGenerator(StateDiagramConfig config) {
        this(config, NullProgressSink.INSTANCE);
    }

    public StateDiagramGenerator(StateDiagramConfig config, ProgressSink progress) {
        this.config = Objects.requireNonNull(config, "config");
        this.progress = Objects.requireNonNull(progress, "progress");
    }

    /**
     * Returns {@code <input-stem>_state_diagram.md} next to {@code input}.
     */
    public static Path defaultOutputPath(Path input) {
        String fileName = input.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return input.resolveSibling(stem + "_state_diagram.md");
    }

    /**
     * Runs the whole pipeline: load, compile, write.
     *
     * @param input    the {@code .L5X} export
     * @param output   destination of the markdown document
     * @param stateTag explicit state tag name; empty to auto-detect
     * @return success with statistics, or a classified failure
     */
    public GenerationResult generate(Path input, Path output, Optional<String> stateTag) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(stateTag, "stateTag");

        try {
            progress.onProgress("Loading L5X file: " + input.getFileName());
            ControllerProject project = new L5xProjectLoader(config.commentLanguage()).load(input);

            CompiledDiagram compiled = compile(project, stateTag);
            String diagramText = compiled.document().text();

            progress.onProgress("Saving diagram to: " + output.getFileName());
            new MarkdownDiagramWriter().write(diagramText, output);

            TransitionGraph graph = compiled.graph();
            return new GenerationResult.Success(
                    List.copyOf(graph.states()),
                    graph.edgeCount(),
                    graph.sources().size(),
                    compiled.section().routine().programName(),
                    compiled.section().routine().routineName(),
                    compiled.stateTag(),
                    diagramText,
                    output,
                    compiled.warnings());
        } catch (StateDiagramException e) {
            log.debug("Generation failed ({})", e.kind(), e);
            return new GenerationResult.Failure(e.kind(), e.getMessage(), describe(e));
        } catch (RuntimeException e) {
            log.error("Unexpected failure generating diagram from {}", input, e);
            return new GenerationResult.Failure(FailureKind.UNEXPECTED,
                    "Unexpected error: " + e.getMessage(), describe(e));
        }
    }

    /**
     * Runs the compile stages on an already-loaded project. Performs no I/O.
     *
     * @throws com.questrail.l5x.section.StateLogicNotFoundException if no section is found
     * @throws StateTagResolutionException if no tag resolves and default names are not accepted
     */
    public CompiledDiagram compile(ControllerProject project, Optional<String> stateTag) {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(stateTag, "stateTag");
        List<String> warnings = new ArrayList<>();

        progress.onProgress("Searching for STATE LOGIC section...");
        LocatedSection section = new SectionFinder(config.sectionStrategies()).locate(project);
        progress.onProgress("Found STATE LOGIC in program: " + section.routine().programName()
                + ", Routine: " + section.routine().routineName()
                + " (rung " + section.startIndex() + ", " + section.strategy() + ")");

        Optional<String> tag = selectTag(project, section, stateTag, warnings);

        progress.onProgress("Extracting state transitions...");
        TransitionGraph graph = new TransitionGraphBuilder(config.convention()).build(section);
        if (graph.isEmpty()) {
            warn(warnings, NO_TRANSITIONS_WARNING);
        }
        progress.onProgress("Found " + graph.sources().size() + " source states");

        progress.onProgress("Retrieving state names...");
        StateNameTable names = tag
                .map(t -> new StateNameResolver(config.stateBitMember()).resolveAll(project, t, graph.states()))
                .orElse(StateNameTable.defaults());

        progress.onProgress("Generating Mermaid " + config.grammar().name().toLowerCase() + "...");
        DiagramDocument document = new DiagramRenderer()
                .render(graph, names, section.routine().routineName(), config.grammar());

        return new CompiledDiagram(section, tag, graph, names, document, warnings);
    }

    private Optional<String> selectTag(ControllerProject project,
                                       LocatedSection section,
                                       Optional<String> stateTag,
                                       List<String> warnings) {
        if (stateTag.isEmpty()) {
            progress.onProgress("Auto-detecting state tag...");
        }
        StateTagSelector selector = new StateTagSelector(config.stateTagDataType(), config.stateBitMember());
        try {
            String tag = selector.select(stateTag, project, section);
            progress.onProgress("Using state tag: " + tag);
            return Optional.of(tag);
        } catch (StateTagResolutionException e) {
            if (!config.acceptDefaultNames()) {
                throw e;
            }
            warn(warnings, DEFAULT_NAMES_WARNING);
            return Optional.empty();
        }
    }

    private void warn(List<String> warnings, String message) {
        warnings.add(message);
        progress.onWarning(message);
    }

    private static String describe(Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
