package com.questrail.l5x.cli;

import com.questrail.l5x.config.StateDiagramConfig;
import com.questrail.l5x.observability.ProgressSink;
import com.questrail.l5x.observability.Slf4jProgressSink;
import com.questrail.l5x.pipeline.GenerationResult;
import com.questrail.l5x.pipeline.StateDiagramGenerator;
import com.questrail.l5x.render.DiagramGrammar;
import com.questrail.l5x.section.SectionStrategy;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Command-line front end.
 *
 * Usage:
 * <pre>
 *   l5x-state-diagram input.L5X
 *   l5x-state-diagram input.L5X -o diagram.md
 *   l5x-state-diagram input.L5X -t _A28_PH -g state
 * </pre>
 *
 * Exit codes: 0 on success, 1 when the pipeline reports a failure, 2 on a
 * usage error.
 */
@Command(
    name = "l5x-state-diagram",
    mixinStandardHelpOptions = true,
    description = "Generate a Mermaid state diagram from the STATE LOGIC section of an L5X export"
)
public final class StateDiagramCommand implements Callable<Integer> {

    /** Values accepted by {@code --grammar}. */
    enum GrammarOption {
        flowchart(DiagramGrammar.FLOWCHART),
        state(DiagramGrammar.STATE_DIAGRAM);

        final DiagramGrammar grammar;

        GrammarOption(DiagramGrammar grammar) {
            this.grammar = grammar;
        }
    }

    /** Values accepted by {@code --strategy}. */
    enum StrategyOption {
        instruction(SectionStrategy.INSTRUCTION_MARKER),
        comment(SectionStrategy.COMMENT_MARKER);

        final SectionStrategy strategy;

        StrategyOption(SectionStrategy strategy) {
            this.strategy = strategy;
        }
    }

    @Parameters(paramLabel = "<input>", description = "Path to the input .L5X file")
    private Path input;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>",
            description = "Output markdown file (default: <input>_state_diagram.md)")
    private Path output;

    @Option(names = {"-t", "--tag"}, paramLabel = "<name>",
            description = "State tag name (default: auto-detect)")
    private String tag;

    @Option(names = {"-g", "--grammar"}, paramLabel = "<grammar>",
            description = "Diagram grammar: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private GrammarOption grammar = GrammarOption.flowchart;

    @Option(names = {"--strategy"}, paramLabel = "<strategy>", split = ",",
            description = "Section-start conventions to try, in order: ${COMPLETION-CANDIDATES} (default: instruction,comment)")
    private List<StrategyOption> strategies;

    @Option(names = {"--end-marker"}, paramLabel = "<text>",
            description = "Rung comment text that ends the section (default: ${DEFAULT-VALUE})")
    private String endMarker = "FAULT";

    @Option(names = {"--transition-offset"}, paramLabel = "<n>",
            description = "Rungs between the section start and the first transition rung (default: ${DEFAULT-VALUE})")
    private int transitionOffset = 2;

    @Option(names = {"--state-type"}, paramLabel = "<type>",
            description = "Data type identifying the state tag (default: ${DEFAULT-VALUE})")
    private String stateType = StateDiagramConfig.DEFAULT_STATE_TAG_DATA_TYPE;

    @Option(names = {"--accept-default-names"},
            description = "Render with 'State n' names when no state tag can be resolved")
    private boolean acceptDefaultNames;

    @Option(names = {"--language"}, paramLabel = "<lang>",
            description = "Preferred language for localized comments (default: ${DEFAULT-VALUE})")
    private String language = "en-US";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private ProgressSink progressSink = new Slf4jProgressSink();

    public static void main(String[] args) {
        System.exit(new CommandLine(new StateDiagramCommand()).execute(args));
    }

    StateDiagramCommand withProgressSink(ProgressSink sink) {
        this.progressSink = sink;
        return this;
    }

    StateDiagramConfig toConfig() {
        StateDiagramConfig.Builder builder = StateDiagramConfig.builder()
                .withGrammar(grammar.grammar)
                .withEndMarker(endMarker)
                .withTransitionOffset(transitionOffset)
                .withStateTagDataType(stateType)
                .withAcceptDefaultNames(acceptDefaultNames)
                .withCommentLanguage(language);
        if (strategies != null && !strategies.isEmpty()) {
            builder.withSectionStrategies(strategies.stream().map(s -> s.strategy).distinct().toList());
        }
        return builder.build();
    }

    @Override
    public Integer call() {
        StateDiagramConfig config;
        try {
            config = toConfig();
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        Path destination = output != null ? output : StateDiagramGenerator.defaultOutputPath(input);
        GenerationResult result = new StateDiagramGenerator(config, progressSink)
                .generate(input, destination, Optional.ofNullable(tag));

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (result instanceof GenerationResult.Success success) {
            out.println("Success! Diagram saved to: " + success.output());
            out.println("States found: " + success.states());
            out.println("Total transitions: " + success.edgeCount());
            out.flush();
            return 0;
        }

        GenerationResult.Failure failure = (GenerationResult.Failure) result;
        err.println("Failed to generate diagram: " + failure.message());
        err.println("Error details (" + failure.kind() + "): " + failure.detail());
        err.flush();
        return 1;
    }
}
