package com.mpl;

import static picocli.CommandLine.ArgGroup;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

import com.google.common.base.Stopwatch;
import com.mpl.evaluation.TruthEvaluator;
import com.mpl.model.KripkeModel;
import com.mpl.output.DotWriter;
import com.mpl.output.Notation;
import com.mpl.parser.ModelParser;
import com.mpl.parser.ModelString;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import picocli.CommandLine;

@Command(
    name = "mpl",
    mixinStandardHelpOptions = true,
    version = "Multi-agent epistemic model checker 0.1",
    description = "Evaluates epistemic modal logic formulas on Kripke models")
public final class Main implements Callable<Integer> {
  private static final Logger log = Logger.getLogger(Main.class.getName());

  private static PrintStream open(String output) throws IOException {
    // Standard output stays open, several writers may share it
    return "-".equals(output)
        ? new PrintStream(System.out, true, StandardCharsets.UTF_8) {
            @Override
            public void close() {
              flush();
            }
          }
        : new PrintStream(new BufferedOutputStream(Files.newOutputStream(Path.of(output))), false,
            StandardCharsets.UTF_8);
  }

  private static <S> void writeIfPresent(@Nullable String output, S object, BiConsumer<S, PrintStream> formatter)
      throws IOException {
    if (output != null) {
      try (var stream = open(output)) {
        formatter.accept(object, stream);
      }
    }
  }

  @ArgGroup(heading = "model", multiplicity = "1")
  private ModelSource modelSource;

  @Option(
      names = {"-f", "--formula"},
      required = true,
      description = "Formula to evaluate, e.g. \"a,b ?C (p -> a ? q)\"")
  private String formula;

  @Nullable
  @Option(
      names = {"-w", "--world"},
      description = "World to evaluate at (default: every world)")
  private Integer world;

  @Option(
      names = {"--notation"},
      description = "Notation used to echo the formula. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
  private Notation notation = Notation.ASCII;

  @Nullable
  @Option(
      names = {"--write-dot"},
      description = "Write the model in dot format")
  private String writeDot;

  @Nullable
  @Option(
      names = {"--write-model-string"},
      description = "Write the model in its compact string form")
  private String writeModelString;

  @Option(
      names = {"-O", "--output"},
      description = "Write the truth values")
  private String writeOutput = "-";

  static class ModelSource {
    @Nullable
    @Option(names = "--model", description = "Model file in JSON format")
    private String json;

    @Nullable
    @Option(names = "--model-string", description = "Model in compact string form")
    private String string;
  }

  Main() {}

  public static void main(String[] args) {
    System.exit(new CommandLine(new Main())
        .setCaseInsensitiveEnumValuesAllowed(true)
        .execute(args));
  }

  private KripkeModel parseModel() throws IOException {
    if (modelSource.json == null) {
      assert modelSource.string != null;
      return ModelString.deserialize(modelSource.string);
    }
    try (BufferedReader reader = Files.newBufferedReader(Path.of(modelSource.json))) {
      return ModelParser.parse(reader);
    }
  }

  @Override
  public Integer call() throws Exception {
    KripkeModel model = parseModel();
    writeIfPresent(writeDot, model, DotWriter::writeModel);
    writeIfPresent(writeModelString, model, (m, stream) -> stream.print(ModelString.serialize(m)));

    Wff wff = Wff.parse(formula);
    Stopwatch timer = Stopwatch.createStarted();
    Map<Integer, Boolean> truth = world == null
        ? TruthEvaluator.truthAtAllWorlds(model, wff)
        : Map.of(world, TruthEvaluator.truth(model, world, wff));
    log.log(Level.INFO, () -> "Evaluation took %s".formatted(timer));

    try (var stream = open(writeOutput)) {
      stream.println(wff.format(notation));
      truth.forEach((index, value) -> stream.printf("world %d: %s%n", index, value));
    }
    return 0;
  }
}
