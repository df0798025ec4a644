package com.mpl;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {
  @TempDir
  Path directory;

  private static int run(String... args) {
    return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
  }

  @Test
  void evaluatesAtEveryWorldOfJsonModel() throws IOException {
    Path model = Files.writeString(directory.resolve("model.json"), """
        {"worlds": [{"valuation": ["p"], "successors": {"a": [1]}}, {"valuation": []}]}
        """);
    Path output = directory.resolve("out.txt");

    assertThat(run("--model", model.toString(), "-f", "a ? p", "-O", output.toString())).isZero();
    assertThat(Files.readAllLines(output)).containsExactly("(a ? p)", "world 0: false", "world 1: true");
  }

  @Test
  void evaluatesAtOneWorldOfModelString() throws IOException {
    Path output = directory.resolve("out.txt");
    Path dot = directory.resolve("model.dot");
    Path modelString = directory.resolve("model.txt");

    assertThat(run("--model-string", "ApSa1;AS;", "-f", "a ? p", "-w", "0", "--notation", "unicode",
        "--write-dot", dot.toString(), "--write-model-string", modelString.toString(),
        "-O", output.toString())).isZero();
    assertThat(Files.readAllLines(output)).containsExactly("(a K p)", "world 0: false");
    assertThat(Files.readString(modelString)).isEqualTo("ApSa1;AS;");
    assertThat(Files.readString(dot)).startsWith("digraph {").contains("W_0 -> W_1 [label=\"a\"]");
  }

  @Test
  void writesStandardOutputAsUtf8() {
    PrintStream original = System.out;
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    System.setOut(new PrintStream(buffer, true, StandardCharsets.ISO_8859_1));
    try {
      assertThat(run("--model-string", "AS;", "-f", "~[]p", "--notation", "unicode")).isZero();
    } finally {
      System.setOut(original);
    }
    assertThat(buffer.toString(StandardCharsets.UTF_8).lines()).containsExactly("¬□p", "world 0: false");
  }

  @Test
  void failsOnMissingWorld() {
    assertThat(run("--model-string", "AS;", "-f", "p", "-w", "3", "-O", directory.resolve("out").toString()))
        .isNotZero();
  }
}
