package com.cppformatter.cli;

import com.cppformatter.config.ConfigurationLoader;
import com.cppformatter.config.FormatterConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FormatterCliTest {

    private static final String UNFORMATTED = "int main() {\nreturn 0;\n}\n";
    private static final String FORMATTED = "int main()\n{\n  return 0;\n}\n";

    @TempDir
    Path tempDir;

    @Test
    void checkReportsFilesThatWouldChange() throws IOException {
        Path file = write("src/main.cpp", UNFORMATTED);

        int exitCode = FormatterCli.run(args("check", tempDir.resolve("src")));

        assertThat(exitCode).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(Files.readString(file)).isEqualTo(UNFORMATTED);
    }

    @Test
    void formatRewritesFilesAndCheckThenPasses() throws IOException {
        Path file = write("src/main.cpp", UNFORMATTED);
        Path header = write("src/util.h", "int add(int a, int b);\n");

        assertThat(FormatterCli.run(args("format", tempDir.resolve("src")))).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(file)).isEqualTo(FORMATTED);
        assertThat(Files.readString(header)).isEqualTo("int add(int a, int b);\n");

        assertThat(FormatterCli.run(args("check", tempDir.resolve("src")))).isEqualTo(FormatterCli.EXIT_OK);
    }

    @Test
    void formatAcceptsASingleFile() throws IOException {
        Path file = write("one.c", "void f() { if (x) g(); }\n");

        assertThat(FormatterCli.run(args("format", file))).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(file)).isEqualTo("void f()\n{\n  if (x)\n  {\n    g();\n  }\n}\n");
    }

    @Test
    void fatalErrorFailsTheRunAndLeavesTheFileAlone() throws IOException {
        Path file = write("bad.cpp", "void f() {\n");

        assertThat(FormatterCli.run(args("format", file))).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(Files.readString(file)).isEqualTo("void f() {\n");
    }

    @Test
    void ciModePrintsAResultLine() throws IOException {
        write("src/main.cpp", UNFORMATTED);
        write("src/done.cpp", FORMATTED);

        String output = captureOutput(() -> FormatterCli.run(args("check", tempDir.resolve("src"))));

        assertThat(output).contains("RESULT:files=2;changed=1;failed=0;warnings=0");
        assertThat(output).doesNotContain("\u001B[");
    }

    @Test
    void ignorePatternsFromTheConfigFileAreHonoured() throws IOException {
        Path vendored = write("src/vendor/lib.c", UNFORMATTED);
        Path own = write("src/own.c", UNFORMATTED);
        Path config = write("format.yml", "general:\n  ignoreFiles:\n    - \"vendor/**\"\nformat:\n  indentWidth: 4\n");

        int exitCode = FormatterCli.run(new String[]{
                "format", tempDir.resolve("src").toString(), "--config=" + config, "--ci", "--threads=2"});

        assertThat(exitCode).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(own)).isEqualTo("int main()\n{\n    return 0;\n}\n");
        assertThat(Files.readString(vendored)).isEqualTo(UNFORMATTED);
    }

    @Test
    void includePatternRestrictsTheFileSet() throws IOException {
        Path source = write("src/a.cpp", UNFORMATTED);
        Path header = write("src/a.h", UNFORMATTED);

        int exitCode = FormatterCli.run(new String[]{
                "format", tempDir.resolve("src").toString(), "--include=*.h", "--config=" + tempDir.resolve("none.yml"), "--ci"});

        assertThat(exitCode).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(Files.readString(header)).isEqualTo(FORMATTED);
        assertThat(Files.readString(source)).isEqualTo(UNFORMATTED);
    }

    @Test
    void badInvocationsFail() {
        assertThat(FormatterCli.run(new String[0])).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(FormatterCli.run(new String[]{"frobnicate"})).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(FormatterCli.run(new String[]{"check"})).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(FormatterCli.run(new String[]{"check", tempDir.resolve("missing").toString()}))
                .isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(FormatterCli.run(new String[]{"--version"})).isEqualTo(FormatterCli.EXIT_OK);
        assertThat(FormatterCli.run(new String[]{"--help"})).isEqualTo(FormatterCli.EXIT_OK);
    }

    @Test
    void initWritesTheDefaultConfiguration() throws IOException {
        Path config = tempDir.resolve("conf/.cppformat.yml");
        String[] init = {"init", "--config=" + config};

        assertThat(FormatterCli.run(init)).isEqualTo(FormatterCli.EXIT_OK);
        FormatterConfig loaded = ConfigurationLoader.loadConfig(config);
        assertThat(loaded.getFormatConfiguration().getIndentWidth()).isEqualTo(2);
        assertThat(loaded.getIgnorePatterns()).contains("build/**");

        assertThat(FormatterCli.run(init)).isEqualTo(FormatterCli.EXIT_FAILURE);
        assertThat(FormatterCli.run(new String[]{"init", "--config=" + config, "--force"}))
                .isEqualTo(FormatterCli.EXIT_OK);
    }

    @Test
    void ignoreGlobsMatchRelativePaths() {
        Path base = Path.of("project");
        List<String> patterns = List.of("build/**", "**/*.pb.h");

        assertThat(FormatterCli._isIgnored(base.resolve("build/gen/a.c"), base, patterns)).isTrue();
        assertThat(FormatterCli._isIgnored(base.resolve("msg.pb.h"), base, patterns)).isTrue();
        assertThat(FormatterCli._isIgnored(base.resolve("src/msg.pb.h"), base, patterns)).isTrue();
        assertThat(FormatterCli._isIgnored(base.resolve("src/main.c"), base, patterns)).isFalse();
        assertThat(FormatterCli._isIgnored(base.resolve("src/main.c"), base, List.of())).isFalse();
    }

    @Test
    void includeGlobMatchesTheFileName() {
        assertThat(FormatterCli._matchesIncludePattern(Path.of("src/a.h"), "*.h")).isTrue();
        assertThat(FormatterCli._matchesIncludePattern(Path.of("src/a.cpp"), "*.h")).isFalse();
        assertThat(FormatterCli._matchesIncludePattern(Path.of("src/a.cpp"), null)).isTrue();
    }

    @Test
    void atomicWriteReplacesContentWithoutLeftovers() throws IOException {
        Path file = write("w.cpp", "old\n");

        FormatterCli._writeAtomically(file, "new\n");

        assertThat(Files.readString(file)).isEqualTo("new\n");
        try (Stream<Path> entries = Files.list(tempDir)) {
            assertThat(entries.map(p -> p.getFileName().toString()).collect(Collectors.toList()))
                    .containsExactly("w.cpp");
        }
    }

    private String[] args(String command, Path path) {
        return new String[]{command, path.toString(), "--config=" + tempDir.resolve("none.yml"), "--ci"};
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static String captureOutput(Runnable action) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            action.run();
        } finally {
            System.setOut(original);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
