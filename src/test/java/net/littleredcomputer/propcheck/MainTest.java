package net.littleredcomputer.propcheck;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;

import static org.hamcrest.Matchers.*;
import static org.junit.Assert.assertThat;

public class MainTest {
    @Rule public TemporaryFolder tmp = new TemporaryFolder();

    private static final String nl = System.lineSeparator();

    private int status;
    private String output;

    private void run(String... args) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (PrintStream out = new PrintStream(bytes, true, "UTF-8")) {
            status = Main.run(args, out);
        } catch (UnsupportedEncodingException e) {
            throw new AssertionError(e);
        }
        output = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
    }

    private static String resource(String name) {
        try {
            return new File(MainTest.class.getClassLoader().getResource(name).toURI()).getPath();
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    private String file(String... lines) throws IOException {
        File f = tmp.newFile();
        Files.write(f.toPath(), Arrays.asList(lines), StandardCharsets.UTF_8);
        return f.getPath();
    }

    @Test
    public void verified() {
        run(resource("modus-ponens.prop"));
        assertThat(status, is(0));
        assertThat(output, is("Theorem has been verified!" + nl));
    }

    @Test
    public void inconsistent() {
        run(resource("inconsistent.prop"));
        assertThat(status, is(0));
        assertThat(output, is("Axioms are not consistent!" + nl));
    }

    @Test
    public void falsified() {
        run(resource("disjunction.prop"));
        assertThat(status, is(1));
        assertThat(output, is(Joiner.on(nl).join(
                "Theorem is false!",
                "Counterexample:",
                String.format("%40s Value", "Proposition"),
                String.format("%40s False", "A"),
                String.format("%40s True", "B"),
                "")));
    }

    @Test
    public void contradiction() {
        run(resource("contradiction.prop"));
        assertThat(status, is(1));
        assertThat(output, startsWith("Theorem is false!" + nl));
        assertThat(output, endsWith(String.format("%40s False", "P") + nl));
    }

    @Test
    public void falsifiedWithoutVariablesHasNoTable() throws IOException {
        run(file("T", "F"));
        assertThat(status, is(1));
        assertThat(output, is("Theorem is false!" + nl));
    }

    @Test
    public void parallelGivesTheSameReport() {
        run(resource("disjunction.prop"));
        String sequential = output;
        run("-parallel", "-loginterval", "PT0S", resource("disjunction.prop"));
        assertThat(status, is(1));
        assertThat(output, is(sequential));
    }

    @Test
    public void puzzles() {
        run(resource("knights.prop"));
        assertThat(status, is(0));
        run(resource("syllogism.prop"));
        assertThat(output, is("Theorem has been verified!" + nl));
    }

    @Test
    public void usage() {
        run();
        assertThat(status, is(1));
        assertThat(output, is("Usage: propcheck <filename>" + nl));
    }

    @Test
    public void badOptions() {
        run("-nosuchoption", resource("modus-ponens.prop"));
        assertThat(status, is(1));
        assertThat(output, startsWith("Usage:"));
        run("-loginterval", "soon", resource("modus-ponens.prop"));
        assertThat(status, is(1));
        assertThat(output, startsWith("Usage:"));
    }

    @Test
    public void missingFile() {
        String f = new File(tmp.getRoot(), "absent.prop").getPath();
        run(f);
        assertThat(status, is(1));
        assertThat(output, is("Error: Cannot open " + f + nl));
    }

    @Test
    public void syntaxError() throws IOException {
        String f = file("// first", "[A]", "( [A] => )", "[A]");
        run(f);
        assertThat(status, is(1));
        assertThat(output, is("Error: Syntax Error line 3 in " + f + nl));
    }

    @Test
    public void nothingToCheck() throws IOException {
        String f = file("// just a comment", "");
        run(f);
        assertThat(status, is(1));
        assertThat(output, is("Error: No theorem to check in " + f + nl));
    }

    @Test
    public void deeplyNestedPropositions() throws IOException {
        final int depth = 10000;
        String bangs = Strings.repeat("!", depth);
        run(file("[A]", bangs + "[A]"));
        assertThat(status, is(0));
        assertThat(output, is("Theorem has been verified!" + nl));
        run(file("[A]", "!" + bangs + "[A]"));
        assertThat(status, is(1));
        assertThat(output, startsWith("Theorem is false!" + nl));
        String parens = Strings.repeat("(", depth) + "[A]" + Strings.repeat(" and [B])", depth);
        run(file("[A]", "[B]", parens));
        assertThat(status, is(0));
        assertThat(output, is("Theorem has been verified!" + nl));
    }

    @Test
    public void invalidUtf8IsNotReportedAsMissing() throws IOException {
        File f = tmp.newFile();
        Files.write(f.toPath(), "( [caf\u00e9] or not [caf\u00e9] )\n".getBytes(StandardCharsets.ISO_8859_1));
        run(f.getPath());
        assertThat(status, is(1));
        assertThat(output, is("Error: Cannot decode " + f.getPath() + " as UTF-8" + nl));
        Files.write(f.toPath(), "( [caf\u00e9] or not [caf\u00e9] )\n".getBytes(StandardCharsets.UTF_8));
        run(f.getPath());
        assertThat(status, is(0));
        assertThat(output, is("Theorem has been verified!" + nl));
    }

    @Test
    public void standardInputIsReadButNotClosed() {
        InputStream stdin = System.in;
        final boolean[] closed = {false};
        byte[] input = "[A]\n( [A] => [B] )\n[B]\n".getBytes(StandardCharsets.UTF_8);
        try {
            System.setIn(new FilterInputStream(new ByteArrayInputStream(input)) {
                @Override
                public void close() throws IOException {
                    closed[0] = true;
                    super.close();
                }
            });
            run("-");
        } finally {
            System.setIn(stdin);
        }
        assertThat(status, is(0));
        assertThat(output, is("Theorem has been verified!" + nl));
        assertThat(closed[0], is(false));
    }

    @Test
    public void tooManyVariables() throws IOException {
        String[] lines = new String[33];
        for (int i = 0; i < lines.length; ++i) lines[i] = "[v" + i + "]";
        run(file(lines));
        assertThat(status, is(1));
        assertThat(output, is("error: over 32 propositional variables, exiting." + nl));
    }
}
