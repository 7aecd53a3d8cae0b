package io.cflow.parser;

import io.cflow.model.SourceFile;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PythonParserTest {

    private final PythonParser parser = new PythonParser();

    @Test
    void parse_validSourceProducesModule() throws ParseException {
        ParsedModule module = parser.parse(new SourceFile(Path.of("app.py"), """
                def main():
                    print("hi")
                """));

        assertThat(module.root().getType()).isEqualTo(PythonNodeTypes.MODULE);
        assertThat(module.file()).isEqualTo(Path.of("app.py"));
        assertThat(module.root().getNamedChildCount()).isEqualTo(1);
    }

    @Test
    void parse_emptyFileIsValid() throws ParseException {
        ParsedModule module = parser.parse(new SourceFile(Path.of("empty.py"), ""));

        assertThat(module.root().getNamedChildCount()).isZero();
    }

    @Test
    void parse_syntaxErrorIsRejected() {
        assertThatThrownBy(() -> parser.parse(new SourceFile(Path.of("bad.py"), """
                def ok():
                    pass

                def broken(:
                    return
                """)))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("bad.py")
                .hasMessageContaining("syntax error")
                .satisfies(e -> assertThat(((ParseException) e).getLine()).isPositive());
    }

    @Test
    void parse_reusesParserAcrossCalls() throws ParseException {
        for (int i = 0; i < 3; i++) {
            ParsedModule module = parser.parse(new SourceFile(Path.of("f" + i + ".py"), "x = " + i + "\n"));
            assertThat(module.root().hasError()).isFalse();
        }
    }
}
