package frontend;

import frontend.grammar.QuilLexer;
import frontend.grammar.QuilParser;
import ir.Program;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import util.logging.LogManager;
import util.logging.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Quil-T text to {@link Program}. Either the whole source parses or a
 * {@link QuilParseException} lists every syntax error found.
 */
public final class QuilFrontend {
    private static final Logger log = LogManager.getLogger(QuilFrontend.class);

    private QuilFrontend() {
    }

    public static Program parse(Path path) throws IOException, QuilParseException {
        return parse(CharStreams.fromPath(path), path.getFileName().toString());
    }

    public static Program parse(String source, String sourceName) throws QuilParseException {
        return parse(CharStreams.fromString(source, sourceName), sourceName);
    }

    private static Program parse(CharStream input, String sourceName) throws QuilParseException {
        CollectingErrorListener errors = new CollectingErrorListener();

        QuilLexer lex = new QuilLexer(input);
        lex.removeErrorListeners();
        lex.addErrorListener(errors);
        CommonTokenStream tokens = new CommonTokenStream(lex);
        QuilParser parser = new QuilParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        QuilParser.ProgramContext tree = parser.program();
        if (!errors.errors.isEmpty()) {
            throw new QuilParseException(sourceName, errors.errors);
        }

        String name = sourceName.endsWith(".quil")
                ? sourceName.substring(0, sourceName.length() - ".quil".length())
                : sourceName;
        Program program = new InstructionGenerator(name, sourceName).generate(tree);
        log.debug("parsed {}: {} instructions, {} declared frames", sourceName, program.size(),
                program.getDeclaredFrames().size());
        return program;
    }

    private static class CollectingErrorListener extends BaseErrorListener {
        private final List<QuilParseException.ParseError> errors = new ArrayList<>();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                int charPositionInLine, String msg, RecognitionException e) {
            errors.add(new QuilParseException.ParseError(line, charPositionInLine, msg));
        }
    }
}
