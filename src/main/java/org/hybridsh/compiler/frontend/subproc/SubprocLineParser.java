package org.hybridsh.compiler.frontend.subproc;

import org.hybridsh.compiler.frontend.parser.ast.Block;
import org.hybridsh.compiler.frontend.parser.ast.ExpressionStatement;
import org.hybridsh.compiler.frontend.parser.ast.Module;
import org.hybridsh.compiler.frontend.parser.ast.SourcePosition;
import org.hybridsh.compiler.frontend.parser.ast.SubprocCall;

import java.util.ArrayList;
import java.util.List;

/**
 * Parser for one line of subprocess syntax.
 * <p>
 * Accepted forms (surrounding whitespace allowed):
 * <pre>
 * $[cmd arg ...]    uncaptured, output goes to the terminal
 * $(cmd arg ...)    captured, output becomes a value
 * </pre>
 * Words are separated by whitespace. Single quotes keep their content verbatim; double
 * quotes additionally honour {@code \"} and {@code \\}. Quoted and unquoted parts that touch
 * form one word, so {@code --name="a b"} is the single word {@code --name=a b}.
 *
 * <p><strong>Thread Safety:</strong> Stateless, safe to share.
 */
public class SubprocLineParser implements SubprocParser {

    private static final int LINE = 1;

    @Override
    public Module parse(String line) throws SubprocSyntaxException {
        Scanner scanner = new Scanner(line);
        scanner.skipWhitespace();
        int start = scanner.pos;

        char closer;
        boolean captured;
        if (scanner.lookingAt("$[")) {
            closer = ']';
            captured = false;
        } else if (scanner.lookingAt("$(")) {
            closer = ')';
            captured = true;
        } else {
            throw scanner.error("expected '$[' or '$('");
        }
        scanner.pos += 2;

        List<String> words = new ArrayList<>();
        boolean closed = false;
        while (!scanner.atEnd()) {
            scanner.skipWhitespace();
            if (scanner.atEnd()) break;
            char c = scanner.peek();
            if (c == closer) {
                scanner.pos++;
                closed = true;
                break;
            }
            words.add(scanner.word(closer));
        }
        if (!closed) {
            throw scanner.error("missing closing '" + closer + "'");
        }
        if (words.isEmpty()) {
            throw new SubprocSyntaxException("empty subprocess command", LINE, start);
        }
        scanner.skipWhitespace();
        if (!scanner.atEnd()) {
            throw scanner.error("unexpected text after '" + closer + "'");
        }

        SourcePosition position = new SourcePosition(LINE, start);
        SubprocCall call = new SubprocCall(words, captured, position);
        return new Module(new Block(List.of(new ExpressionStatement(call, position)), position));
    }

    /**
     * Cursor over the input line.
     */
    private static final class Scanner {
        private final String text;
        private int pos;

        Scanner(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return text.charAt(pos);
        }

        boolean lookingAt(String prefix) {
            return text.startsWith(prefix, pos);
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                pos++;
            }
        }

        /**
         * Reads one word, stopping before whitespace or the closer.
         */
        String word(char closer) throws SubprocSyntaxException {
            StringBuilder word = new StringBuilder();
            while (!atEnd()) {
                char c = peek();
                if (Character.isWhitespace(c) || c == closer) {
                    break;
                }
                if (c == '\'') {
                    int quoteStart = pos++;
                    int end = text.indexOf('\'', pos);
                    if (end < 0) {
                        throw new SubprocSyntaxException("unterminated single quote", LINE, quoteStart);
                    }
                    word.append(text, pos, end);
                    pos = end + 1;
                } else if (c == '"') {
                    readDoubleQuoted(word);
                } else {
                    word.append(c);
                    pos++;
                }
            }
            return word.toString();
        }

        private void readDoubleQuoted(StringBuilder word) throws SubprocSyntaxException {
            int quoteStart = pos++;
            while (!atEnd()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return;
                }
                if (c == '\\' && !atEnd() && (peek() == '"' || peek() == '\\')) {
                    word.append(text.charAt(pos++));
                } else {
                    word.append(c);
                }
            }
            throw new SubprocSyntaxException("unterminated double quote", LINE, quoteStart);
        }

        SubprocSyntaxException error(String message) {
            return new SubprocSyntaxException(message, LINE, pos);
        }
    }
}
