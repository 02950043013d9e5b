package dumb.bao;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads bracket notation into live Forms with fresh ids.
 * <pre>
 *   ( ... )  round      [ ... ]  square      &lt; ... &gt;  angle
 *   x, "two words"      atom labels          ; comment to end of line
 * </pre>
 */
public class FormParser {
    private static final int CONTEXT_BUFFER_SIZE = 50;
    private final Reader reader;
    private final StringBuilder contextBuffer = new StringBuilder(CONTEXT_BUFFER_SIZE);
    private int currentChar = -2;
    private int line = 1;
    private int col = 0;

    private FormParser(Reader reader) {
        this.reader = reader;
    }

    public static List<Form> parse(String text) throws ParseException {
        try (var reader = new StringReader(text)) {
            var parser = new FormParser(reader);
            var forms = new ArrayList<Form>();
            parser.skipWhitespaceAndComments();
            while (parser.peek() != -1) {
                forms.add(parser.parseForm());
                parser.skipWhitespaceAndComments();
            }
            return forms;
        } catch (IOException e) {
            throw new ParseException("IO Error: " + e.getMessage());
        }
    }

    public static Form parseOne(String text) throws ParseException {
        var forms = parse(text);
        if (forms.size() != 1)
            throw new ParseException("Expected exactly one form but found " + forms.size(), text);
        return forms.get(0);
    }

    private static boolean delimiter(int c) {
        return Character.isWhitespace(c) || c == '"' || c == ';' || Boundary.opening(c) != null || closing(c);
    }

    private static boolean closing(int c) {
        return c == ')' || c == ']' || c == '>';
    }

    private int peek() throws IOException {
        if (currentChar == -2) {
            currentChar = reader.read();
            if (contextBuffer.length() >= CONTEXT_BUFFER_SIZE) {
                contextBuffer.deleteCharAt(0);
            }
            if (currentChar != -1) {
                contextBuffer.append((char) currentChar);
            }
        }
        return currentChar;
    }

    private int consumeChar() throws IOException {
        var c = peek();
        if (c != -1) {
            currentChar = -2;
            if (c == '\n') {
                line++;
                col = 0;
            } else {
                col++;
            }
        }
        return c;
    }

    private void consumeChar(char expected) throws IOException, ParseException {
        var actual = consumeChar();
        if (actual != expected) {
            throw createParseException("Expected '" + expected + "'", ((actual == -1) ? "EOF" : "'" + (char) actual + "'"));
        }
    }

    private void skipWhitespaceAndComments() throws IOException {
        while (true) {
            var c = peek();
            if (c == -1) return;
            if (Character.isWhitespace(c)) {
                consumeChar();
            } else if (c == ';') {
                consumeChar();
                while (peek() != '\n' && peek() != -1) {
                    consumeChar();
                }
            } else {
                return;
            }
        }
    }

    private Form parseForm() throws IOException, ParseException {
        skipWhitespaceAndComments();
        var c = peek();
        if (c == -1) throw createParseException("Unexpected EOF while parsing form");
        var boundary = Boundary.opening(c);
        if (boundary != null) return parseBoundary(boundary);
        if (c == '"') return Form.atom(parseQuotedLabel());
        if (closing(c)) throw createParseException("Unbalanced '" + (char) c + "'");
        return Form.atom(parseBareLabel());
    }

    private Form parseBoundary(Boundary boundary) throws IOException, ParseException {
        consumeChar(boundary.open);
        var children = new ArrayList<Form>();
        skipWhitespaceAndComments();
        while (peek() != boundary.close) {
            var c = peek();
            if (c == -1) throw createParseException("Unexpected EOF inside " + boundary);
            if (closing(c))
                throw createParseException("Mismatched '" + (char) c + "' inside " + boundary + ", expected '" + boundary.close + "'");
            children.add(parseForm());
            skipWhitespaceAndComments();
        }
        consumeChar(boundary.close);
        return Form.of(boundary, children);
    }

    private String parseQuotedLabel() throws IOException, ParseException {
        consumeChar('"');
        var sb = new StringBuilder();
        while (peek() != '"') {
            if (peek() == -1) throw createParseException("Unexpected EOF inside quoted label");
            if (peek() == '\\') {
                consumeChar('\\');
                var escaped = consumeChar();
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default -> throw createParseException("Invalid escape sequence '\\" + (char) escaped + "'");
                }
            } else {
                sb.append((char) consumeChar());
            }
        }
        consumeChar('"');
        if (sb.isEmpty()) throw createParseException("Empty atom label");
        return sb.toString();
    }

    private String parseBareLabel() throws IOException, ParseException {
        var sb = new StringBuilder();
        while (peek() != -1 && !delimiter(peek())) {
            sb.append((char) consumeChar());
        }
        if (sb.isEmpty()) throw createParseException("Empty atom label");
        return sb.toString();
    }

    private ParseException createParseException(String message) {
        return new ParseException(message, line, col, contextBuffer.toString());
    }

    private ParseException createParseException(String message, @Nullable String foundToken) {
        var foundInfo = foundToken != null ? " found " + foundToken : "";
        return new ParseException(message + foundInfo, line, col, contextBuffer.toString());
    }

    public static class ParseException extends Exception {
        private final int line;
        private final int col;
        private final String context;

        public ParseException(String message) {
            this(message, "");
        }

        public ParseException(String message, String context) {
            this(message, -1, -1, context);
        }

        public ParseException(String message, int line, int col, String context) {
            super(message);
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public String getMessage() {
            var location = (line != -1 && col != -1) ? " at line " + line + ", col " + col : "";
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + location + contextSnippet;
        }
    }
}
