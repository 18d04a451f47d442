package nl.bytesoflife.natalchart.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Reader for the small S-expression dialect of the orb profile files. Comments run from
 * {@code ;} or {@code #} to the end of the line. Not thread-safe; use one instance per parse.
 */
public class SExpressionParser {

    private String input;
    private int pos;
    private int line;

    public List<SNode> parse(String text) {
        this.input = text;
        this.pos = 0;
        this.line = 1;
        List<SNode> nodes = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) break;
            if (input.charAt(pos) != '(') {
                throw error("Expected '(' at top level but found '" + input.charAt(pos) + "'");
            }
            nodes.add(parseList());
        }
        return nodes;
    }

    private SNode.SList parseList() {
        expect('(');
        List<SNode> children = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            if (pos >= input.length()) {
                throw error("Unexpected end of input, expected ')'");
            }
            char c = input.charAt(pos);
            if (c == ')') {
                pos++;
                return new SNode.SList(children);
            } else if (c == '(') {
                children.add(parseList());
            } else if (c == '"') {
                children.add(parseQuotedString());
            } else {
                children.add(parseAtom());
            }
        }
    }

    private SNode.SAtom parseQuotedString() {
        expect('"');
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '"') {
                pos++;
                return new SNode.SAtom(sb.toString(), true);
            }
            if (c == '\n') {
                throw error("Newline inside quoted string");
            }
            if (c == '\\' && pos + 1 < input.length()) {
                pos++;
                sb.append(input.charAt(pos));
            } else {
                sb.append(c);
            }
            pos++;
        }
        throw error("Unterminated quoted string");
    }

    private SNode.SAtom parseAtom() {
        int start = pos;
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '(' || c == ')' || c == '"' || c == ';' || Character.isWhitespace(c)) {
                break;
            }
            pos++;
        }
        return new SNode.SAtom(input.substring(start, pos));
    }

    private void skipWhitespaceAndComments() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '\n') {
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '#' || c == ';') {
                while (pos < input.length() && input.charAt(pos) != '\n') {
                    pos++;
                }
            } else {
                break;
            }
        }
    }

    private void expect(char expected) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw error("Expected '" + expected + "'");
        }
        pos++;
    }

    private ParseException error(String message) {
        return new ParseException(message + " (line " + line + ")", pos, line);
    }

    public static class ParseException extends RuntimeException {
        private final int position;
        private final int line;

        public ParseException(String message, int position, int line) {
            super(message);
            this.position = position;
            this.line = line;
        }

        public int getPosition() {
            return position;
        }

        public int getLine() {
            return line;
        }
    }
}
