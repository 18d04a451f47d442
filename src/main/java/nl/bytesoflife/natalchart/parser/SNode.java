package nl.bytesoflife.natalchart.parser;

import java.util.List;

/**
 * Node of a parsed S-expression: an atom or a list.
 */
public sealed interface SNode permits SNode.SAtom, SNode.SList {

    record SAtom(String value, boolean quoted) implements SNode {

        public SAtom(String value) {
            this(value, false);
        }

        @Override
        public String toString() {
            return quoted ? '"' + value.replace("\"", "\\\"") + '"' : value;
        }
    }

    record SList(List<SNode> children) implements SNode {

        public SList {
            children = List.copyOf(children);
        }

        /** First child when it is an atom, otherwise the empty string. */
        public String tag() {
            return atom(0);
        }

        /** Atom value at {@code index}, or the empty string when missing or not an atom. */
        public String atom(int index) {
            if (index >= children.size()) return "";
            return children.get(index) instanceof SAtom a ? a.value() : "";
        }

        public int size() {
            return children.size();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
