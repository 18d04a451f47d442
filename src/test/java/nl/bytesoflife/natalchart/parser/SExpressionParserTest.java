package nl.bytesoflife.natalchart.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SExpressionParserTest {

    private final SExpressionParser parser = new SExpressionParser();

    @Test
    void parseSimpleList() {
        List<SNode> nodes = parser.parse("(version 1)");
        assertEquals(1, nodes.size());
        SNode.SList list = assertInstanceOf(SNode.SList.class, nodes.get(0));
        assertEquals(2, list.size());
        assertEquals("version", list.tag());
        assertEquals("1", list.atom(1));
    }

    @Test
    void parseNestedAspectEntry() {
        List<SNode> nodes = parser.parse("(aspect trine (angle 120) (orb 8))");
        SNode.SList list = (SNode.SList) nodes.get(0);
        assertEquals(4, list.size());
        SNode.SList orb = assertInstanceOf(SNode.SList.class, list.children().get(3));
        assertEquals("orb", orb.tag());
        assertEquals("8", orb.atom(1));
    }

    @Test
    void quotedStringKeepsSpacesAndIsMarkedQuoted() {
        SNode.SList list = (SNode.SList) parser.parse("(profile \"wide orbs\")").get(0);
        SNode.SAtom atom = (SNode.SAtom) list.children().get(1);
        assertEquals("wide orbs", atom.value());
        assertTrue(atom.quoted());
        assertEquals("(profile \"wide orbs\")", list.toString());
    }

    @Test
    void skipHashAndSemicolonComments() {
        String input = """
                # header
                (version 1) ; trailing comment
                ; another
                (profile "x")
                """;
        assertEquals(2, parser.parse(input).size());
    }

    @Test
    void atomStopsAtComment() {
        SNode.SList list = (SNode.SList) parser.parse("(orb 8;eight\n)").get(0);
        assertEquals(2, list.size());
        assertEquals("8", list.atom(1));
    }

    @Test
    void missingValuesReadAsEmpty() {
        SNode.SList list = (SNode.SList) parser.parse("(a (b))").get(0);
        assertEquals("", list.atom(1));
        assertEquals("", list.atom(5));
        assertEquals("", ((SNode.SList) parser.parse("(() x)").get(0)).tag());
    }

    @Test
    void parseEmptyInput() {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("   \n\n  # comment only\n  ").isEmpty());
    }

    @Test
    void unbalancedInputReportsLine() {
        SExpressionParser.ParseException e = assertThrows(SExpressionParser.ParseException.class,
                () -> parser.parse("(version 1)\n(aspect trine\n  (orb 8)"));
        assertEquals(3, e.getLine());
        assertTrue(e.getMessage().contains("expected ')'"));
    }

    @Test
    void unterminatedStringFails() {
        assertThrows(SExpressionParser.ParseException.class, () -> parser.parse("(profile \"open"));
    }

    @Test
    void strayTopLevelAtomFails() {
        SExpressionParser.ParseException e = assertThrows(SExpressionParser.ParseException.class,
                () -> parser.parse("(version 1) stray"));
        assertEquals(12, e.getPosition());
    }
}
