package org.dxworks.mathrules.tree;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class XmlTreeReaderTest {

    @Test
    void readsElementsLeavesAndAttributes() throws IOException {
        Node math = XmlTreeReader.parse(
                "<math xmlns='http://www.w3.org/1998/Math/MathML' id='m0'>\n"
                        + "  <mrow id='r1'>\n"
                        + "    <mi>x</mi>\n"
                        + "    <mo> + </mo>\n"
                        + "    <mn>2</mn>\n"
                        + "  </mrow>\n"
                        + "</math>");

        assertEquals("math", math.getName());
        assertEquals("m0", math.getId());
        assertEquals(1, math.getAttributes().size());

        Node row = math.child(0);
        assertEquals("mrow", row.getName());
        assertEquals(3, row.childCount());
        assertTrue(row.child(1).isLeaf());
        assertEquals("+", row.child(1).getText());
        assertEquals("x+2", math.stringValue());
        assertEquals(row, row.child(2).getParent());
        assertEquals(2, row.child(2).getIndex());
        assertNull(row.child(3));
    }

    @Test
    void emptyLeafHasNoTextNode() throws IOException {
        Node mspace = XmlTreeReader.parse("<mspace width='1em'/>");

        assertTrue(mspace.isLeaf());
        assertEquals("", mspace.getText());
        assertNull(mspace.textNode());
        assertEquals("1em", mspace.attributeNode("width").getText());
    }

    @Test
    void rejectsMixedContent() {
        assertThrows(IllegalArgumentException.class,
                () -> XmlTreeReader.parse("<mrow>a<mi>x</mi></mrow>"));
    }

    @Test
    void rejectsInvalidXml() {
        assertThrows(IOException.class, () -> XmlTreeReader.parse("<math><mi>x</math>"));
    }
}
