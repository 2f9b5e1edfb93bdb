package org.dxworks.mathrules.tree;

import org.approvaltests.Approvals;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.dxworks.mathrules.TestUtils.APPROVAL_MAPPER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class JsonTreeCodecTest {

    @Test
    void writesTreeAsJson() throws IOException {
        Node math = XmlTreeReader.parse("<math><mfrac linethickness='0'><mi>n</mi><mi>k</mi></mfrac></math>");

        Approvals.verify(APPROVAL_MAPPER.writeValueAsString(JsonTreeCodec.toJson(math)));
    }

    @Test
    void readsTreeFromJson() throws IOException {
        Node tree = JsonTreeCodec.parse("{\"name\":\"msup\",\"attributes\":{\"id\":\"s\"},"
                + "\"children\":[{\"name\":\"mi\",\"text\":\"x\"},{\"name\":\"mn\",\"text\":\"2\"}]}");

        assertEquals("msup", tree.getName());
        assertEquals("s", tree.getId());
        assertEquals("x2", tree.stringValue());
        assertEquals("mn", tree.child(1).getName());
    }

    @Test
    void rejectsTextTogetherWithChildren() {
        assertThrows(IllegalArgumentException.class, () -> JsonTreeCodec.parse(
                "{\"name\":\"mrow\",\"text\":\"a\",\"children\":[{\"name\":\"mi\",\"text\":\"x\"}]}"));
    }
}
