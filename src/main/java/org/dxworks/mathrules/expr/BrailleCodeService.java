package org.dxworks.mathrules.expr;

import org.dxworks.mathrules.tree.Node;

/**
 * Braille-code specific helpers behind {@code NestingChars} and {@code BrailleChars}.
 */
public interface BrailleCodeService {

    /**
     * Indicator characters for the nesting level of {@code node}, e.g. one indicator per
     * enclosing fraction for Nemeth complex fractions.
     */
    String nestingChars(Node node, String indicator);

    /**
     * Translates {@code text} (taken from {@code node}, which may be null for plain strings)
     * into the braille cells of {@code code}.
     */
    String brailleChars(String text, String code, Node node);
}
