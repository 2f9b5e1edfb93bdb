package org.dxworks.mathrules.engine;

import org.dxworks.mathrules.expr.BrailleCodeService;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.output.TokenStream;
import org.dxworks.mathrules.output.TokenStreamBuilder;
import org.dxworks.mathrules.replace.Instruction;
import org.dxworks.mathrules.rules.CharacterRules;
import org.dxworks.mathrules.rules.Definitions;
import org.dxworks.mathrules.rules.RuleSet;
import org.dxworks.mathrules.tree.Node;
import org.dxworks.mathrules.tree.TreeHelper;

import java.util.List;

/**
 * Turns a tree into a token stream. Used for both speech and braille; the two differ only in
 * their rules and in how blank text is treated by the {@link TokenStreamBuilder}.
 */
public class SpeechConversion extends Conversion {

    private final CharacterRules characters;

    public SpeechConversion(RuleSet rules, Definitions definitions, BrailleCodeService braille, int maxDepth) {
        super(rules, definitions, braille, maxDepth);
        this.characters = rules.getCharacters();
    }

    public TokenStream convert(Node root, Scope scope, TokenStreamBuilder out) {
        dispatch(root, scope, out);
        return out.build();
    }

    @Override
    protected void noRule(Node node, Scope scope, OutputSink out) {
        throw new NoMatchingRuleException(node.getName(), TreeHelper.path(node));
    }

    @Override
    protected void emitText(String text, Node context, Scope scope, OutputSink out, boolean characterRule) {
        if (characterRule || characters.isEmpty() || context == null || !context.isLeaf()) {
            out.text(text);
            return;
        }
        translate(text, context, scope, out);
    }

    /**
     * Replaces characters that have a table entry, trying the longest key first. Consecutive
     * characters without an entry are emitted together as one text token.
     */
    void translate(String text, Node context, Scope scope, OutputSink out) {
        int[] codePoints = text.codePoints().toArray();
        StringBuilder pending = new StringBuilder();
        int i = 0;
        while (i < codePoints.length) {
            int length = Math.min(characters.getMaxKeyLength(), codePoints.length - i);
            List<Instruction> entry = null;
            String key = null;
            for (; length > 0; length--) {
                key = new String(codePoints, i, length);
                entry = characters.get(key);
                if (entry != null) break;
            }
            if (entry == null) {
                pending.appendCodePoint(codePoints[i]);
                i++;
                continue;
            }
            if (pending.length() > 0) {
                out.text(pending.toString());
                pending.setLength(0);
            }
            context(context, scope, "character '" + key + "'", true).run(entry, out);
            i += length;
        }
        if (pending.length() > 0) {
            out.text(pending.toString());
        }
    }
}
