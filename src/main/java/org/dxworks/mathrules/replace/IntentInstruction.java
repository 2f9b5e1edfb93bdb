package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.output.IntentNodeBuilder;
import org.dxworks.mathrules.output.OutputSink;
import org.dxworks.mathrules.tree.Node;

import java.util.List;

/**
 * {@code intent:} builds a new intent element named {@code name} from the output of {@code children}.
 */
public class IntentInstruction implements Instruction {

    private final String name;
    private final List<Instruction> children;

    public IntentInstruction(String name, List<Instruction> children) {
        this.name = name;
        this.children = List.copyOf(children);
    }

    @Override
    public void execute(ReplacementContext ctx, OutputSink out) {
        if (!out.acceptsElements()) {
            throw ctx.error("intent: '" + name + "' can only be used by intent rules", null);
        }
        IntentNodeBuilder content = new IntentNodeBuilder();
        ctx.run(children, content);

        Node.Builder element = Node.builder(name);
        String id = ctx.getNode().getId();
        if (id != null) {
            element.id(id);
        }
        if (content.hasElements()) {
            element.children(content.elements());
        } else {
            element.text(content.text());
        }
        out.element(element.build());
    }
}
