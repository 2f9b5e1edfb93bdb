package org.dxworks.mathrules.replace;

import org.dxworks.mathrules.engine.ReplacementContext;
import org.dxworks.mathrules.output.OutputSink;

/**
 * One compiled step of a rule's {@code replace} list.
 */
public interface Instruction {

    void execute(ReplacementContext ctx, OutputSink out);
}
