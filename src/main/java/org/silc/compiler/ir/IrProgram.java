package org.silc.compiler.ir;

import java.util.List;

/**
 * Linear IR program container. The order of items is the emission order
 * as produced by lowering and is preserved by the backends.
 */
public record IrProgram(List<IrItem> items) {

    public IrProgram {
        items = List.copyOf(items);
    }
}
