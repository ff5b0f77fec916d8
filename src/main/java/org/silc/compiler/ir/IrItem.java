package org.silc.compiler.ir;

/**
 * Marker interface for all instructions emitted by lowering and consumed by the backends.
 * The set is closed; backends handle every permitted type.
 */
public sealed interface IrItem
        permits IrDecl, IrMov, IrArith, IrCompare, IrCmp, IrBranch, IrLabelDef,
                IrFuncBegin, IrParam, IrFuncEnd, IrReturn {
}
