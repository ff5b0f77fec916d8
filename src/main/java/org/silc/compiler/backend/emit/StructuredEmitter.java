package org.silc.compiler.backend.emit;

import org.silc.compiler.api.TranslationException;
import org.silc.compiler.ir.IrArith;
import org.silc.compiler.ir.IrCmp;
import org.silc.compiler.ir.IrCompare;
import org.silc.compiler.ir.IrConditionalBranch;
import org.silc.compiler.ir.IrDecl;
import org.silc.compiler.ir.IrFuncBegin;
import org.silc.compiler.ir.IrFuncEnd;
import org.silc.compiler.ir.IrItem;
import org.silc.compiler.ir.IrJump;
import org.silc.compiler.ir.IrJumpIfFalse;
import org.silc.compiler.ir.IrLabelDef;
import org.silc.compiler.ir.IrLiteral;
import org.silc.compiler.ir.IrMov;
import org.silc.compiler.ir.IrOperand;
import org.silc.compiler.ir.IrParam;
import org.silc.compiler.ir.IrPrinter;
import org.silc.compiler.ir.IrProgram;
import org.silc.compiler.ir.IrReturn;
import org.silc.compiler.ir.IrTemp;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The structured-text backend. It walks the IR exactly once and rebuilds the source nesting from
 * the flat label/jump stream using a depth counter and a stack of open blocks; no control-flow
 * graph is built. The surface syntax comes from an {@link IBackendSyntax} table, so every backend
 * shares the same nesting rules:
 * <ul>
 *   <li>a conditional branch opens a block one level deeper and records its target label;</li>
 *   <li>the block closes at the definition of that label, or at a jump that immediately precedes it;</li>
 *   <li>all other jumps and labels are comment markers and leave the depth alone.</li>
 * </ul>
 * Lowering only ever produces properly nested branch/label pairs. Anything else is reported as
 * malformed control flow instead of being laid out by guesswork.
 * <p>
 * Instances are stateless; all state lives in a per-call {@link EmissionState}.
 */
public class StructuredEmitter {

    /**
     * Renders the program and returns its text.
     *
     * @param program The lowered program.
     * @param syntax The backend table.
     * @return The rendered text.
     * @throws TranslationException if the control flow is not properly nested.
     */
    public String emit(IrProgram program, IBackendSyntax syntax) throws TranslationException {
        return render(program, syntax).text();
    }

    /**
     * Renders the program and reports the nesting depths reached.
     *
     * @param program The lowered program.
     * @param syntax The backend table.
     * @return The rendered lines with depth information.
     * @throws TranslationException if the control flow is not properly nested.
     */
    public RenderedText render(IrProgram program, IBackendSyntax syntax) throws TranslationException {
        EmissionState state = new EmissionState(syntax);
        List<IrItem> items = program.items();
        for (int i = 0; i < items.size(); i++) {
            IrItem next = i + 1 < items.size() ? items.get(i + 1) : null;
            state.accept(items.get(i), next);
        }
        return state.finish();
    }

    private enum BlockKind { PROGRAM, FUNCTION, BRANCH }

    private static final class Block {
        final BlockKind kind;
        final String targetLabel;
        final int openDepth;
        final int declarationIndex;
        final Set<String> temporaries = new LinkedHashSet<>();
        int statements;

        Block(BlockKind kind, String targetLabel, int openDepth, int declarationIndex) {
            this.kind = kind;
            this.targetLabel = targetLabel;
            this.openDepth = openDepth;
            this.declarationIndex = declarationIndex;
        }

        boolean isFrame() {
            return kind != BlockKind.BRANCH;
        }
    }

    private static final class EmissionState {
        private final IBackendSyntax syntax;
        private final List<String> lines = new ArrayList<>();
        private final Deque<Block> blocks = new ArrayDeque<>();
        private int depth;
        private int maxDepth;
        private IrOperand pendingTest;
        private String headerName;
        private List<String> headerParams;

        EmissionState(IBackendSyntax syntax) {
            this.syntax = syntax;
            lines.addAll(syntax.prologue());
            this.depth = syntax.baseDepth();
            this.maxDepth = depth;
            blocks.push(new Block(BlockKind.PROGRAM, null, depth, lines.size()));
        }

        void accept(IrItem item, IrItem next) throws TranslationException {
            if (pendingTest != null && !(item instanceof IrConditionalBranch)) {
                throw TranslationException.malformedControlFlow("cmp " + pendingTest.text(),
                        "not followed by a conditional branch but by '" + IrPrinter.format(item) + "'");
            }
            if (headerName != null && !(item instanceof IrParam)) {
                openFunction();
            }

            if (item instanceof IrDecl d) {
                statement(syntax.declaration(d.name()));
            } else if (item instanceof IrMov m) {
                noteTemporary(m.dest());
                statement(syntax.assignment(operand(m.dest()), operand(m.source())));
            } else if (item instanceof IrArith a) {
                noteTemporary(a.dest());
                statement(syntax.binaryOperation(operand(a.dest()), operand(a.lhs()), syntax.spell(a.op()), operand(a.rhs())));
            } else if (item instanceof IrCompare c) {
                noteTemporary(c.dest());
                statement(syntax.binaryOperation(operand(c.dest()), operand(c.lhs()), syntax.spell(c.op()), operand(c.rhs())));
            } else if (item instanceof IrCmp c) {
                pendingTest = c.operand();
            } else if (item instanceof IrConditionalBranch b) {
                openBranch(b);
            } else if (item instanceof IrJump j) {
                comment(syntax.jumpMarker(j.label()));
                Block top = blocks.peek();
                if (top.kind == BlockKind.BRANCH && next instanceof IrLabelDef l && l.name().equals(top.targetLabel)) {
                    closeBlock();
                }
            } else if (item instanceof IrLabelDef l) {
                defineLabel(l.name());
            } else if (item instanceof IrFuncBegin f) {
                beginFunction(f.name());
            } else if (item instanceof IrParam p) {
                if (headerName == null) {
                    throw TranslationException.malformedControlFlow("param " + p.name(), "parameter outside a function header");
                }
                headerParams.add(p.name());
            } else if (item instanceof IrFuncEnd) {
                endFunction();
            } else if (item instanceof IrReturn r) {
                statement(syntax.returnStatement(r.hasOperand() ? operand(r.operand()) : null));
            } else {
                throw new IllegalStateException("Unhandled IR item: " + item);
            }
        }

        RenderedText finish() throws TranslationException {
            if (pendingTest != null) {
                throw TranslationException.malformedControlFlow("cmp " + pendingTest.text(), "not followed by a conditional branch");
            }
            if (headerName != null) {
                throw TranslationException.malformedControlFlow("func " + headerName, "function is never closed");
            }
            Block top = blocks.peek();
            if (top.kind == BlockKind.BRANCH) {
                throw TranslationException.malformedControlFlow(top.targetLabel, "branch target is never reached");
            }
            if (top.kind == BlockKind.FUNCTION) {
                throw TranslationException.malformedControlFlow("endfunc", "function is never closed");
            }
            declareTemporaries(blocks.pop());
            lines.addAll(syntax.epilogue());
            return new RenderedText(lines, depth, maxDepth);
        }

        private void openBranch(IrConditionalBranch branch) throws TranslationException {
            if (pendingTest == null) {
                throw TranslationException.malformedControlFlow(branch.label(), "conditional branch without a preceding cmp");
            }
            statement(syntax.conditionOpener(operand(pendingTest), branch instanceof IrJumpIfFalse));
            pendingTest = null;
            push(new Block(BlockKind.BRANCH, branch.label(), depth, -1));
        }

        private void defineLabel(String label) throws TranslationException {
            Block top = blocks.peek();
            if (top.kind == BlockKind.BRANCH && label.equals(top.targetLabel)) {
                closeBlock();
            } else {
                for (Block open : blocks) {
                    if (label.equals(open.targetLabel)) {
                        throw TranslationException.malformedControlFlow(label,
                                "label closes a branch while the branch to " + top.targetLabel + " is still open");
                    }
                }
            }
            comment(syntax.labelMarker(label));
        }

        private void beginFunction(String name) throws TranslationException {
            for (Block open : blocks) {
                if (open.kind == BlockKind.FUNCTION) {
                    throw TranslationException.malformedControlFlow("func " + name, "function opened inside another function");
                }
            }
            headerName = name;
            headerParams = new ArrayList<>();
        }

        private void openFunction() {
            statement(syntax.functionOpener(headerName, headerParams));
            headerName = null;
            headerParams = null;
            push(new Block(BlockKind.FUNCTION, null, depth, lines.size()));
        }

        private void endFunction() throws TranslationException {
            Block top = blocks.peek();
            if (top.kind == BlockKind.BRANCH) {
                throw TranslationException.malformedControlFlow(top.targetLabel, "branch still open at end of function");
            }
            if (top.kind != BlockKind.FUNCTION) {
                throw TranslationException.malformedControlFlow("endfunc", "no open function");
            }
            declareTemporaries(top);
            closeBlock();
            syntax.functionCloser().ifPresent(this::line);
        }

        private void push(Block block) {
            blocks.push(block);
            depth++;
            maxDepth = Math.max(maxDepth, depth);
        }

        private void closeBlock() {
            Block block = blocks.pop();
            if (block.statements == 0) {
                syntax.emptyBlockStatement().ifPresent(this::line);
            }
            depth = block.openDepth;
            if (block.kind == BlockKind.BRANCH) {
                syntax.blockCloser().ifPresent(this::line);
            }
        }

        private void declareTemporaries(Block frame) {
            if (frame.temporaries.isEmpty()) {
                return;
            }
            syntax.temporaryDeclaration(List.copyOf(frame.temporaries)).ifPresent(declaration -> {
                lines.add(frame.declarationIndex, indentation(frame.openDepth + (frame.kind == BlockKind.FUNCTION ? 1 : 0)) + declaration);
                frame.statements++;
            });
        }

        private void noteTemporary(IrOperand dest) {
            if (!(dest instanceof IrTemp temp)) {
                return;
            }
            for (Block block : blocks) {
                if (block.isFrame()) {
                    block.temporaries.add(temp.name());
                    return;
                }
            }
        }

        private String operand(IrOperand operand) {
            if (operand instanceof IrLiteral literal) {
                return syntax.literal(literal);
            }
            return operand.text();
        }

        private void statement(String text) {
            blocks.peek().statements++;
            line(text);
        }

        private void comment(String text) {
            line(text);
        }

        private void line(String text) {
            lines.add(indentation(depth) + text);
        }

        private String indentation(int level) {
            return syntax.indentUnit().repeat(level);
        }
    }
}
