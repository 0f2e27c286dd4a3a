package frontend;

import frontend.grammar.QuilParser;
import frontend.grammar.QuilParserBaseVisitor;
import ir.Opcode;
import ir.Program;
import ir.instructions.*;
import ir.operand.FrameIdentifier;
import ir.operand.Imm;
import ir.operand.MemoryReference;
import ir.operand.Operand;
import ir.operand.Qubit;
import ir.operand.WaveformInvocation;
import org.antlr.v4.runtime.tree.TerminalNode;
import util.logging.LogManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks a parse tree and appends one {@link Instruction} per statement to a
 * {@link Program.Builder}. DEFFRAME statements only declare their frame.
 */
public class InstructionGenerator extends QuilParserBaseVisitor<Instruction> {
    private static final Logger logger = LogManager.getLogger(InstructionGenerator.class);

    private final Program.Builder program;
    private final String sourceName;

    public InstructionGenerator(String name, String sourceName) {
        this.program = Program.builder(name);
        this.sourceName = sourceName;
    }

    /**
     * @throws QuilParseException if a statement parses but its operands are invalid,
     *                            e.g. {@code EXCHANGE ro 1}
     */
    public Program generate(QuilParser.ProgramContext ctx) throws QuilParseException {
        for (QuilParser.InstructionContext inst : ctx.instruction()) {
            Instruction generated;
            try {
                generated = visit(inst);
            } catch (IllegalArgumentException e) {
                throw new QuilParseException(sourceName, inst.getStart().getLine(),
                        inst.getStart().getCharPositionInLine(), e.getMessage(), e);
            }
            if (generated != null) {
                logger.trace("line {}: {}", inst.getStart().getLine(), generated);
                program.add(generated);
            }
        }
        return program.build();
    }

    @Override
    public Instruction visitInstruction(QuilParser.InstructionContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Instruction visitDefFrame(QuilParser.DefFrameContext ctx) {
        program.declareFrame(frame(ctx.frame()));
        return null;
    }

    @Override
    public Instruction visitPulse(QuilParser.PulseContext ctx) {
        return new PulseInst(frame(ctx.frame()), waveform(ctx.waveform()), ctx.NONBLOCKING() == null);
    }

    @Override
    public Instruction visitCapture(QuilParser.CaptureContext ctx) {
        return new CaptureInst(frame(ctx.frame()), waveform(ctx.waveform()), addr(ctx.addr()),
                ctx.NONBLOCKING() == null);
    }

    @Override
    public Instruction visitRawCapture(QuilParser.RawCaptureContext ctx) {
        return new RawCaptureInst(frame(ctx.frame()), ExpressionPrinter.print(ctx.expression()),
                addr(ctx.addr()), ctx.NONBLOCKING() == null);
    }

    @Override
    public Instruction visitDelay(QuilParser.DelayContext ctx) {
        List<String> names = new ArrayList<>();
        for (TerminalNode name : ctx.STRING()) {
            names.add(unquote(name));
        }
        return new DelayInst(qubits(ctx.qubit()), names, ExpressionPrinter.print(ctx.expression()));
    }

    @Override
    public Instruction visitFence(QuilParser.FenceContext ctx) {
        return new FenceInst(qubits(ctx.qubit()));
    }

    @Override
    public Instruction visitFrameUpdate(QuilParser.FrameUpdateContext ctx) {
        Opcode opcode = Opcode.fromMnemonic(ctx.getChild(0).getText());
        return new FrameUpdateInst(opcode, frame(ctx.frame()), ExpressionPrinter.print(ctx.expression()));
    }

    @Override
    public Instruction visitSwapPhases(QuilParser.SwapPhasesContext ctx) {
        return new SwapPhasesInst(frame(ctx.frame(0)), frame(ctx.frame(1)));
    }

    @Override
    public Instruction visitLabel(QuilParser.LabelContext ctx) {
        return new LabelInst(ctx.LABEL_REF().getText());
    }

    @Override
    public Instruction visitJump(QuilParser.JumpContext ctx) {
        return new JumpInst(ctx.LABEL_REF().getText());
    }

    @Override
    public Instruction visitJumpWhen(QuilParser.JumpWhenContext ctx) {
        return new JumpWhenInst(ctx.LABEL_REF().getText(), addr(ctx.addr()));
    }

    @Override
    public Instruction visitJumpUnless(QuilParser.JumpUnlessContext ctx) {
        return new JumpUnlessInst(ctx.LABEL_REF().getText(), addr(ctx.addr()));
    }

    @Override
    public Instruction visitHalt(QuilParser.HaltContext ctx) {
        return new HaltInst();
    }

    @Override
    public Instruction visitUnaryClassical(QuilParser.UnaryClassicalContext ctx) {
        return new ClassicalInst(Opcode.fromMnemonic(ctx.unaryOp().getText()), addr(ctx.addr()));
    }

    @Override
    public Instruction visitBinaryClassical(QuilParser.BinaryClassicalContext ctx) {
        return new ClassicalInst(Opcode.fromMnemonic(ctx.binaryOp().getText()), addr(ctx.addr()),
                operand(ctx.operand()));
    }

    @Override
    public Instruction visitComparisonClassical(QuilParser.ComparisonClassicalContext ctx) {
        return new ClassicalInst(Opcode.fromMnemonic(ctx.comparisonOp().getText()), addr(ctx.addr()),
                operand(ctx.operand(0)), operand(ctx.operand(1)));
    }

    private FrameIdentifier frame(QuilParser.FrameContext ctx) {
        return FrameIdentifier.of(qubits(ctx.qubit()), unquote(ctx.STRING()));
    }

    private List<Qubit> qubits(List<QuilParser.QubitContext> ctxs) {
        List<Qubit> qubits = new ArrayList<>(ctxs.size());
        for (QuilParser.QubitContext q : ctxs) {
            qubits.add(Qubit.of(Long.parseLong(q.INT().getText())));
        }
        return qubits;
    }

    private WaveformInvocation waveform(QuilParser.WaveformContext ctx) {
        Map<String, String> params = new LinkedHashMap<>();
        for (QuilParser.ParamContext p : ctx.param()) {
            String name = p.IDENTIFIER().getText();
            if (params.put(name, ExpressionPrinter.print(p.expression())) != null) {
                throw new IllegalArgumentException("waveform " + ctx.IDENTIFIER().getText()
                        + " repeats parameter " + name);
            }
        }
        return new WaveformInvocation(ctx.IDENTIFIER().getText(), params);
    }

    private MemoryReference addr(QuilParser.AddrContext ctx) {
        // "ro" 等价于 "ro[0]"
        int index = ctx.INT() == null ? 0 : Integer.parseInt(ctx.INT().getText());
        return MemoryReference.of(ctx.IDENTIFIER().getText(), index);
    }

    private Operand operand(QuilParser.OperandContext ctx) {
        if (ctx.addr() != null) {
            return addr(ctx.addr());
        }
        QuilParser.NumberContext number = ctx.number();
        boolean negative = number.MINUS() != null;
        if (number.INT() != null) {
            long value = Long.parseLong(number.INT().getText());
            return Imm.of(negative ? -value : value);
        }
        double value = Double.parseDouble(number.FLOAT().getText());
        return Imm.of(negative ? -value : value);
    }

    private static String unquote(TerminalNode string) {
        String text = string.getText();
        return text.substring(1, text.length() - 1);
    }
}
