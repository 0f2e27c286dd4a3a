package pass.GraphPass;

import exception.ProgramGraphException;
import graph.BasicBlock;
import graph.BlockTerminator;
import ir.instructions.Instruction;
import ir.instructions.LabelInst;
import ir.operand.Label;
import pass.BuildContext;
import pass.GraphPassType;
import pass.Pass;
import util.logging.LogManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Split the flat instruction list into basic blocks. A block opens at program start,
 * right after every terminator and right before every label; a block that reaches the
 * next label or the end of the program without a terminator falls through.
 */
public class BasicBlockExtractionPass implements Pass.GraphPass {
    private static final Logger log = LogManager.getLogger(BasicBlockExtractionPass.class);

    /**
     * Blocks in program order and the block index each label opens.
     */
    public record Extraction(List<BasicBlock> blocks, Map<String, Integer> labelIndex) {
    }

    @Override
    public GraphPassType getType() {
        return GraphPassType.BlockExtraction;
    }

    @Override
    public void run(BuildContext context) {
        Extraction extraction = extract(context.getProgram().getInstructions());
        context.setBlocks(extraction.blocks(), extraction.labelIndex());
        log.debug("{} instructions split into {} blocks", context.getProgram().size(),
                extraction.blocks().size());
    }

    /**
     * @throws ProgramGraphException DUPLICATE_LABEL or UNDEFINED_LABEL; nothing is returned then
     */
    public static Extraction extract(List<Instruction> instructions) {
        List<BasicBlock> blocks = new ArrayList<>();
        Map<String, Integer> labelIndex = new LinkedHashMap<>();

        Label label = null;
        List<Instruction> body = new ArrayList<>();
        for (Instruction inst : instructions) {
            if (inst instanceof LabelInst labelInst) {
                if (label != null || !body.isEmpty()) {
                    blocks.add(new BasicBlock(blocks.size(), label, body, BlockTerminator.fallthrough()));
                    body = new ArrayList<>();
                }
                label = labelInst.getLabel();
                if (labelIndex.putIfAbsent(label.getName(), blocks.size()) != null) {
                    throw ProgramGraphException.duplicateLabel(label.getName());
                }
            } else if (inst.isTerminator()) {
                blocks.add(new BasicBlock(blocks.size(), label, body, BlockTerminator.of(inst)));
                label = null;
                body = new ArrayList<>();
            } else {
                body.add(inst);
            }
        }
        if (label != null || !body.isEmpty()) {
            blocks.add(new BasicBlock(blocks.size(), label, body, BlockTerminator.fallthrough()));
        }

        // 所有标签收集完才能检查跳转目标, 允许向前跳转
        for (BasicBlock block : blocks) {
            Label target = block.getTerminator().getTarget();
            if (target != null && !labelIndex.containsKey(target.getName())) {
                throw ProgramGraphException.undefinedLabel(target.getName());
            }
        }
        return new Extraction(Collections.unmodifiableList(blocks), Collections.unmodifiableMap(labelIndex));
    }
}
