package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * A named list of metadata nodes at module level, such as {@code !llvm.dbg.cu}.
 * <p>
 * Not itself usable as an operand.
 */
public final class NamedMDNode extends User {
    NamedMDNode(String name) {
        super(Type.METADATA);
        setName(name);
    }

    public void addNode(MDNode node) {
        addOperand(node);
    }

    public List<MDNode> getNodes() {
        List<MDNode> nodes = new ArrayList<>(getNumOperands());
        for (Value operand : getOperands()) {
            nodes.add((MDNode) operand);
        }
        return nodes;
    }

    @Override
    public String toString() {
        return "!" + getName();
    }
}
