package io.github.eutro.jbitcode.core.ir;

import io.github.eutro.jbitcode.core.ir.types.PointerType;
import io.github.eutro.jbitcode.core.ops.Linkage;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * A second name for a global, possibly through a pointer cast. The aliasee is operand 0.
 */
public final class GlobalAlias extends GlobalValue {
    public GlobalAlias(PointerType type, Linkage linkage, @Nullable String name, @Nullable Constant aliasee) {
        super(type, linkage, name);
        addOperand(null);
        if (aliasee != null) setAliasee(aliasee);
    }

    @Override
    public boolean isDeclaration() {
        return false;
    }

    public @Nullable Constant getAliasee() {
        return (Constant) getOperand(0);
    }

    public void setAliasee(Constant aliasee) {
        if (!aliasee.getType().equals(getType())) {
            throw new IllegalArgumentException("aliasee of type " + aliasee.getType()
                    + " for alias of type " + getType());
        }
        setOperand(0, aliasee);
    }

    /**
     * Follow the aliasee through pointer casts and other aliases to the variable or function it names.
     *
     * @return The aliased object, or null if the chain is not made of no-op pointer
     * adjustments and aliases, or loops back on itself.
     */
    public @Nullable GlobalValue resolveAliasedGlobal() {
        Set<GlobalAlias> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.add(this);
        Constant current = getAliasee();
        while (current != null) {
            if (current instanceof GlobalAlias) {
                GlobalAlias alias = (GlobalAlias) current;
                if (!seen.add(alias)) return null;
                current = alias.getAliasee();
            } else if (current instanceof GlobalValue) {
                return (GlobalValue) current;
            } else if (Constants.isNoOpPointerAdjustment(current)) {
                current = ((Constant) current).getConstantOperand(0);
            } else {
                return null;
            }
        }
        return null;
    }
}
