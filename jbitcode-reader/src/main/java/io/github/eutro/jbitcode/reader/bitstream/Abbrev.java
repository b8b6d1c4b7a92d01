package io.github.eutro.jbitcode.reader.bitstream;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A record layout, defined in the stream and referred to by abbreviation id.
 */
public final class Abbrev {
    private final List<AbbrevOp> ops;

    public Abbrev(List<AbbrevOp> ops) {
        this.ops = Collections.unmodifiableList(new ArrayList<>(ops));
    }

    public List<AbbrevOp> getOps() {
        return ops;
    }

    public int getNumOps() {
        return ops.size();
    }

    public AbbrevOp getOp(int i) {
        return ops.get(i);
    }

    @Override
    public String toString() {
        return ops.toString();
    }
}
