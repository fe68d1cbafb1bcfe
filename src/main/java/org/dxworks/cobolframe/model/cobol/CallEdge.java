package org.dxworks.cobolframe.model.cobol;

import java.util.Objects;

public final class CallEdge {
    public final String caller;
    public final String callee;

    public CallEdge(String caller, String callee) {
        this.caller = Objects.requireNonNull(caller, "caller");
        this.callee = Objects.requireNonNull(callee, "callee");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CallEdge)) return false;
        CallEdge other = (CallEdge) o;
        return caller.equals(other.caller) && callee.equals(other.callee);
    }

    @Override
    public int hashCode() {
        return Objects.hash(caller, callee);
    }

    @Override
    public String toString() {
        return caller + " -> " + callee;
    }
}
