package com.rsfleet.repairs.error;

import com.rsfleet.repairs.model.RepairStatus;

/**
 * A status change that is not in the repair transition table.
 * The repair is left in its current state.
 */
public class TransitionException extends RepairEngineException {

    private final RepairStatus from;
    private final RepairStatus to;

    public TransitionException(RepairStatus from, RepairStatus to) {
        super(Kind.TRANSITION, describe(from, to));
        this.from = from;
        this.to   = to;
    }

    public TransitionException(String message) {
        super(Kind.TRANSITION, message);
        this.from = null;
        this.to   = null;
    }

    public RepairStatus getFrom() { return from; }
    public RepairStatus getTo()   { return to; }

    private static String describe(RepairStatus from, RepairStatus to) {
        if (from != null && from.isTerminal()) {
            return "Repair is " + from + ", which is final; it cannot move to " + to;
        }
        return "Illegal repair transition " + from + " → " + to;
    }
}
