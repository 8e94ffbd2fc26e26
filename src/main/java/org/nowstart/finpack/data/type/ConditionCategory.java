package org.nowstart.finpack.data.type;

/**
 * Buy-condition stage. A and B narrow the candidate set, C picks and orders the final list.
 */
public enum ConditionCategory {
    A,
    B,
    C
}
