package com.telcobright.partman.core.partition;

/**
 * One entry of a {@code PARTITION BY RANGE} list: a name and its {@code VALUES LESS THAN} bound.
 */
public class PartitionDefinition {

    public static final String MAXVALUE = "MAXVALUE";

    private final String name;
    private final String lessThan;

    private PartitionDefinition(String name, String lessThan) {
        this.name = name;
        this.lessThan = lessThan;
    }

    public static PartitionDefinition lessThan(String name, long boundary) {
        return new PartitionDefinition(name, Long.toString(boundary));
    }

    /**
     * Bound given as an expression, e.g. {@code TO_DAYS('2025-01-02')}; checked again when DDL is built.
     */
    public static PartitionDefinition lessThan(String name, String boundaryExpression) {
        return new PartitionDefinition(name, boundaryExpression);
    }

    public static PartitionDefinition maxValue(String name) {
        return new PartitionDefinition(name, MAXVALUE);
    }

    public String getName() {
        return name;
    }

    public String getLessThan() {
        return lessThan;
    }

    public boolean isMaxValue() {
        return MAXVALUE.equals(lessThan);
    }

    @Override
    public String toString() {
        return name + " < " + lessThan;
    }
}
