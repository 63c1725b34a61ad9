package com.telcobright.partman.db.metadata;

/**
 * Column definition read from {@code information_schema.columns}.
 */
public class ColumnInfo {

    private final String name;
    private final String dataType;
    private final String fullType;
    private final boolean nullable;
    private final String generationExpression;

    public ColumnInfo(String name, String dataType, String fullType, boolean nullable, String generationExpression) {
        this.name = name;
        this.dataType = dataType;
        this.fullType = fullType;
        this.nullable = nullable;
        this.generationExpression = generationExpression;
    }

    public String getName() { return name; }
    public String getDataType() { return dataType; }
    public String getFullType() { return fullType; }
    public boolean isNullable() { return nullable; }
    public String getGenerationExpression() { return generationExpression; }

    /**
     * TIMESTAMP values are stored as instants and read back in the session time zone.
     */
    public boolean isTimestamp() {
        return "timestamp".equalsIgnoreCase(dataType);
    }

    public boolean isGenerated() {
        return generationExpression != null && !generationExpression.isBlank();
    }
}
