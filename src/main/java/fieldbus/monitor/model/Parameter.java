package fieldbus.monitor.model;

import fieldbus.monitor.enums.ByteOrder;
import fieldbus.monitor.enums.DataType;
import org.jetbrains.annotations.Nullable;

public class Parameter {
    private final String name;
    private final DataType dataType;
    private final ByteOrder byteOrder;
    private final int registerOffset;
    private final Integer wordCount;
    private final Double scalingFactor;
    private final Integer decimalPrecision;
    private final Boolean signed;
    private final String unit;

    public Parameter(
            String name,
            DataType dataType,
            @Nullable ByteOrder byteOrder,
            int registerOffset,
            @Nullable Integer wordCount,
            @Nullable Double scalingFactor,
            @Nullable Integer decimalPrecision,
            @Nullable Boolean signed,
            @Nullable String unit
    ) {
        this.name = name;
        this.dataType = dataType;
        this.byteOrder = byteOrder;
        this.registerOffset = registerOffset;
        this.wordCount = wordCount;
        this.scalingFactor = scalingFactor;
        this.decimalPrecision = decimalPrecision;
        this.signed = signed;
        this.unit = unit;
    }

    public Parameter(String name, DataType dataType, @Nullable ByteOrder byteOrder, int registerOffset) {
        this(name, dataType, byteOrder, registerOffset, null, null, null, null, null);
    }

    public String getName() {
        return name;
    }

    public DataType getDataType() {
        return dataType;
    }

    public @Nullable ByteOrder getByteOrder() {
        return byteOrder;
    }

    public ByteOrder getEffectiveByteOrder() {
        return byteOrder != null ? byteOrder : ByteOrder.defaultFor(dataType);
    }

    public int getRegisterOffset() {
        return registerOffset;
    }

    public int getWordCount() {
        return wordCount != null ? wordCount : dataType.getWordCount();
    }

    public @Nullable Double getScalingFactor() {
        return scalingFactor;
    }

    public @Nullable Integer getDecimalPrecision() {
        return decimalPrecision;
    }

    public @Nullable Boolean getSigned() {
        return signed;
    }

    public @Nullable String getUnit() {
        return unit;
    }

    @Override
    public String toString() {
        return name + " (" + dataType + " @" + registerOffset + ")";
    }
}
