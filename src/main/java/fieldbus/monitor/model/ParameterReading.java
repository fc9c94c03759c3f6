package fieldbus.monitor.model;

import fieldbus.monitor.enums.DataType;
import fieldbus.monitor.enums.ErrorKind;
import org.jetbrains.annotations.Nullable;

public class ParameterReading {
    private final String name;
    private final Object value;
    private final String unit;
    private final DataType dataType;
    private final Integer decimalPrecision;
    private final ErrorKind errorKind;
    private final String error;

    private ParameterReading(
            String name,
            @Nullable Object value,
            @Nullable String unit,
            DataType dataType,
            @Nullable Integer decimalPrecision,
            @Nullable ErrorKind errorKind,
            @Nullable String error
    ) {
        this.name = name;
        this.value = value;
        this.unit = unit;
        this.dataType = dataType;
        this.decimalPrecision = decimalPrecision;
        this.errorKind = errorKind;
        this.error = error;
    }

    public static ParameterReading success(Parameter parameter, Object value) {
        return new ParameterReading(parameter.getName(), value, parameter.getUnit(), parameter.getDataType(),
                parameter.getDecimalPrecision(), null, null);
    }

    public static ParameterReading failure(Parameter parameter, ErrorKind errorKind, String error) {
        return new ParameterReading(parameter.getName(), null, parameter.getUnit(), parameter.getDataType(),
                parameter.getDecimalPrecision(), errorKind, error);
    }

    public String getName() {
        return name;
    }

    public @Nullable Object getValue() {
        return value;
    }

    public @Nullable String getUnit() {
        return unit;
    }

    public DataType getDataType() {
        return dataType;
    }

    public @Nullable Integer getDecimalPrecision() {
        return decimalPrecision;
    }

    public @Nullable ErrorKind getErrorKind() {
        return errorKind;
    }

    public @Nullable String getError() {
        return error;
    }

    public boolean isError() {
        return errorKind != null;
    }

    @Override
    public String toString() {
        return isError() ? name + "=<" + error + ">" : name + "=" + value + (unit != null ? " " + unit : "");
    }
}
