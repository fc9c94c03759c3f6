package fieldbus.monitor.model;

import fieldbus.monitor.enums.CoilType;
import fieldbus.monitor.enums.ErrorKind;
import org.jetbrains.annotations.Nullable;

public class CoilWriteResult {
    private final int address;
    private final boolean value;
    private final CoilType coilType;
    private final ErrorKind errorKind;
    private final String error;

    private CoilWriteResult(
            int address,
            boolean value,
            @Nullable CoilType coilType,
            @Nullable ErrorKind errorKind,
            @Nullable String error
    ) {
        this.address = address;
        this.value = value;
        this.coilType = coilType;
        this.errorKind = errorKind;
        this.error = error;
    }

    public static CoilWriteResult applied(int address, boolean value) {
        return new CoilWriteResult(address, value, null, null, null);
    }

    public static CoilWriteResult failed(int address, boolean value, ErrorKind errorKind, String error) {
        return new CoilWriteResult(address, value, null, errorKind, error);
    }

    public CoilWriteResult withCoilType(CoilType coilType) {
        return new CoilWriteResult(address, value, coilType, errorKind, error);
    }

    public int getAddress() {
        return address;
    }

    public boolean getValue() {
        return value;
    }

    public @Nullable CoilType getCoilType() {
        return coilType;
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public @Nullable ErrorKind getErrorKind() {
        return errorKind;
    }

    public @Nullable String getError() {
        return error;
    }

    public String getMessage() {
        String coil = coilType != null ? coilType.getTemplate() + " coil" : "coil";
        if (isSuccess()) {
            return "Successfully set " + coil + " at address " + address + " to " + value;
        }
        return "Failed to set " + coil + " at address " + address + ": " + error;
    }
}
