package fieldbus.monitor.enums;

import java.util.Arrays;

public enum FunctionCode {
    READ_COILS(1, true, 2000, true),

    READ_DISCRETE_INPUTS(2, true, 2000, false),

    READ_HOLDING_REGISTERS(3, false, 125, true),

    READ_INPUT_REGISTERS(4, false, 125, false);

    private final int code;
    private final boolean bitAccess;
    private final int maxReadCount;
    private final boolean writable;

    FunctionCode(int code, boolean bitAccess, int maxReadCount, boolean writable) {
        this.code = code;
        this.bitAccess = bitAccess;
        this.maxReadCount = maxReadCount;
        this.writable = writable;
    }

    public int getCode() {
        return code;
    }

    public boolean isBitAccess() {
        return bitAccess;
    }

    public int getMaxReadCount() {
        return maxReadCount;
    }

    public boolean isWritable() {
        return writable;
    }

    public static FunctionCode fromCode(int code) {
        return Arrays.stream(values())
                .filter(functionCode -> functionCode.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported function code " + code));
    }
}
