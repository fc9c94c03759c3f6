package fieldbus.monitor.model;

import fieldbus.monitor.enums.FunctionCode;

import java.util.List;

public class RegisterRange {
    private final int startAddress;
    private final int count;
    private final FunctionCode functionCode;
    private final List<Parameter> parameters;

    public RegisterRange(int startAddress, int count, FunctionCode functionCode, List<Parameter> parameters) {
        this.startAddress = startAddress;
        this.count = count;
        this.functionCode = functionCode;
        this.parameters = List.copyOf(parameters);
    }

    public int getStartAddress() {
        return startAddress;
    }

    public int getCount() {
        return count;
    }

    public FunctionCode getFunctionCode() {
        return functionCode;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return "FC" + functionCode.getCode() + " " + startAddress + "+" + count;
    }
}
