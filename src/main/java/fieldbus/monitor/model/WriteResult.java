package fieldbus.monitor.model;

import fieldbus.monitor.enums.ErrorKind;
import org.jetbrains.annotations.Nullable;

public class WriteResult {
    private final boolean success;
    private final String message;
    private final ErrorKind errorKind;

    private WriteResult(boolean success, String message, @Nullable ErrorKind errorKind) {
        this.success = success;
        this.message = message;
        this.errorKind = errorKind;
    }

    public static WriteResult success(String message) {
        return new WriteResult(true, message, null);
    }

    public static WriteResult failure(String message, ErrorKind errorKind) {
        return new WriteResult(false, message, errorKind);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getMessage() {
        return message;
    }

    public @Nullable ErrorKind getErrorKind() {
        return errorKind;
    }
}
