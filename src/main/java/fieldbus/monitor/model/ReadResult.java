package fieldbus.monitor.model;

import fieldbus.monitor.enums.ErrorKind;
import org.jetbrains.annotations.Nullable;

/**
 * Результат чтения для внешних потребителей: снимок либо ошибка с понятным сообщением.
 * Флаг stale означает, что отдаются последние успешные данные, а свежий опрос не удался.
 */
public class ReadResult {
    private final boolean success;
    private final ReadingSnapshot snapshot;
    private final boolean stale;
    private final String message;
    private final ErrorKind errorKind;

    private ReadResult(
            boolean success,
            @Nullable ReadingSnapshot snapshot,
            boolean stale,
            String message,
            @Nullable ErrorKind errorKind
    ) {
        this.success = success;
        this.snapshot = snapshot;
        this.stale = stale;
        this.message = message;
        this.errorKind = errorKind;
    }

    public static ReadResult fresh(ReadingSnapshot snapshot) {
        return new ReadResult(true, snapshot, false, "OK", null);
    }

    public static ReadResult stale(ReadingSnapshot snapshot, String message, @Nullable ErrorKind errorKind) {
        return new ReadResult(true, snapshot, true, message, errorKind);
    }

    public static ReadResult failure(String message, ErrorKind errorKind) {
        return new ReadResult(false, null, false, message, errorKind);
    }

    public boolean isSuccess() {
        return success;
    }

    public @Nullable ReadingSnapshot getSnapshot() {
        return snapshot;
    }

    public boolean isStale() {
        return stale;
    }

    public String getMessage() {
        return message;
    }

    public @Nullable ErrorKind getErrorKind() {
        return errorKind;
    }
}
