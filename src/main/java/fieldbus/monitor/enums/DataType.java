package fieldbus.monitor.enums;

public enum DataType {
    BOOL(1, 16, false),

    INT16(1, 16, true),

    UINT16(1, 16, false),

    INT32(2, 32, true),

    UINT32(2, 32, false),

    FLOAT32(2, 32, true),

    FLOAT64(4, 64, true),

    /* длина строки задается количеством слов параметра */
    STRING(1, 16, false);

    private final int wordCount;
    private final int bitWidth;
    private final boolean signedByDefault;

    DataType(int wordCount, int bitWidth, boolean signedByDefault) {
        this.wordCount = wordCount;
        this.bitWidth = bitWidth;
        this.signedByDefault = signedByDefault;
    }

    public int getWordCount() {
        return wordCount;
    }

    public int getBitWidth() {
        return bitWidth;
    }

    public boolean isSignedByDefault() {
        return signedByDefault;
    }

    public boolean isInteger() {
        return this == INT16 || this == UINT16 || this == INT32 || this == UINT32;
    }

    public boolean isFloat() {
        return this == FLOAT32 || this == FLOAT64;
    }

    public boolean isNumeric() {
        return isInteger() || isFloat();
    }
}
