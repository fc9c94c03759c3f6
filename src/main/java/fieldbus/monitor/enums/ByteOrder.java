package fieldbus.monitor.enums;

public enum ByteOrder {
    /* 16 бит: старший байт первым */
    AB(1, false, false),

    /* 16 бит: байты переставлены */
    BA(1, false, true),

    ABCD(2, false, false),

    CDAB(2, true, false),

    BADC(2, false, true),

    DCBA(2, true, true);

    private final int wordCount;
    private final boolean swapUnits;
    private final boolean swapInsideUnits;

    ByteOrder(int wordCount, boolean swapUnits, boolean swapInsideUnits) {
        this.wordCount = wordCount;
        this.swapUnits = swapUnits;
        this.swapInsideUnits = swapInsideUnits;
    }

    /**
     * @return true, если порядок применим к 16-битным типам
     */
    public boolean isWordOrder() {
        return wordCount == 1;
    }

    /**
     * @return true для порядков, в которых меняются местами слова (или 32-битные половины для FLOAT64)
     */
    public boolean isSwapUnits() {
        return swapUnits;
    }

    /**
     * @return true для порядков, в которых меняются байты внутри слова (или слова внутри половины для FLOAT64)
     */
    public boolean isSwapInsideUnits() {
        return swapInsideUnits;
    }

    public static ByteOrder defaultFor(DataType dataType) {
        return dataType.getBitWidth() > 16 ? ABCD : AB;
    }
}
