package fieldbus.monitor.model;

import org.jetbrains.annotations.Nullable;

/**
 * Сырые данные одного прочитанного диапазона. Для катушек и дискретных входов
 * слова содержат 0/1, а исходные биты лежат в {@link #getBits()}.
 */
public class RangeData {
    private final RegisterRange range;
    private final int[] words;
    private final boolean[] bits;

    private RangeData(RegisterRange range, int[] words, @Nullable boolean[] bits) {
        this.range = range;
        this.words = words;
        this.bits = bits;
    }

    public static RangeData ofWords(RegisterRange range, int[] words) {
        int[] masked = new int[words.length];
        for (int i = 0; i < words.length; i++) {
            masked[i] = words[i] & 0xFFFF;
        }
        return new RangeData(range, masked, null);
    }

    public static RangeData ofBits(RegisterRange range, boolean[] bits) {
        int[] words = new int[bits.length];
        for (int i = 0; i < bits.length; i++) {
            words[i] = bits[i] ? 1 : 0;
        }
        return new RangeData(range, words, bits.clone());
    }

    public RegisterRange getRange() {
        return range;
    }

    public int[] getWords() {
        return words.clone();
    }

    public @Nullable boolean[] getBits() {
        return bits != null ? bits.clone() : null;
    }

    public int size() {
        return words.length;
    }
}
