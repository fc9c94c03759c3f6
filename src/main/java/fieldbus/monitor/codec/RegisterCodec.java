package fieldbus.monitor.codec;

import fieldbus.monitor.enums.ByteOrder;
import fieldbus.monitor.enums.DataType;
import fieldbus.monitor.exception.InvalidByteOrderException;
import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.exception.ValueOutOfRangeException;
import fieldbus.monitor.model.Parameter;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

/**
 * Преобразование 16-битных слов регистров в типизированные значения и обратно.
 * <p>
 * Порядок байт применяется к последовательности слов до интерпретации значения:
 * <ul>
 *     <li>16 бит: AB - как есть, BA - байты слова переставлены;</li>
 *     <li>32 бита: ABCD - как есть, CDAB - слова переставлены, BADC - байты внутри каждого слова переставлены,
 *     DCBA - и то и другое;</li>
 *     <li>64 бита: те же правила, где единица - пара слов (32-битная половина), а внутри половины меняются слова.
 *     Байты внутри слов для 64 бит не переставляются: DCBA дает слова в обратном порядке [w3, w2, w1, w0],
 *     полностью little-endian double не поддерживается.</li>
 * </ul>
 * Перестановки симметричны, поэтому одно и то же преобразование используется и для чтения, и для записи.
 */
public final class RegisterCodec {
    private static final long INT16_MIN = Short.MIN_VALUE;
    private static final long INT16_MAX = Short.MAX_VALUE;
    private static final long UINT16_MAX = 0xFFFFL;
    private static final long INT32_MIN = Integer.MIN_VALUE;
    private static final long INT32_MAX = Integer.MAX_VALUE;
    private static final long UINT32_MAX = 0xFFFFFFFFL;

    private RegisterCodec() {
    }

    public static Object decode(
            int[] words,
            int offset,
            DataType dataType,
            @Nullable ByteOrder byteOrder,
            @Nullable Double scale,
            @Nullable Boolean signed
    ) throws ValidationException {
        if (dataType == DataType.STRING) {
            return decodeString(words, offset, words.length - offset);
        }
        ByteOrder order = checkByteOrder(dataType, byteOrder);
        int[] raw = reorder(slice(words, offset, dataType.getWordCount()), order);

        switch (dataType) {
            case BOOL:
                return raw[0] != 0;
            case INT16:
            case UINT16: {
                long value = raw[0];
                if (isSigned(dataType, signed)) {
                    value = (short) raw[0];
                }
                return applyScale(value, scale);
            }
            case INT32:
            case UINT32: {
                long unsigned = ((long) raw[0] << 16) | raw[1];
                long value = isSigned(dataType, signed) ? (int) unsigned : unsigned;
                return applyScale(value, scale);
            }
            case FLOAT32: {
                float value = Float.intBitsToFloat((raw[0] << 16) | raw[1]);
                return applyScale((double) value, scale);
            }
            case FLOAT64: {
                long bits = ((long) raw[0] << 48) | ((long) raw[1] << 32) | ((long) raw[2] << 16) | raw[3];
                return applyScale(Double.longBitsToDouble(bits), scale);
            }
            default:
                throw new ValidationException("Unsupported data type " + dataType);
        }
    }

    /**
     * Декодирование значения параметра с учетом его типа, порядка байт, масштаба и точности.
     *
     * @param words  слова всего диапазона
     * @param offset смещение параметра от начала диапазона
     */
    public static Object decode(int[] words, int offset, Parameter parameter) throws ValidationException {
        if (parameter.getDataType() == DataType.STRING) {
            return decodeString(words, offset, parameter.getWordCount());
        }
        Object value = decode(words, offset, parameter.getDataType(), parameter.getEffectiveByteOrder(),
                parameter.getScalingFactor(), parameter.getSigned());
        return round(value, parameter.getDecimalPrecision());
    }

    public static String decodeString(int[] words, int offset, int wordCount) throws ValidationException {
        int[] raw = slice(words, offset, wordCount);
        byte[] bytes = new byte[raw.length * 2];
        int length = 0;
        for (int word : raw) {
            byte high = (byte) (word >> 8);
            if (high == 0) {
                break;
            }
            bytes[length++] = high;
            byte low = (byte) word;
            if (low == 0) {
                break;
            }
            bytes[length++] = low;
        }
        return new String(bytes, 0, length, StandardCharsets.US_ASCII);
    }

    public static int[] encode(
            Object value,
            DataType dataType,
            @Nullable ByteOrder byteOrder,
            @Nullable Double scale
    ) throws ValidationException {
        return encode(value, dataType, byteOrder, scale, null);
    }

    public static int[] encode(
            Object value,
            DataType dataType,
            @Nullable ByteOrder byteOrder,
            @Nullable Double scale,
            @Nullable Boolean signed
    ) throws ValidationException {
        if (value == null) {
            throw new ValidationException("Value must not be null");
        }
        if (dataType == DataType.STRING) {
            String text = value.toString();
            return encodeString(text, (text.length() + 1) / 2);
        }
        ByteOrder order = checkByteOrder(dataType, byteOrder);

        switch (dataType) {
            case BOOL:
                return reorder(new int[]{toBoolean(value) ? 1 : 0}, order);
            case INT16:
            case UINT16: {
                long raw = toRawInteger(value, dataType, scale);
                checkRange(raw, dataType, isSigned(dataType, signed), value);
                return reorder(new int[]{(int) (raw & 0xFFFF)}, order);
            }
            case INT32:
            case UINT32: {
                long raw = toRawInteger(value, dataType, scale);
                checkRange(raw, dataType, isSigned(dataType, signed), value);
                return reorder(new int[]{(int) ((raw >> 16) & 0xFFFF), (int) (raw & 0xFFFF)}, order);
            }
            case FLOAT32: {
                double raw = unscale(toNumber(value, dataType).doubleValue(), scale);
                if (Double.isFinite(raw) && Math.abs(raw) > Float.MAX_VALUE) {
                    throw new ValueOutOfRangeException(dataType, value);
                }
                int bits = Float.floatToRawIntBits((float) raw);
                return reorder(new int[]{(bits >>> 16) & 0xFFFF, bits & 0xFFFF}, order);
            }
            case FLOAT64: {
                double raw = unscale(toNumber(value, dataType).doubleValue(), scale);
                long bits = Double.doubleToRawLongBits(raw);
                return reorder(new int[]{
                        (int) ((bits >>> 48) & 0xFFFF),
                        (int) ((bits >>> 32) & 0xFFFF),
                        (int) ((bits >>> 16) & 0xFFFF),
                        (int) (bits & 0xFFFF)
                }, order);
            }
            default:
                throw new ValidationException("Unsupported data type " + dataType);
        }
    }

    public static int[] encode(Object value, Parameter parameter) throws ValidationException {
        if (parameter.getDataType() == DataType.STRING) {
            return encodeString(String.valueOf(value), parameter.getWordCount());
        }
        return encode(value, parameter.getDataType(), parameter.getEffectiveByteOrder(),
                parameter.getScalingFactor(), parameter.getSigned());
    }

    /**
     * Строка ASCII, дополненная нулями или обрезанная до wordCount * 2 байт.
     */
    public static int[] encodeString(String value, int wordCount) throws ValidationException {
        if (wordCount <= 0) {
            throw new ValidationException("String word count must be positive");
        }
        byte[] bytes = value.getBytes(StandardCharsets.US_ASCII);
        int[] words = new int[wordCount];
        for (int i = 0; i < wordCount; i++) {
            int high = 2 * i < bytes.length ? bytes[2 * i] & 0xFF : 0;
            int low = 2 * i + 1 < bytes.length ? bytes[2 * i + 1] & 0xFF : 0;
            words[i] = (high << 8) | low;
        }
        return words;
    }

    /**
     * Перестановка слов и байт согласно порядку. Преобразование является собственным обратным.
     */
    public static int[] reorder(int[] words, ByteOrder order) {
        int[] result = new int[words.length];
        if (words.length == 1) {
            result[0] = order.isSwapInsideUnits() ? swapBytes(words[0]) : words[0] & 0xFFFF;
            return result;
        }
        int unit = words.length / 2;
        for (int i = 0; i < words.length; i++) {
            int unitIndex = i / unit;
            int inside = i % unit;
            int sourceUnit = order.isSwapUnits() ? 1 - unitIndex : unitIndex;
            int sourceInside = order.isSwapInsideUnits() && unit > 1 ? unit - 1 - inside : inside;
            int word = words[sourceUnit * unit + sourceInside] & 0xFFFF;
            /* для 32 бит единица - слово, значит внутри меняем байты */
            result[i] = order.isSwapInsideUnits() && unit == 1 ? swapBytes(word) : word;
        }
        return result;
    }

    private static ByteOrder checkByteOrder(DataType dataType, @Nullable ByteOrder byteOrder)
            throws InvalidByteOrderException {
        ByteOrder order = byteOrder != null ? byteOrder : ByteOrder.defaultFor(dataType);
        boolean wordType = dataType.getBitWidth() == 16;
        if (order.isWordOrder() != wordType) {
            throw new InvalidByteOrderException(dataType, order);
        }
        return order;
    }

    private static int[] slice(int[] words, int offset, int count) throws ValidationException {
        if (offset < 0 || count <= 0 || offset + count > words.length) {
            throw new ValidationException(
                    "Not enough registers: need " + count + " at offset " + offset + ", have " + words.length);
        }
        int[] result = new int[count];
        for (int i = 0; i < count; i++) {
            result[i] = words[offset + i] & 0xFFFF;
        }
        return result;
    }

    private static int swapBytes(int word) {
        return ((word & 0xFF) << 8) | ((word >> 8) & 0xFF);
    }

    private static boolean isSigned(DataType dataType, @Nullable Boolean signed) {
        return signed != null ? signed : dataType.isSignedByDefault();
    }

    private static boolean hasScale(@Nullable Double scale) {
        return scale != null && scale != 1.0;
    }

    private static Object applyScale(long value, @Nullable Double scale) {
        if (hasScale(scale)) {
            return value * scale;
        }
        return value;
    }

    private static Object applyScale(double value, @Nullable Double scale) {
        if (hasScale(scale)) {
            return value * scale;
        }
        return value;
    }

    private static double unscale(double value, @Nullable Double scale) throws ValidationException {
        if (!hasScale(scale)) {
            return value;
        }
        if (scale == 0.0) {
            throw new ValidationException("Scaling factor must not be zero");
        }
        return value / scale;
    }

    private static Number toNumber(Object value, DataType dataType) throws ValidationException {
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? 1 : 0;
        }
        if (value instanceof String) {
            try {
                return new BigDecimal(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("Value '" + value + "' is not a number for " + dataType);
            }
        }
        throw new ValidationException("Value " + value + " can not be written as " + dataType);
    }

    private static boolean toBoolean(Object value) throws ValidationException {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean(((String) value).trim());
        }
        throw new ValidationException("Value " + value + " can not be written as " + DataType.BOOL);
    }

    private static long toRawInteger(Object value, DataType dataType, @Nullable Double scale)
            throws ValidationException {
        Number number = toNumber(value, dataType);
        boolean integral = number instanceof Long || number instanceof Integer || number instanceof Short
                || number instanceof Byte;
        if (integral && !hasScale(scale)) {
            return number.longValue();
        }
        double raw = unscale(number.doubleValue(), scale);
        if (!Double.isFinite(raw) || Math.abs(raw) > Long.MAX_VALUE / 2.0) {
            throw new ValueOutOfRangeException(dataType, value);
        }
        return Math.round(raw);
    }

    private static void checkRange(long raw, DataType dataType, boolean signed, Object value)
            throws ValueOutOfRangeException {
        boolean wide = dataType.getBitWidth() == 32;
        long min = signed ? (wide ? INT32_MIN : INT16_MIN) : 0;
        long max = signed ? (wide ? INT32_MAX : INT16_MAX) : (wide ? UINT32_MAX : UINT16_MAX);
        if (raw < min || raw > max) {
            throw new ValueOutOfRangeException(dataType, value);
        }
    }

    private static Object round(Object value, @Nullable Integer decimalPrecision) {
        if (decimalPrecision == null || !(value instanceof Double) || !Double.isFinite((Double) value)) {
            return value;
        }
        return BigDecimal.valueOf((Double) value).setScale(decimalPrecision, RoundingMode.HALF_UP).doubleValue();
    }
}
