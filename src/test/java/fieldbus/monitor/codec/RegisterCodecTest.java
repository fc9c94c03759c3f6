package fieldbus.monitor.codec;

import fieldbus.monitor.enums.ByteOrder;
import fieldbus.monitor.enums.DataType;
import fieldbus.monitor.exception.InvalidByteOrderException;
import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.exception.ValueOutOfRangeException;
import fieldbus.monitor.model.Parameter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RegisterCodecTest {
    private static final ByteOrder[] WORD_ORDERS = {ByteOrder.AB, ByteOrder.BA};
    private static final ByteOrder[] WIDE_ORDERS = {ByteOrder.ABCD, ByteOrder.CDAB, ByteOrder.BADC, ByteOrder.DCBA};

    static Stream<Arguments> roundTripValues() {
        List<Arguments> values = new ArrayList<>();
        for (ByteOrder order : WORD_ORDERS) {
            values.add(Arguments.of(DataType.BOOL, order, true, true));
            values.add(Arguments.of(DataType.BOOL, order, false, false));
            values.add(Arguments.of(DataType.INT16, order, -1234, -1234L));
            values.add(Arguments.of(DataType.UINT16, order, 54321, 54321L));
        }
        for (ByteOrder order : WIDE_ORDERS) {
            values.add(Arguments.of(DataType.INT32, order, -123456789, -123456789L));
            values.add(Arguments.of(DataType.UINT32, order, 3000000000L, 3000000000L));
            values.add(Arguments.of(DataType.FLOAT32, order, 3.14f, (double) 3.14f));
            values.add(Arguments.of(DataType.FLOAT32, order, -0.5f, -0.5));
            values.add(Arguments.of(DataType.FLOAT64, order, 6.02214076e23, 6.02214076e23));
        }
        values.add(Arguments.of(DataType.STRING, null, "PUMP-7", "PUMP-7"));
        return values.stream();
    }

    @ParameterizedTest(name = "{0} {1}: {2}")
    @MethodSource("roundTripValues")
    @DisplayName("Проверка что декодирование закодированного значения возвращает исходное")
    void checkRoundTrip(DataType dataType, ByteOrder order, Object value, Object expected)
            throws ValidationException {
        int[] words = RegisterCodec.encode(value, dataType, order, null);

        if (dataType != DataType.STRING) {
            assertEquals(dataType.getWordCount(), words.length);
        }
        assertEquals(expected, RegisterCodec.decode(words, 0, dataType, order, null, null));
    }

    @Test
    @DisplayName("Проверка совпадения с исходным значением после масштабирования")
    void checkScaledRoundTrip() throws ValidationException {
        for (ByteOrder order : WIDE_ORDERS) {
            int[] words = RegisterCodec.encode(-1234.56, DataType.INT32, order, 0.01);
            assertEquals(-1234.56, (Double) RegisterCodec.decode(words, 0, DataType.INT32, order, 0.01, null), 1e-9);
        }
        for (ByteOrder order : WORD_ORDERS) {
            int[] words = RegisterCodec.encode(655.35, DataType.UINT16, order, 0.01);
            assertEquals(655.35, (Double) RegisterCodec.decode(words, 0, DataType.UINT16, order, 0.01, null), 1e-9);
        }
    }

    @Test
    @DisplayName("Проверка что одни и те же слова дают разные значения в разном порядке")
    void checkOrderChangesValue() throws ValidationException {
        int[] words = {0x0042, 0x1234};

        Object abcd = RegisterCodec.decode(words, 0, DataType.UINT32, ByteOrder.ABCD, null, null);
        Object cdab = RegisterCodec.decode(words, 0, DataType.UINT32, ByteOrder.CDAB, null, null);

        assertEquals(0x00421234L, abcd);
        assertEquals(0x12340042L, cdab);
        assertArrayEquals(words, RegisterCodec.encode(abcd, DataType.UINT32, ByteOrder.ABCD, null));
        assertArrayEquals(words, RegisterCodec.encode(cdab, DataType.UINT32, ByteOrder.CDAB, null));
    }

    @Test
    @DisplayName("Проверка порядка слов для 32-битного целого")
    void checkInt32WordOrder() throws ValidationException {
        int[] words = {0x0001, 0x0002};

        assertEquals(65538L, RegisterCodec.decode(words, 0, DataType.UINT32, ByteOrder.ABCD, null, null));
        assertEquals(131073L, RegisterCodec.decode(words, 0, DataType.UINT32, ByteOrder.CDAB, null, null));
        assertEquals(0x01000200L, RegisterCodec.decode(words, 0, DataType.UINT32, ByteOrder.BADC, null, null));
        assertEquals(0x02000100L, RegisterCodec.decode(words, 0, DataType.UINT32, ByteOrder.DCBA, null, null));
    }

    @Test
    @DisplayName("Проверка порядка байт для FLOAT32")
    void checkFloat32ByteOrders() throws ValidationException {
        /* 1.0f = 0x3F800000 */
        assertArrayEquals(new int[]{0x3F80, 0x0000}, RegisterCodec.encode(1.0f, DataType.FLOAT32, ByteOrder.ABCD, null));
        assertArrayEquals(new int[]{0x0000, 0x3F80}, RegisterCodec.encode(1.0f, DataType.FLOAT32, ByteOrder.CDAB, null));
        assertArrayEquals(new int[]{0x803F, 0x0000}, RegisterCodec.encode(1.0f, DataType.FLOAT32, ByteOrder.BADC, null));
        assertArrayEquals(new int[]{0x0000, 0x803F}, RegisterCodec.encode(1.0f, DataType.FLOAT32, ByteOrder.DCBA, null));

        assertEquals(1.0, RegisterCodec.decode(new int[]{0x803F, 0x0000}, 0, DataType.FLOAT32, ByteOrder.BADC,
                null, null));
    }

    @Test
    @DisplayName("Проверка порядка байт для FLOAT64: единица перестановки - пара слов")
    void checkFloat64ByteOrders() throws ValidationException {
        /* 1.0 = 0x3FF0000000000000 */
        assertArrayEquals(new int[]{0x3FF0, 0, 0, 0}, RegisterCodec.encode(1.0, DataType.FLOAT64, ByteOrder.ABCD, null));
        assertArrayEquals(new int[]{0, 0, 0x3FF0, 0}, RegisterCodec.encode(1.0, DataType.FLOAT64, ByteOrder.CDAB, null));
        assertArrayEquals(new int[]{0, 0x3FF0, 0, 0}, RegisterCodec.encode(1.0, DataType.FLOAT64, ByteOrder.BADC, null));
        assertArrayEquals(new int[]{0, 0, 0, 0x3FF0}, RegisterCodec.encode(1.0, DataType.FLOAT64, ByteOrder.DCBA, null));
        /* байты внутри слов не переставляются */
        assertEquals(Double.longBitsToDouble(0xF03F000000000000L), RegisterCodec.decode(new int[]{0, 0, 0, 0xF03F}, 0,
                DataType.FLOAT64, ByteOrder.DCBA, null, null));

        for (ByteOrder order : new ByteOrder[]{ByteOrder.ABCD, ByteOrder.CDAB, ByteOrder.BADC, ByteOrder.DCBA}) {
            int[] words = RegisterCodec.encode(-273.15, DataType.FLOAT64, order, null);
            assertEquals(-273.15, RegisterCodec.decode(words, 0, DataType.FLOAT64, order, null, null));
        }
    }

    @Test
    @DisplayName("Проверка что FLOAT32 декодируется без потери точности")
    void checkFloatExactness() throws ValidationException {
        int[] words = RegisterCodec.encode(0.1f, DataType.FLOAT32, ByteOrder.ABCD, null);
        assertEquals((double) 0.1f, RegisterCodec.decode(words, 0, DataType.FLOAT32, ByteOrder.ABCD, null, null));
    }

    @Test
    @DisplayName("Проверка 16-битных типов и перестановки байт")
    void checkWordTypes() throws ValidationException {
        assertEquals(-112L, RegisterCodec.decode(new int[]{0xFF90}, 0, DataType.INT16, ByteOrder.AB, null, null));
        assertEquals(65424L, RegisterCodec.decode(new int[]{0xFF90}, 0, DataType.UINT16, ByteOrder.AB, null, null));
        assertEquals(0x3412L, RegisterCodec.decode(new int[]{0x1234}, 0, DataType.UINT16, ByteOrder.BA, null, null));
        assertEquals(true, RegisterCodec.decode(new int[]{0, 1}, 1, DataType.BOOL, null, null, null));

        /* отрицательные значения при явном признаке знака для UINT16 */
        assertEquals(-1L, RegisterCodec.decode(new int[]{0xFFFF}, 0, DataType.UINT16, ByteOrder.AB, null, true));
    }

    @Test
    @DisplayName("Проверка границ диапазонов целых типов")
    void checkIntegerBounds() throws ValidationException {
        assertArrayEquals(new int[]{0x7FFF}, RegisterCodec.encode(32767, DataType.INT16, ByteOrder.AB, null));
        assertArrayEquals(new int[]{0x8000}, RegisterCodec.encode(-32768, DataType.INT16, ByteOrder.AB, null));
        assertThrows(ValueOutOfRangeException.class,
                () -> RegisterCodec.encode(32768, DataType.INT16, ByteOrder.AB, null));
        assertThrows(ValueOutOfRangeException.class,
                () -> RegisterCodec.encode(-32769, DataType.INT16, ByteOrder.AB, null));

        assertArrayEquals(new int[]{0xFFFF}, RegisterCodec.encode(65535, DataType.UINT16, ByteOrder.AB, null));
        assertThrows(ValueOutOfRangeException.class,
                () -> RegisterCodec.encode(65536, DataType.UINT16, ByteOrder.AB, null));
        assertThrows(ValueOutOfRangeException.class,
                () -> RegisterCodec.encode(-1, DataType.UINT16, ByteOrder.AB, null));

        assertArrayEquals(new int[]{0x8000, 0x0000},
                RegisterCodec.encode(Integer.MIN_VALUE, DataType.INT32, ByteOrder.ABCD, null));
        assertArrayEquals(new int[]{0x7FFF, 0xFFFF},
                RegisterCodec.encode(Integer.MAX_VALUE, DataType.INT32, ByteOrder.ABCD, null));
        assertThrows(ValueOutOfRangeException.class,
                () -> RegisterCodec.encode(2147483648L, DataType.INT32, ByteOrder.ABCD, null));
        assertThrows(ValueOutOfRangeException.class,
                () -> RegisterCodec.encode(-2147483649L, DataType.INT32, ByteOrder.ABCD, null));

        assertArrayEquals(new int[]{0xFFFF, 0xFFFF},
                RegisterCodec.encode(4294967295L, DataType.UINT32, ByteOrder.ABCD, null));
        assertThrows(ValueOutOfRangeException.class,
                () -> RegisterCodec.encode(4294967296L, DataType.UINT32, ByteOrder.ABCD, null));
        assertArrayEquals(new int[]{0x0000, 0x0000}, RegisterCodec.encode(0, DataType.UINT32, ByteOrder.ABCD, null));
        assertThrows(ValueOutOfRangeException.class,
                () -> RegisterCodec.encode(-1, DataType.UINT32, ByteOrder.ABCD, null));
        assertArrayEquals(new int[]{0x0000}, RegisterCodec.encode(0, DataType.UINT16, ByteOrder.AB, null));

        assertThrows(ValueOutOfRangeException.class,
                () -> RegisterCodec.encode(1e39, DataType.FLOAT32, ByteOrder.ABCD, null));
    }

    @Test
    @DisplayName("Проверка масштаба и округления до заданной точности")
    void checkScaleAndPrecision() throws ValidationException {
        Parameter temperature = new Parameter("temperature", DataType.INT16, null, 0, null, 0.1, 1, null, "C");

        assertEquals(-11.2, RegisterCodec.decode(new int[]{0xFF90}, 0, temperature));
        assertEquals(21.9, RegisterCodec.decode(new int[]{0x00DB}, 0, temperature));
        assertArrayEquals(new int[]{215}, RegisterCodec.encode(21.5, temperature));
        assertArrayEquals(new int[]{0xFF90}, RegisterCodec.encode(-11.2, temperature));

        assertEquals(21.5, (Double) RegisterCodec.decode(new int[]{215}, 0, DataType.UINT16, ByteOrder.AB, 0.1, null),
                1e-9);
    }

    @Test
    @DisplayName("Проверка строк: обрезка, дополнение нулями, остановка на нуле")
    void checkStrings() throws ValidationException {
        assertArrayEquals(new int[]{0x4142, 0x0000}, RegisterCodec.encodeString("AB", 2));
        assertArrayEquals(new int[]{0x4142, 0x4344}, RegisterCodec.encodeString("ABCDE", 2));
        assertArrayEquals(new int[]{0x4142, 0x4300}, RegisterCodec.encodeString("ABC", 2));

        assertEquals("AB", RegisterCodec.decodeString(new int[]{0x4142, 0x0000}, 0, 2));
        assertEquals("ABC", RegisterCodec.decodeString(new int[]{0x4142, 0x4300, 0x4445}, 0, 3));
        assertEquals("SN-1", RegisterCodec.decode(RegisterCodec.encodeString("SN-1", 4), 0,
                new Parameter("serial", DataType.STRING, null, 0, 4, null, null, null, null)));
    }

    @Test
    @DisplayName("Проверка отказа для порядка байт неподходящей ширины")
    void checkInvalidByteOrder() {
        assertThrows(InvalidByteOrderException.class,
                () -> RegisterCodec.decode(new int[]{1, 2}, 0, DataType.INT16, ByteOrder.CDAB, null, null));
        assertThrows(InvalidByteOrderException.class,
                () -> RegisterCodec.decode(new int[]{1, 2}, 0, DataType.FLOAT32, ByteOrder.AB, null, null));
        assertThrows(InvalidByteOrderException.class,
                () -> RegisterCodec.encode(1, DataType.UINT32, ByteOrder.BA, null));
    }

    @Test
    @DisplayName("Проверка отказа при нехватке слов")
    void checkNotEnoughWords() {
        assertThrows(ValidationException.class,
                () -> RegisterCodec.decode(new int[]{1, 2, 3}, 2, DataType.FLOAT32, ByteOrder.ABCD, null, null));
    }
}
