package fieldbus.monitor.service.impl;

import fieldbus.monitor.codec.RegisterCodec;
import fieldbus.monitor.connection.ConnectionHandle;
import fieldbus.monitor.enums.DataType;
import fieldbus.monitor.enums.ErrorKind;
import fieldbus.monitor.enums.FunctionCode;
import fieldbus.monitor.exception.ModbusException;
import fieldbus.monitor.exception.ProtocolException;
import fieldbus.monitor.exception.ValidationException;
import fieldbus.monitor.model.CoilWriteResult;
import fieldbus.monitor.model.Parameter;
import fieldbus.monitor.model.ParameterReading;
import fieldbus.monitor.model.RangeData;
import fieldbus.monitor.model.RegisterRange;
import fieldbus.monitor.service.RegisterOperationsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class RegisterOperationsServiceImpl implements RegisterOperationsService {
    private static final Logger logger = LoggerFactory.getLogger(RegisterOperationsServiceImpl.class);
    private static final int MAX_ADDRESS = 0xFFFF;
    private static final int MAX_WRITE_REGISTERS = 123;
    private static final int MAX_WRITE_COILS = 1968;

    @Override
    public RangeData readRange(ConnectionHandle handle, RegisterRange range) throws ModbusException {
        FunctionCode functionCode = range.getFunctionCode();
        checkAddresses(range.getStartAddress(), range.getCount(), functionCode.getMaxReadCount());

        int unitId = handle.getUnitId();
        int start = range.getStartAddress();
        int count = range.getCount();
        RangeData data = switch (functionCode) {
            case READ_COILS -> RangeData.ofBits(range,
                    handle.call("Read coils", transport -> transport.readCoils(unitId, start, count)));
            case READ_DISCRETE_INPUTS -> RangeData.ofBits(range,
                    handle.call("Read discrete inputs", transport -> transport.readDiscreteInputs(unitId, start, count)));
            case READ_HOLDING_REGISTERS -> RangeData.ofWords(range,
                    handle.call("Read holding registers", transport -> transport.readHoldingRegisters(unitId, start, count)));
            case READ_INPUT_REGISTERS -> RangeData.ofWords(range,
                    handle.call("Read input registers", transport -> transport.readInputRegisters(unitId, start, count)));
        };
        /* некоторые устройства возвращают биты с запасом до целого байта */
        if (data.size() < count) {
            throw new ProtocolException(
                    "Device returned " + data.size() + " values for " + range + ", expected " + count);
        }
        logger.debug("Прочитан диапазон {} с {}", range, handle.getConfig().describe());
        return data;
    }

    @Override
    public List<ParameterReading> readParameters(
            ConnectionHandle handle,
            RegisterRange range,
            List<Parameter> parameters
    ) throws ModbusException {
        return decodeParameters(readRange(handle, range), parameters);
    }

    @Override
    public List<ParameterReading> decodeParameters(RangeData data, List<Parameter> parameters) {
        RegisterRange range = data.getRange();
        int[] words = data.getWords();
        List<ParameterReading> readings = new ArrayList<>(parameters.size());
        for (Parameter parameter : parameters) {
            readings.add(decodeParameter(range, words, parameter));
        }
        return readings;
    }

    private ParameterReading decodeParameter(RegisterRange range, int[] words, Parameter parameter) {
        int offset = parameter.getRegisterOffset();
        int wordCount = parameter.getWordCount();
        if (offset < 0 || offset + wordCount > range.getCount()) {
            return partialDecodeError(parameter, "Parameter " + parameter.getName() + " at offset " + offset + " with "
                    + wordCount + " words does not fit range of " + range.getCount());
        }
        if (wordCount < parameter.getDataType().getWordCount()) {
            return partialDecodeError(parameter, parameter.getDataType() + " needs "
                    + parameter.getDataType().getWordCount() + " words, " + wordCount + " configured");
        }
        if (range.getFunctionCode().isBitAccess() && parameter.getDataType() != DataType.BOOL) {
            return partialDecodeError(parameter, "Only BOOL parameters can be read from " + range);
        }
        try {
            Object value = RegisterCodec.decode(words, offset, parameter);
            if (value instanceof Double && !Double.isFinite((Double) value)) {
                return partialDecodeError(parameter, "Non-finite value");
            }
            return ParameterReading.success(parameter, value);
        } catch (ValidationException e) {
            return partialDecodeError(parameter, e.getMessage());
        }
    }

    private ParameterReading partialDecodeError(Parameter parameter, String message) {
        logger.debug("Ошибка декодирования параметра {}: {}", parameter, message);
        return ParameterReading.failure(parameter, ErrorKind.PARTIAL_DECODE, message);
    }

    @Override
    public void writeCoil(ConnectionHandle handle, int address, boolean value) throws ModbusException {
        checkAddresses(address, 1, 1);
        int unitId = handle.getUnitId();
        handle.call("Write coil", transport -> {
            transport.writeSingleCoil(unitId, address, value);
            return null;
        });
        logger.info("Катушка {} на {} выставлена в {}", address, handle.getConfig().describe(), value);
    }

    @Override
    public List<CoilWriteResult> writeCoils(ConnectionHandle handle, int address, boolean[] values)
            throws ValidationException {
        checkCoilWrite(address, values.length);
        int unitId = handle.getUnitId();
        boolean[] batch = values.clone();
        List<CoilWriteResult> results = new ArrayList<>(batch.length);
        try {
            handle.call("Write coils", transport -> {
                transport.writeMultipleCoils(unitId, address, batch);
                return null;
            });
            for (int i = 0; i < batch.length; i++) {
                results.add(CoilWriteResult.applied(address + i, batch[i]));
            }
            logger.info("Катушки {}-{} на {} выставлены", address, address + batch.length - 1,
                    handle.getConfig().describe());
        } catch (ModbusException e) {
            logger.error("Ошибка выставления значений катушек {}-{} на {}", address, address + batch.length - 1,
                    handle.getConfig().describe(), e);
            for (int i = 0; i < batch.length; i++) {
                results.add(CoilWriteResult.failed(address + i, batch[i], e.getKind(), e.getMessage()));
            }
        }
        return results;
    }

    @Override
    public void writeParameter(ConnectionHandle handle, RegisterRange range, Parameter parameter, Object value)
            throws ModbusException {
        writeEncoded(handle, range, parameter, encodeWrite(range, parameter, value));
        logger.info("Параметр {} на {} записан: {}", parameter.getName(), handle.getConfig().describe(), value);
    }

    @Override
    public void checkCoilWrite(int address, int count) throws ValidationException {
        checkAddresses(address, count, MAX_WRITE_COILS);
    }

    @Override
    public int[] encodeWrite(RegisterRange range, Parameter parameter, Object value) throws ValidationException {
        FunctionCode functionCode = range.getFunctionCode();
        if (!functionCode.isWritable()) {
            throw new ValidationException("Parameter " + parameter.getName() + " is read-only (" + range + ")");
        }
        if (functionCode.isBitAccess() && parameter.getDataType() != DataType.BOOL) {
            throw new ValidationException("Only BOOL parameters can be written to coils");
        }
        int[] words = RegisterCodec.encode(value, parameter);
        int wordCount = functionCode.isBitAccess() ? 1 : words.length;
        checkFitsRange(range, parameter, wordCount);
        checkAddresses(range.getStartAddress() + parameter.getRegisterOffset(), wordCount,
                functionCode.isBitAccess() ? 1 : MAX_WRITE_REGISTERS);
        return words;
    }

    @Override
    public void writeEncoded(ConnectionHandle handle, RegisterRange range, Parameter parameter, int[] words)
            throws ModbusException {
        int address = range.getStartAddress() + parameter.getRegisterOffset();
        if (range.getFunctionCode().isBitAccess()) {
            writeCoil(handle, address, words[0] != 0);
            return;
        }
        checkAddresses(address, words.length, MAX_WRITE_REGISTERS);
        int unitId = handle.getUnitId();
        if (words.length == 1) {
            handle.call("Write register", transport -> {
                transport.writeSingleRegister(unitId, address, words[0]);
                return null;
            });
        } else {
            handle.call("Write registers", transport -> {
                transport.writeMultipleRegisters(unitId, address, words);
                return null;
            });
        }
    }

    private void checkFitsRange(RegisterRange range, Parameter parameter, int wordCount) throws ValidationException {
        if (parameter.getRegisterOffset() < 0 || parameter.getRegisterOffset() + wordCount > range.getCount()) {
            throw new ValidationException("Parameter " + parameter.getName() + " does not fit " + range);
        }
    }

    private void checkAddresses(int address, int count, int maxCount) throws ValidationException {
        if (address < 0 || address > MAX_ADDRESS) {
            throw new ValidationException("Address " + address + " is out of range 0.." + MAX_ADDRESS);
        }
        if (count < 1 || count > maxCount) {
            throw new ValidationException("Count " + count + " is out of range 1.." + maxCount);
        }
        if (address + count > MAX_ADDRESS + 1) {
            throw new ValidationException("Range " + address + "+" + count + " exceeds address space");
        }
    }
}
