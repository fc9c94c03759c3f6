package fieldbus.monitor.configuration;

import fieldbus.monitor.enums.ByteOrder;
import fieldbus.monitor.enums.DataType;
import fieldbus.monitor.enums.Parity;
import fieldbus.monitor.enums.TransportKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Описание устройств в application.yml для автономного запуска
 */
@ConfigurationProperties("fieldbus")
public class DevicesConfiguration {
    private List<DeviceProperties> devices = new ArrayList<>();

    public List<DeviceProperties> getDevices() {
        return devices;
    }

    public void setDevices(List<DeviceProperties> devices) {
        this.devices = devices;
    }

    public static class DeviceProperties {
        private String id;
        private String name;
        private boolean enabled = true;
        private Long pollInterval;
        private Long fastPollInterval;
        private ConnectionProperties connection = new ConnectionProperties();
        private List<RangeProperties> ranges = new ArrayList<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Long getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Long pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Long getFastPollInterval() {
            return fastPollInterval;
        }

        public void setFastPollInterval(Long fastPollInterval) {
            this.fastPollInterval = fastPollInterval;
        }

        public ConnectionProperties getConnection() {
            return connection;
        }

        public void setConnection(ConnectionProperties connection) {
            this.connection = connection;
        }

        public List<RangeProperties> getRanges() {
            return ranges;
        }

        public void setRanges(List<RangeProperties> ranges) {
            this.ranges = ranges;
        }
    }

    public static class ConnectionProperties {
        private TransportKind type = TransportKind.STREAM;
        private String host;
        private Integer port;
        private Integer unitId;
        private String serialPath;
        private Integer baudRate;
        private Integer dataBits;
        private Integer stopBits;
        private Parity parity;
        private Long timeout;
        private Long connectTimeout;
        private Integer retries;
        private Long retryDelay;

        public TransportKind getType() {
            return type;
        }

        public void setType(TransportKind type) {
            this.type = type;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public Integer getPort() {
            return port;
        }

        public void setPort(Integer port) {
            this.port = port;
        }

        public Integer getUnitId() {
            return unitId;
        }

        public void setUnitId(Integer unitId) {
            this.unitId = unitId;
        }

        public String getSerialPath() {
            return serialPath;
        }

        public void setSerialPath(String serialPath) {
            this.serialPath = serialPath;
        }

        public Integer getBaudRate() {
            return baudRate;
        }

        public void setBaudRate(Integer baudRate) {
            this.baudRate = baudRate;
        }

        public Integer getDataBits() {
            return dataBits;
        }

        public void setDataBits(Integer dataBits) {
            this.dataBits = dataBits;
        }

        public Integer getStopBits() {
            return stopBits;
        }

        public void setStopBits(Integer stopBits) {
            this.stopBits = stopBits;
        }

        public Parity getParity() {
            return parity;
        }

        public void setParity(Parity parity) {
            this.parity = parity;
        }

        public Long getTimeout() {
            return timeout;
        }

        public void setTimeout(Long timeout) {
            this.timeout = timeout;
        }

        public Long getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Long connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Integer getRetries() {
            return retries;
        }

        public void setRetries(Integer retries) {
            this.retries = retries;
        }

        public Long getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Long retryDelay) {
            this.retryDelay = retryDelay;
        }
    }

    public static class RangeProperties {
        private int start;
        private int count;
        private int functionCode = 3;
        private List<ParameterProperties> parameters = new ArrayList<>();

        public int getStart() {
            return start;
        }

        public void setStart(int start) {
            this.start = start;
        }

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        public int getFunctionCode() {
            return functionCode;
        }

        public void setFunctionCode(int functionCode) {
            this.functionCode = functionCode;
        }

        public List<ParameterProperties> getParameters() {
            return parameters;
        }

        public void setParameters(List<ParameterProperties> parameters) {
            this.parameters = parameters;
        }
    }

    public static class ParameterProperties {
        private String name;
        private DataType dataType;
        private ByteOrder byteOrder;
        private int offset;
        private Integer wordCount;
        private Double scale;
        private Integer decimalPrecision;
        private Boolean signed;
        private String unit;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public DataType getDataType() {
            return dataType;
        }

        public void setDataType(DataType dataType) {
            this.dataType = dataType;
        }

        public ByteOrder getByteOrder() {
            return byteOrder;
        }

        public void setByteOrder(ByteOrder byteOrder) {
            this.byteOrder = byteOrder;
        }

        public int getOffset() {
            return offset;
        }

        public void setOffset(int offset) {
            this.offset = offset;
        }

        public Integer getWordCount() {
            return wordCount;
        }

        public void setWordCount(Integer wordCount) {
            this.wordCount = wordCount;
        }

        public Double getScale() {
            return scale;
        }

        public void setScale(Double scale) {
            this.scale = scale;
        }

        public Integer getDecimalPrecision() {
            return decimalPrecision;
        }

        public void setDecimalPrecision(Integer decimalPrecision) {
            this.decimalPrecision = decimalPrecision;
        }

        public Boolean getSigned() {
            return signed;
        }

        public void setSigned(Boolean signed) {
            this.signed = signed;
        }

        public String getUnit() {
            return unit;
        }

        public void setUnit(String unit) {
            this.unit = unit;
        }
    }
}
