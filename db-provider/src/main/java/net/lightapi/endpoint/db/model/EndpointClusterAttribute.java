package net.lightapi.endpoint.db.model;

/**
 * An attribute visible on a cluster of an endpoint type, merged with the per endpoint type overrides
 * (storage, included, singleton, bound, default value and reporting). The override fields are null when
 * the store has no value for them.
 */
public final class EndpointClusterAttribute {
    private final long id;
    private final long clusterId;
    private final int code;
    private final Integer manufacturerCode;
    private final String hexCode;
    private final String name;
    private final String side;
    private final String type;
    private final String entryType;
    private final Integer minLength;
    private final Integer maxLength;
    private final String min;
    private final String max;
    private final String storage;
    private final Boolean included;
    private final Boolean singleton;
    private final Boolean bound;
    private final Boolean writable;
    private final String defaultValue;
    private final Boolean includedReportable;
    private final Integer minInterval;
    private final Integer maxInterval;
    private final Integer reportableChange;
    private final String define;

    private EndpointClusterAttribute(Builder builder) {
        this.id = builder.id;
        this.clusterId = builder.clusterId;
        this.code = builder.code;
        this.manufacturerCode = builder.manufacturerCode;
        this.hexCode = builder.hexCode;
        this.name = builder.name;
        this.side = builder.side;
        this.type = builder.type;
        this.entryType = builder.entryType;
        this.minLength = builder.minLength;
        this.maxLength = builder.maxLength;
        this.min = builder.min;
        this.max = builder.max;
        this.storage = builder.storage;
        this.included = builder.included;
        this.singleton = builder.singleton;
        this.bound = builder.bound;
        this.writable = builder.writable;
        this.defaultValue = builder.defaultValue;
        this.includedReportable = builder.includedReportable;
        this.minInterval = builder.minInterval;
        this.maxInterval = builder.maxInterval;
        this.reportableChange = builder.reportableChange;
        this.define = builder.define;
    }

    public static Builder builder() {
        return new Builder();
    }

    public long getId() {
        return id;
    }

    public long getClusterId() {
        return clusterId;
    }

    public int getCode() {
        return code;
    }

    public Integer getManufacturerCode() {
        return manufacturerCode;
    }

    public String getHexCode() {
        return hexCode;
    }

    public String getName() {
        return name;
    }

    /** Either {@code client} or {@code server}, see {@link net.lightapi.endpoint.EndpointConstants}. */
    public String getSide() {
        return side;
    }

    public String getType() {
        return type;
    }

    public String getEntryType() {
        return entryType;
    }

    public Integer getMinLength() {
        return minLength;
    }

    public Integer getMaxLength() {
        return maxLength;
    }

    public String getMin() {
        return min;
    }

    public String getMax() {
        return max;
    }

    public String getStorage() {
        return storage;
    }

    public Boolean getIncluded() {
        return included;
    }

    public Boolean getSingleton() {
        return singleton;
    }

    public Boolean getBound() {
        return bound;
    }

    public Boolean getWritable() {
        return writable;
    }

    public String getDefaultValue() {
        return defaultValue;
    }

    public Boolean getIncludedReportable() {
        return includedReportable;
    }

    public Integer getMinInterval() {
        return minInterval;
    }

    public Integer getMaxInterval() {
        return maxInterval;
    }

    public Integer getReportableChange() {
        return reportableChange;
    }

    public String getDefine() {
        return define;
    }

    @Override
    public String toString() {
        return "EndpointClusterAttribute{" +
                "id=" + id +
                ", clusterId=" + clusterId +
                ", hexCode='" + hexCode + '\'' +
                ", manufacturerCode=" + manufacturerCode +
                ", name='" + name + '\'' +
                ", side='" + side + '\'' +
                ", type='" + type + '\'' +
                ", included=" + included +
                ", defaultValue='" + defaultValue + '\'' +
                '}';
    }

    public static final class Builder {
        private long id;
        private long clusterId;
        private int code;
        private Integer manufacturerCode;
        private String hexCode;
        private String name;
        private String side;
        private String type;
        private String entryType;
        private Integer minLength;
        private Integer maxLength;
        private String min;
        private String max;
        private String storage;
        private Boolean included;
        private Boolean singleton;
        private Boolean bound;
        private Boolean writable;
        private String defaultValue;
        private Boolean includedReportable;
        private Integer minInterval;
        private Integer maxInterval;
        private Integer reportableChange;
        private String define;

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder clusterId(long clusterId) {
            this.clusterId = clusterId;
            return this;
        }

        public Builder code(int code) {
            this.code = code;
            return this;
        }

        public Builder manufacturerCode(Integer manufacturerCode) {
            this.manufacturerCode = manufacturerCode;
            return this;
        }

        public Builder hexCode(String hexCode) {
            this.hexCode = hexCode;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder side(String side) {
            this.side = side;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder entryType(String entryType) {
            this.entryType = entryType;
            return this;
        }

        public Builder minLength(Integer minLength) {
            this.minLength = minLength;
            return this;
        }

        public Builder maxLength(Integer maxLength) {
            this.maxLength = maxLength;
            return this;
        }

        public Builder min(String min) {
            this.min = min;
            return this;
        }

        public Builder max(String max) {
            this.max = max;
            return this;
        }

        public Builder storage(String storage) {
            this.storage = storage;
            return this;
        }

        public Builder included(Boolean included) {
            this.included = included;
            return this;
        }

        public Builder singleton(Boolean singleton) {
            this.singleton = singleton;
            return this;
        }

        public Builder bound(Boolean bound) {
            this.bound = bound;
            return this;
        }

        public Builder writable(Boolean writable) {
            this.writable = writable;
            return this;
        }

        public Builder defaultValue(String defaultValue) {
            this.defaultValue = defaultValue;
            return this;
        }

        public Builder includedReportable(Boolean includedReportable) {
            this.includedReportable = includedReportable;
            return this;
        }

        public Builder minInterval(Integer minInterval) {
            this.minInterval = minInterval;
            return this;
        }

        public Builder maxInterval(Integer maxInterval) {
            this.maxInterval = maxInterval;
            return this;
        }

        public Builder reportableChange(Integer reportableChange) {
            this.reportableChange = reportableChange;
            return this;
        }

        public Builder define(String define) {
            this.define = define;
            return this;
        }

        public EndpointClusterAttribute build() {
            return new EndpointClusterAttribute(this);
        }
    }
}
