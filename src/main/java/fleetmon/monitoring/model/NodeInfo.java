package fleetmon.monitoring.model;

import java.util.Objects;

/**
 * Immutable domain model for the latest utilization sample of one node.
 * Memory figures are in KB, network and disk figures in bytes.
 */
public final class NodeInfo {
    private final String nodeName;
    private final String ip;
    private final double cpuUsage;
    private final long cpuCount;
    private final long gpuCount;
    private final long usedMemory;
    private final long totalMemory;
    private final double memUsage;
    private final long rxBytes;
    private final long txBytes;
    private final long readBytes;
    private final long writeBytes;
    private final String os;
    private final String arch;

    private NodeInfo(Builder builder) {
        this.nodeName = Objects.requireNonNull(builder.nodeName, "nodeName is required");
        this.ip = builder.ip;
        this.cpuUsage = builder.cpuUsage;
        this.cpuCount = builder.cpuCount;
        this.gpuCount = builder.gpuCount;
        this.usedMemory = builder.usedMemory;
        this.totalMemory = builder.totalMemory;
        this.memUsage = builder.memUsage;
        this.rxBytes = builder.rxBytes;
        this.txBytes = builder.txBytes;
        this.readBytes = builder.readBytes;
        this.writeBytes = builder.writeBytes;
        this.os = builder.os;
        this.arch = builder.arch;
    }

    // Getters
    public String nodeName() {
        return nodeName;
    }

    public String ip() {
        return ip;
    }

    public double cpuUsage() {
        return cpuUsage;
    }

    public long cpuCount() {
        return cpuCount;
    }

    public long gpuCount() {
        return gpuCount;
    }

    public long usedMemory() {
        return usedMemory;
    }

    public long totalMemory() {
        return totalMemory;
    }

    public double memUsage() {
        return memUsage;
    }

    public long rxBytes() {
        return rxBytes;
    }

    public long txBytes() {
        return txBytes;
    }

    public long readBytes() {
        return readBytes;
    }

    public long writeBytes() {
        return writeBytes;
    }

    public String os() {
        return os;
    }

    public String arch() {
        return arch;
    }

    /** Create a builder from this node (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .nodeName(nodeName)
                .ip(ip)
                .cpuUsage(cpuUsage)
                .cpuCount(cpuCount)
                .gpuCount(gpuCount)
                .usedMemory(usedMemory)
                .totalMemory(totalMemory)
                .memUsage(memUsage)
                .rxBytes(rxBytes)
                .txBytes(txBytes)
                .readBytes(readBytes)
                .writeBytes(writeBytes)
                .os(os)
                .arch(arch);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String nodeName;
        private String ip;
        private double cpuUsage;
        private long cpuCount;
        private long gpuCount;
        private long usedMemory;
        private long totalMemory;
        private double memUsage;
        private long rxBytes;
        private long txBytes;
        private long readBytes;
        private long writeBytes;
        private String os;
        private String arch;

        public Builder nodeName(String nodeName) {
            this.nodeName = nodeName;
            return this;
        }

        public Builder ip(String ip) {
            this.ip = ip;
            return this;
        }

        public Builder cpuUsage(double cpuUsage) {
            this.cpuUsage = cpuUsage;
            return this;
        }

        public Builder cpuCount(long cpuCount) {
            this.cpuCount = cpuCount;
            return this;
        }

        public Builder gpuCount(long gpuCount) {
            this.gpuCount = gpuCount;
            return this;
        }

        public Builder usedMemory(long usedMemory) {
            this.usedMemory = usedMemory;
            return this;
        }

        public Builder totalMemory(long totalMemory) {
            this.totalMemory = totalMemory;
            return this;
        }

        public Builder memUsage(double memUsage) {
            this.memUsage = memUsage;
            return this;
        }

        public Builder rxBytes(long rxBytes) {
            this.rxBytes = rxBytes;
            return this;
        }

        public Builder txBytes(long txBytes) {
            this.txBytes = txBytes;
            return this;
        }

        public Builder readBytes(long readBytes) {
            this.readBytes = readBytes;
            return this;
        }

        public Builder writeBytes(long writeBytes) {
            this.writeBytes = writeBytes;
            return this;
        }

        public Builder os(String os) {
            this.os = os;
            return this;
        }

        public Builder arch(String arch) {
            this.arch = arch;
            return this;
        }

        public NodeInfo build() {
            return new NodeInfo(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NodeInfo that))
            return false;
        return Double.compare(cpuUsage, that.cpuUsage) == 0
                && cpuCount == that.cpuCount
                && gpuCount == that.gpuCount
                && usedMemory == that.usedMemory
                && totalMemory == that.totalMemory
                && Double.compare(memUsage, that.memUsage) == 0
                && rxBytes == that.rxBytes
                && txBytes == that.txBytes
                && readBytes == that.readBytes
                && writeBytes == that.writeBytes
                && nodeName.equals(that.nodeName)
                && Objects.equals(ip, that.ip)
                && Objects.equals(os, that.os)
                && Objects.equals(arch, that.arch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeName, ip, cpuUsage, cpuCount, gpuCount, usedMemory, totalMemory,
                memUsage, rxBytes, txBytes, readBytes, writeBytes, os, arch);
    }

    @Override
    public String toString() {
        return "NodeInfo{name='" + nodeName + "', ip=" + ip + ", cpu=" + cpuUsage + "%, mem=" + memUsage + "%}";
    }
}
