package ai.yarrow.util.grpc;

import com.google.common.net.HostAndPort;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;

import java.util.concurrent.TimeUnit;

public class ChannelBuilder {

    public static final int IDLE_TIMEOUT_MINS = 5;
    public static final int KEEP_ALIVE_TIME_MINS = 3;
    public static final int KEEP_ALIVE_TIMEOUT_SECS = 10;
    // releases carry whole datasets
    public static final int MAX_INBOUND_MESSAGE_SIZE = 64 * 1024 * 1024;

    private final String host;
    private final int port;

    private boolean tls;

    private ChannelBuilder(String host, int port) {
        this.host = host;
        this.port = port;

        this.tls = true;
    }

    public static ChannelBuilder forAddress(String hostPort) {
        return forAddress(HostAndPort.fromString(hostPort));
    }

    @SuppressWarnings("UnstableApiUsage")
    public static ChannelBuilder forAddress(HostAndPort hostAndPort) {
        if (!hostAndPort.hasPort()) {
            throw new IllegalArgumentException("Port is not specified in address " + hostAndPort);
        }
        return new ChannelBuilder(hostAndPort.getHost(), hostAndPort.getPort());
    }

    public ChannelBuilder tls(boolean tls) {
        this.tls = tls;
        return this;
    }

    public ManagedChannel build() {
        var builder = ManagedChannelBuilder.forAddress(host, port);
        if (!tls) {
            builder.usePlaintext();
        }
        return builder
            .maxInboundMessageSize(MAX_INBOUND_MESSAGE_SIZE)
            .keepAliveWithoutCalls(true)
            .idleTimeout(IDLE_TIMEOUT_MINS, TimeUnit.MINUTES)
            .keepAliveTime(KEEP_ALIVE_TIME_MINS, TimeUnit.MINUTES)
            .keepAliveTimeout(KEEP_ALIVE_TIMEOUT_SECS, TimeUnit.SECONDS)
            .build();
    }
}
