package ai.yarrow.util.grpc;

import io.grpc.ManagedChannel;
import io.grpc.stub.AbstractBlockingStub;
import jakarta.annotation.Nullable;

import java.time.Duration;

public final class GrpcUtils {

    private GrpcUtils() {
    }

    public static <T extends AbstractBlockingStub<T>> T newBlockingClient(T stub, String name) {
        return stub.withInterceptors(GrpcLogsInterceptor.client(name));
    }

    public static <T extends AbstractBlockingStub<T>> T withTimeout(T stub, @Nullable Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return stub;
        }
        return stub.withInterceptors(DeadlineClientInterceptor.fromDuration(timeout));
    }

    public static ManagedChannel newGrpcChannel(String address, boolean tls) {
        return ChannelBuilder.forAddress(address)
            .tls(tls)
            .build();
    }

    public static ManagedChannel newGrpcChannel(String address) {
        return newGrpcChannel(address, false);
    }
}
