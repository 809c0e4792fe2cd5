package ai.yarrow.util.grpc;

import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.MethodDescriptor;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Sets a deadline on every outgoing call, counted from the moment the call starts.
 */
public class DeadlineClientInterceptor implements ClientInterceptor {
    private final long timeoutMillis;

    private DeadlineClientInterceptor(long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(MethodDescriptor<ReqT, RespT> method,
                                                               CallOptions callOptions, Channel next)
    {
        return next.newCall(method, callOptions.withDeadlineAfter(timeoutMillis, TimeUnit.MILLISECONDS));
    }

    public static DeadlineClientInterceptor fromDuration(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Deadline must be positive, got " + timeout);
        }
        return new DeadlineClientInterceptor(timeout.toMillis());
    }
}
