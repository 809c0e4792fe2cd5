package ai.yarrow.util.grpc;

import com.google.protobuf.MessageOrBuilder;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.ForwardingClientCallListener;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class GrpcLogsInterceptor {
    private static final Logger CLIENT_LOG = LogManager.getLogger("GrpcClient");

    private GrpcLogsInterceptor() {
    }

    public static ClientInterceptor client(String name) {
        return new ClientInterceptor() {
            @Override
            public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(MethodDescriptor<ReqT, RespT> method,
                                                                       CallOptions callOptions, Channel next)
            {
                var methodName = method.getFullMethodName();
                return new ForwardingClientCall.SimpleForwardingClientCall<>(next.newCall(method, callOptions)) {
                    @Override
                    public void start(Listener<RespT> responseListener, Metadata headers) {
                        super.start(new ForwardingClientCallListener.SimpleForwardingClientCallListener<>(
                            responseListener)
                        {
                            @Override
                            public void onClose(Status status, Metadata trailers) {
                                if (!status.isOk()) {
                                    CLIENT_LOG.debug("{} call {} finished with {}: {}", name, methodName,
                                        status.getCode(), status.getDescription());
                                }
                                super.onClose(status, trailers);
                            }
                        }, headers);
                    }

                    @Override
                    public void sendMessage(ReqT message) {
                        if (CLIENT_LOG.isTraceEnabled()) {
                            CLIENT_LOG.trace("{} call {}, request ({})", name, methodName, printMessage(message));
                        } else {
                            CLIENT_LOG.debug("{} call {}, request <...>", name, methodName);
                        }
                        super.sendMessage(message);
                    }
                };
            }
        };
    }

    private static String printMessage(Object message) {
        return message instanceof MessageOrBuilder msg
            ? JsonUtils.printSingleLine(msg)
            : message.getClass().getName();
    }
}
