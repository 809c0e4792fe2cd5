package ai.yarrow.analysis;

import ai.yarrow.analysis.config.RuntimeConfig;
import ai.yarrow.analysis.runtime.GrpcRuntimeClient;
import ai.yarrow.analysis.runtime.RuntimeClient;
import ai.yarrow.util.grpc.GrpcUtils;
import io.grpc.ManagedChannel;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

@Factory
public class BeanFactory {

    @Bean(preDestroy = "shutdown")
    @Singleton
    @Named("YarrowRuntimeGrpcChannel")
    public ManagedChannel runtimeChannel(RuntimeConfig config) {
        return GrpcUtils.newGrpcChannel(config.getAddress(), config.isTls());
    }

    @Singleton
    public RuntimeClient runtimeClient(@Named("YarrowRuntimeGrpcChannel") ManagedChannel channel,
                                       RuntimeConfig config)
    {
        return new GrpcRuntimeClient(channel, config.getTimeout());
    }
}
