package ai.yarrow.analysis.runtime;

import ai.yarrow.model.exceptions.RuntimeEngineException;
import ai.yarrow.util.grpc.GrpcUtils;
import ai.yarrow.v1.RuntimeServiceGrpc;
import ai.yarrow.v1.YA;
import ai.yarrow.v1.YR;
import ai.yarrow.v1.YV;
import io.grpc.Channel;
import io.grpc.StatusRuntimeException;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.function.Supplier;

public class GrpcRuntimeClient implements RuntimeClient {
    private static final Logger LOG = LogManager.getLogger(GrpcRuntimeClient.class);

    public static final String CLIENT_NAME = "YarrowRuntimeClient";

    private final RuntimeServiceGrpc.RuntimeServiceBlockingStub stub;

    public GrpcRuntimeClient(Channel channel, @Nullable Duration timeout) {
        this.stub = GrpcUtils.withTimeout(
            GrpcUtils.newBlockingClient(RuntimeServiceGrpc.newBlockingStub(channel), CLIENT_NAME), timeout);
    }

    @Override
    public YR.ValidateAnalysisResponse validate(YA.Analysis analysis, YA.Release release) {
        return call("ValidateAnalysis", () -> stub.validateAnalysis(request(analysis, release)));
    }

    @Override
    public YV.PrivacyUsage computePrivacyUsage(YA.Analysis analysis, YA.Release release) {
        return call("ComputePrivacyUsage", () -> stub.computePrivacyUsage(request(analysis, release)))
            .getPrivacyUsage();
    }

    @Override
    public YA.Release computeRelease(YA.Analysis analysis, YA.Release release) {
        return call("ComputeRelease", () -> stub.computeRelease(request(analysis, release))).getRelease();
    }

    @Override
    public String generateReport(YA.Analysis analysis, YA.Release release) {
        return call("GenerateReport", () -> stub.generateReport(request(analysis, release))).getReport();
    }

    private static YR.AnalysisRequest request(YA.Analysis analysis, YA.Release release) {
        return YR.AnalysisRequest.newBuilder()
            .setAnalysis(analysis)
            .setRelease(release)
            .build();
    }

    private static <T> T call(String method, Supplier<T> fn) {
        LOG.info("Call runtime {}", method);
        try {
            return fn.get();
        } catch (StatusRuntimeException e) {
            LOG.error("Runtime call {} failed: {}", method, e.getStatus());
            throw new RuntimeEngineException(method, e);
        }
    }
}
