package ai.yarrow.analysis.test;

import ai.yarrow.analysis.Analysis;
import ai.yarrow.analysis.Component;
import ai.yarrow.analysis.ComponentKind;
import ai.yarrow.analysis.Dataset;
import ai.yarrow.analysis.options.MechanismOptions;
import ai.yarrow.analysis.runtime.GrpcRuntimeClient;
import ai.yarrow.model.exceptions.ConfigurationException;
import ai.yarrow.model.exceptions.RuntimeEngineException;
import ai.yarrow.model.privacy.PrivacyUsage;
import ai.yarrow.model.value.Values;
import ai.yarrow.util.grpc.GrpcUtils;
import ai.yarrow.v1.YA;
import ai.yarrow.v1.YV;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.netty.NettyServerBuilder;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class GrpcRuntimeClientTest {
    private RuntimeServiceMock runtime;
    private Server server;
    private ManagedChannel channel;
    private GrpcRuntimeClient client;

    @Before
    public void setUp() throws IOException {
        runtime = new RuntimeServiceMock();
        server = NettyServerBuilder.forPort(0)
            .addService(runtime)
            .build()
            .start();
        channel = GrpcUtils.newGrpcChannel("localhost:" + server.getPort());
        client = new GrpcRuntimeClient(channel, Duration.ofSeconds(10));
    }

    @After
    public void tearDown() throws InterruptedException {
        channel.shutdownNow();
        server.shutdownNow();
        server.awaitTermination();
    }

    @Test
    public void validate() {
        var analysis = new Analysis(client);
        Assert.assertFalse(analysis.validate());

        try (var scope = analysis.enter()) {
            Dataset.fromPath("data.csv").index("age");
        }
        Assert.assertTrue(analysis.validate());
        Assert.assertEquals(3, runtime.lastRequest.getAnalysis().getComputationGraph().getValueCount());
        Assert.assertEquals(1, runtime.lastRequest.getRelease().getValuesCount());
    }

    @Test
    public void privacyUsage() {
        var analysis = new Analysis(client);

        Assert.assertEquals(Optional.of(new PrivacyUsage.Approximate(1.0, 1e-6)), analysis.privacyUsage());

        runtime.privacyUsage = YV.PrivacyUsage.getDefaultInstance();
        Assert.assertEquals(Optional.empty(), analysis.privacyUsage());
    }

    @Test
    public void releaseReplacesValues() {
        var analysis = new Analysis(client);
        Component constant;
        Component mean;
        try (var scope = analysis.enter()) {
            var age = Dataset.fromPath("data.csv").index("age");
            constant = age.arguments().get("columns");
            mean = new Component(ComponentKind.DP_MEAN, Map.of("data", age), new MechanismOptions("Laplace",
                List.of(new PrivacyUsage.Pure(0.5))));
        }
        Assert.assertTrue(constant.value().isPresent());

        var usage = new PrivacyUsage.Pure(0.49);
        runtime.release = YA.Release.newBuilder()
            .putValues(mean.id(), YA.ReleaseNode.newBuilder()
                .setValue(ai.yarrow.model.grpc.ProtoConverter.toProto(Values.encode(41.5)))
                .addPrivacyUsage(ai.yarrow.model.grpc.ProtoConverter.toProto(usage))
                .build())
            .build();

        analysis.release();

        Assert.assertEquals(Optional.of(41.5), mean.javaValue());
        Assert.assertEquals(List.of(usage), mean.actualPrivacyUsage());
        Assert.assertTrue(constant.value().isEmpty());
        Assert.assertEquals(1, analysis.releaseValues().size());
    }

    @Test
    public void report() {
        var analysis = new Analysis(client);
        runtime.report = "[{\"mechanism\": \"Laplace\", \"releaseInfo\": 41.5}]";

        var report = analysis.report();
        Assert.assertEquals("Laplace", report.get(0).get("mechanism").asText());

        runtime.report = "not a report";
        Assert.assertThrows(RuntimeEngineException.class, analysis::report);
    }

    @Test
    public void engineFailure() {
        var analysis = new Analysis(client);
        runtime.failure = Status.INVALID_ARGUMENT.withDescription("unknown component");

        var error = Assert.assertThrows(RuntimeEngineException.class, analysis::release);
        Assert.assertEquals(Status.Code.INVALID_ARGUMENT, error.status().getCode());
        Assert.assertEquals("unknown component", error.status().getDescription());
    }

    @Test
    public void noRuntime() {
        var analysis = new Analysis();

        Assert.assertThrows(ConfigurationException.class, analysis::validate);
        Assert.assertThrows(ConfigurationException.class, analysis::release);
    }
}
