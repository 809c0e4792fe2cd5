package ai.yarrow.analysis.test;

import ai.yarrow.analysis.Analysis;
import ai.yarrow.analysis.Component;
import ai.yarrow.analysis.ComponentKind;
import ai.yarrow.analysis.Dataset;
import ai.yarrow.analysis.PrivacyDefinition;
import ai.yarrow.analysis.ReleasedValue;
import ai.yarrow.analysis.grpc.ProtoConverter;
import ai.yarrow.analysis.options.ComponentOptions;
import ai.yarrow.analysis.options.MaterializeOptions;
import ai.yarrow.analysis.options.MechanismOptions;
import ai.yarrow.model.exceptions.ConfigurationException;
import ai.yarrow.model.privacy.PrivacyUsage;
import ai.yarrow.model.privacy.PrivacyUsages;
import ai.yarrow.model.value.Values;
import ai.yarrow.v1.YA;
import ai.yarrow.v1.YC;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Locale;
import java.util.Map;

public class ProtoConverterTest {

    @Test
    public void computationGraph() {
        var analysis = new Analysis();
        try (var scope = analysis.enter()) {
            var data = Dataset.fromPath("data.csv");
            var age = data.index("age");
            new Component(ComponentKind.DP_MEAN, Map.of("data", age),
                new MechanismOptions("Laplace", PrivacyUsages.of(0.5, null).orElseThrow()));
        }

        var proto = ProtoConverter.toProto(analysis);
        var nodes = proto.getComputationGraph().getValueMap();
        Assert.assertEquals(4, nodes.size());

        var materialize = nodes.get(0);
        Assert.assertEquals(YC.Component.VariantCase.MATERIALIZE, materialize.getVariantCase());
        Assert.assertEquals("data.csv", materialize.getMaterialize().getFilePath());
        Assert.assertTrue(materialize.getMaterialize().getPrivate());
        Assert.assertFalse(materialize.getMaterialize().hasLiteral());
        Assert.assertTrue(materialize.getArgumentsMap().isEmpty());

        var index = nodes.get(2);
        Assert.assertEquals(YC.Component.VariantCase.INDEX, index.getVariantCase());
        Assert.assertEquals(Map.of("columns", 1, "data", 0), index.getArgumentsMap());

        var mean = nodes.get(3);
        Assert.assertEquals("Laplace", mean.getDpmean().getMechanism());
        Assert.assertEquals(0.5, mean.getDpmean().getPrivacyUsage(0).getDistancePure().getEpsilon(), 0.0);
        Assert.assertEquals(Map.of("data", 2), mean.getArgumentsMap());
    }

    @Test
    public void privacyDefinition() {
        var defaults = ProtoConverter.toProto(new Analysis()).getPrivacyDefinition();
        Assert.assertEquals(YA.PrivacyDefinition.Distance.APPROXIMATE, defaults.getDistance());
        Assert.assertEquals(YA.PrivacyDefinition.Neighboring.SUBSTITUTE, defaults.getNeighboring());

        var custom = new Analysis(null, PrivacyDefinition.of("pure", "add_remove"));
        var proto = ProtoConverter.toProto(custom).getPrivacyDefinition();
        Assert.assertEquals(YA.PrivacyDefinition.Distance.PURE, proto.getDistance());
        Assert.assertEquals(YA.PrivacyDefinition.Neighboring.ADD_REMOVE, proto.getNeighboring());

        Assert.assertThrows(ConfigurationException.class, () -> PrivacyDefinition.of("renyi", "substitute"));
    }

    @Test
    public void everyKindHasVariant() {
        var analysis = new Analysis();
        try (var scope = analysis.enter()) {
            for (var kind : ComponentKind.values()) {
                ComponentOptions options = null;
                if (kind.optionsType() == MechanismOptions.class) {
                    options = new MechanismOptions("Gaussian", List.of());
                } else if (kind.optionsType() == MaterializeOptions.class) {
                    options = MaterializeOptions.fromPath("data.csv", false);
                }
                var proto = ProtoConverter.toProto(new Component(kind, Map.of(), options));

                var variant = proto.getVariantCase().name().toLowerCase(Locale.ROOT);
                Assert.assertEquals(kind.variant(), variant);
            }
        }
    }

    @Test
    public void literalsAreReleased() {
        var analysis = new Analysis();
        int id;
        try (var scope = analysis.enter()) {
            id = Component.of(List.of(1.0, 2.0)).multiply(2).id();
        }

        var release = ProtoConverter.releaseToProto(analysis);
        Assert.assertEquals(2, release.getValuesCount());
        Assert.assertFalse(release.containsValues(id));
        var literal = release.getValuesOrThrow(0);
        Assert.assertEquals(List.of(2L), literal.getValue().getArrayNd().getShapeList());
        Assert.assertEquals(0, literal.getPrivacyUsageCount());
    }

    @Test
    public void releaseFromProto() {
        var usage = new PrivacyUsage.Approximate(0.1, 1e-6);
        var release = YA.Release.newBuilder()
            .putValues(3, YA.ReleaseNode.newBuilder()
                .setValue(ai.yarrow.model.grpc.ProtoConverter.toProto(Values.encode(42.0)))
                .addPrivacyUsage(ai.yarrow.model.grpc.ProtoConverter.toProto(usage))
                .build())
            .putValues(5, YA.ReleaseNode.getDefaultInstance())
            .build();

        var values = ProtoConverter.fromProto(release);

        Assert.assertEquals(new ReleasedValue(Values.encode(42.0), List.of(usage)), values.get(3));
        Assert.assertEquals(new ReleasedValue(null, List.of()), values.get(5));
    }
}
