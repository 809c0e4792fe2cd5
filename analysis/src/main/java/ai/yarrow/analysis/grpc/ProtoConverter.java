package ai.yarrow.analysis.grpc;

import ai.yarrow.analysis.Analysis;
import ai.yarrow.analysis.Component;
import ai.yarrow.analysis.PrivacyDefinition;
import ai.yarrow.analysis.ReleasedValue;
import ai.yarrow.analysis.options.MaterializeOptions;
import ai.yarrow.analysis.options.MechanismOptions;
import ai.yarrow.v1.YA;
import ai.yarrow.v1.YC;

import java.util.HashMap;
import java.util.Map;

public final class ProtoConverter {

    private ProtoConverter() {
    }

    public static YA.Analysis toProto(Analysis analysis) {
        var graph = YA.ComputationGraph.newBuilder();
        analysis.components().forEach((id, component) -> graph.putValue(id, toProto(component)));
        return YA.Analysis.newBuilder()
            .setComputationGraph(graph)
            .setPrivacyDefinition(toProto(analysis.privacyDefinition()))
            .build();
    }

    public static YA.PrivacyDefinition toProto(PrivacyDefinition definition) {
        return YA.PrivacyDefinition.newBuilder()
            .setDistance(YA.PrivacyDefinition.Distance.valueOf(definition.distance().name()))
            .setNeighboring(YA.PrivacyDefinition.Neighboring.valueOf(definition.neighboring().name()))
            .build();
    }

    public static YC.Component toProto(Component component) {
        var builder = YC.Component.newBuilder();
        component.arguments().forEach((name, argument) -> builder.putArguments(name, argument.id()));

        var options = component.options();
        YC.Component.Builder variant = switch (component.kind()) {
            case MATERIALIZE -> builder.setMaterialize(toProto((MaterializeOptions) options));
            case INDEX -> builder.setIndex(YC.Index.getDefaultInstance());
            case CONSTANT -> builder.setConstant(YC.Constant.getDefaultInstance());
            case CLAMP -> builder.setClamp(YC.Clamp.getDefaultInstance());
            case IMPUTE -> builder.setImpute(YC.Impute.getDefaultInstance());
            case RESIZE -> builder.setResize(YC.Resize.getDefaultInstance());
            case ROW_MIN -> builder.setRowmin(YC.RowMin.getDefaultInstance());
            case ROW_MAX -> builder.setRowmax(YC.RowMax.getDefaultInstance());
            case NEGATIVE -> builder.setNegative(YC.Negative.getDefaultInstance());
            case ADD -> builder.setAdd(YC.Add.getDefaultInstance());
            case SUBTRACT -> builder.setSubtract(YC.Subtract.getDefaultInstance());
            case MULTIPLY -> builder.setMultiply(YC.Multiply.getDefaultInstance());
            case DIVIDE -> builder.setDivide(YC.Divide.getDefaultInstance());
            case POWER -> builder.setPower(YC.Power.getDefaultInstance());
            case OR -> builder.setOr(YC.Or.getDefaultInstance());
            case AND -> builder.setAnd(YC.And.getDefaultInstance());
            case GREATER_THAN -> builder.setGreaterthan(YC.GreaterThan.getDefaultInstance());
            case LESS_THAN -> builder.setLessthan(YC.LessThan.getDefaultInstance());
            case EQUAL -> builder.setEqual(YC.Equal.getDefaultInstance());
            case COUNT -> builder.setCount(YC.Count.getDefaultInstance());
            case SUM -> builder.setSum(YC.Sum.getDefaultInstance());
            case MEAN -> builder.setMean(YC.Mean.getDefaultInstance());
            case VARIANCE -> builder.setVariance(YC.Variance.getDefaultInstance());
            case DP_COUNT -> {
                var mechanism = (MechanismOptions) options;
                yield builder.setDpcount(YC.DPCount.newBuilder()
                    .setMechanism(mechanism.mechanism())
                    .addAllPrivacyUsage(ai.yarrow.model.grpc.ProtoConverter.toProto(mechanism.privacyUsage())));
            }
            case DP_SUM -> {
                var mechanism = (MechanismOptions) options;
                yield builder.setDpsum(YC.DPSum.newBuilder()
                    .setMechanism(mechanism.mechanism())
                    .addAllPrivacyUsage(ai.yarrow.model.grpc.ProtoConverter.toProto(mechanism.privacyUsage())));
            }
            case DP_MEAN -> {
                var mechanism = (MechanismOptions) options;
                yield builder.setDpmean(YC.DPMean.newBuilder()
                    .setMechanism(mechanism.mechanism())
                    .addAllPrivacyUsage(ai.yarrow.model.grpc.ProtoConverter.toProto(mechanism.privacyUsage())));
            }
            case DP_VARIANCE -> {
                var mechanism = (MechanismOptions) options;
                yield builder.setDpvariance(YC.DPVariance.newBuilder()
                    .setMechanism(mechanism.mechanism())
                    .addAllPrivacyUsage(ai.yarrow.model.grpc.ProtoConverter.toProto(mechanism.privacyUsage())));
            }
        };
        return variant.build();
    }

    public static YC.Materialize toProto(MaterializeOptions options) {
        var builder = YC.Materialize.newBuilder().setPrivate(options.isPrivate());
        if (options.filePath() != null) {
            builder.setFilePath(options.filePath());
        }
        if (options.literal() != null) {
            builder.setLiteral(ai.yarrow.model.grpc.ProtoConverter.toProto(options.literal()));
        }
        return builder.build();
    }

    /**
     * Values released so far, including component literals.
     */
    public static YA.Release releaseToProto(Analysis analysis) {
        var builder = YA.Release.newBuilder();
        analysis.releaseValues().forEach((id, released) -> {
            var node = YA.ReleaseNode.newBuilder()
                .addAllPrivacyUsage(ai.yarrow.model.grpc.ProtoConverter.toProto(released.privacyUsage()));
            if (released.value() != null) {
                node.setValue(ai.yarrow.model.grpc.ProtoConverter.toProto(released.value()));
            }
            builder.putValues(id, node.build());
        });
        return builder.build();
    }

    public static Map<Integer, ReleasedValue> fromProto(YA.Release release) {
        var result = new HashMap<Integer, ReleasedValue>();
        release.getValuesMap().forEach((id, node) -> {
            var value = node.hasValue()
                ? ai.yarrow.model.grpc.ProtoConverter.fromProto(node.getValue()).orElse(null)
                : null;
            var usage = ai.yarrow.model.grpc.ProtoConverter.fromProto(node.getPrivacyUsageList());
            result.put(id, new ReleasedValue(value, usage));
        });
        return result;
    }
}
