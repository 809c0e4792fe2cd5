package ai.yarrow.model.grpc;

import ai.yarrow.model.privacy.PrivacyUsage;
import ai.yarrow.model.value.Array1d;
import ai.yarrow.model.value.ArrayValue;
import ai.yarrow.model.value.ElementType;
import ai.yarrow.model.value.HashmapValue;
import ai.yarrow.model.value.JaggedValue;
import ai.yarrow.model.value.Value;
import ai.yarrow.v1.YV;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

@SuppressWarnings({"OverloadMethodsDeclarationOrder", "unchecked"})
public final class ProtoConverter {

    private ProtoConverter() {
    }

    public static YV.Value toProto(Value value) {
        var builder = YV.Value.newBuilder();
        if (value instanceof ArrayValue array) {
            builder.setArrayNd(YV.ArrayNd.newBuilder()
                .setFlattened(toProto(array.flattened()))
                .addAllOrder(array.order().stream().map(Integer::longValue).toList())
                .addAllShape(array.shape()));
        } else if (value instanceof JaggedValue jagged) {
            var proto = YV.Array2dJagged.newBuilder();
            for (var column : jagged.columns()) {
                var option = YV.Array2dJagged.Array1dOption.newBuilder();
                column.ifPresent(data -> option.setOption(toProto(data)));
                proto.addData(option);
            }
            builder.setArray2DJagged(proto);
        } else {
            var proto = YV.HashmapString.newBuilder();
            ((HashmapValue) value).data().forEach((key, entry) -> proto.putData(key, toProto(entry)));
            builder.setHashmapString(proto);
        }
        return builder.build();
    }

    /**
     * @return decoded value, or empty if the message carries no data
     */
    public static Optional<Value> fromProto(YV.Value value) {
        return switch (value.getDataCase()) {
            case ARRAY_ND -> {
                var array = value.getArrayNd();
                yield fromProto(array.getFlattened()).<Value>map(data -> new ArrayValue(data, array.getShapeList(),
                    array.getOrderList().stream().map(Math::toIntExact).toList()));
            }
            case ARRAY_2D_JAGGED -> {
                var columns = new ArrayList<Optional<Array1d>>();
                for (var column : value.getArray2DJagged().getDataList()) {
                    columns.add(column.hasOption() ? fromProto(column.getOption()) : Optional.empty());
                }
                yield Optional.<Value>of(new JaggedValue(columns));
            }
            case HASHMAP_STRING -> {
                var data = new HashMap<String, Value>();
                value.getHashmapString().getDataMap().forEach((key, entry) ->
                    fromProto(entry).ifPresent(decoded -> data.put(key, decoded)));
                yield Optional.<Value>of(new HashmapValue(data));
            }
            case DATA_NOT_SET -> Optional.empty();
        };
    }

    public static YV.Array1d toProto(Array1d array) {
        var builder = YV.Array1d.newBuilder();
        var data = array.data();
        switch (array.type()) {
            case BOOL -> builder.setBool(YV.Array1dBool.newBuilder().addAllData((List<Boolean>) (List<?>) data));
            case I64 -> builder.setI64(YV.Array1dI64.newBuilder().addAllData((List<Long>) (List<?>) data));
            case F64 -> builder.setF64(YV.Array1dF64.newBuilder().addAllData((List<Double>) (List<?>) data));
            case STRING -> builder.setString(YV.Array1dStr.newBuilder().addAllData((List<String>) (List<?>) data));
        }
        return builder.build();
    }

    public static Optional<Array1d> fromProto(YV.Array1d array) {
        return switch (array.getDataCase()) {
            case BOOL -> Optional.of(new Array1d(ElementType.BOOL, List.copyOf(array.getBool().getDataList())));
            case I64 -> Optional.of(new Array1d(ElementType.I64, List.copyOf(array.getI64().getDataList())));
            case F64 -> Optional.of(new Array1d(ElementType.F64, List.copyOf(array.getF64().getDataList())));
            case STRING -> Optional.of(new Array1d(ElementType.STRING,
                List.copyOf(array.getString().getDataList())));
            case DATA_NOT_SET -> Optional.empty();
        };
    }

    public static YV.PrivacyUsage toProto(PrivacyUsage usage) {
        var builder = YV.PrivacyUsage.newBuilder();
        if (usage instanceof PrivacyUsage.Approximate approximate) {
            builder.setDistanceApproximate(YV.PrivacyUsage.DistanceApproximate.newBuilder()
                .setEpsilon(approximate.epsilon())
                .setDelta(approximate.delta()));
        } else {
            builder.setDistancePure(YV.PrivacyUsage.DistancePure.newBuilder()
                .setEpsilon(usage.epsilon()));
        }
        return builder.build();
    }

    /**
     * @return decoded usage, or empty if no distance is set
     */
    public static Optional<PrivacyUsage> fromProto(YV.PrivacyUsage usage) {
        return switch (usage.getDistanceCase()) {
            case DISTANCE_PURE -> Optional.<PrivacyUsage>of(
                new PrivacyUsage.Pure(usage.getDistancePure().getEpsilon()));
            case DISTANCE_APPROXIMATE -> Optional.<PrivacyUsage>of(new PrivacyUsage.Approximate(
                usage.getDistanceApproximate().getEpsilon(), usage.getDistanceApproximate().getDelta()));
            case DISTANCE_NOT_SET -> Optional.<PrivacyUsage>empty();
        };
    }

    public static List<YV.PrivacyUsage> toProto(List<PrivacyUsage> usages) {
        return usages.stream().map(ProtoConverter::toProto).toList();
    }

    public static List<PrivacyUsage> fromProto(List<YV.PrivacyUsage> usages) {
        return usages.stream()
            .map(ProtoConverter::fromProto)
            .flatMap(Optional::stream)
            .toList();
    }
}
