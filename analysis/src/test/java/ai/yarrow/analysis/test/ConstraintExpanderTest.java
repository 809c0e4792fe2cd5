package ai.yarrow.analysis.test;

import ai.yarrow.analysis.Analysis;
import ai.yarrow.analysis.AnalysisScope;
import ai.yarrow.analysis.Component;
import ai.yarrow.analysis.ComponentKind;
import ai.yarrow.analysis.ConstraintExpander;
import ai.yarrow.analysis.Dataset;
import ai.yarrow.model.exceptions.UnsupportedDtypeException;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ConstraintExpanderTest {
    private Analysis analysis;
    private AnalysisScope scope;
    private Dataset dataset;
    private Component data;

    @Before
    public void setUp() {
        analysis = new Analysis();
        scope = analysis.enter();
        dataset = Dataset.fromPath("data.csv");
        data = dataset.component();
    }

    @After
    public void tearDown() {
        scope.close();
    }

    @Test
    public void minAndMaxClampThenImpute() {
        var mean = new Component(ComponentKind.MEAN, Map.of("data", data), null,
            Map.of("data_min", 0, "data_max", 100));

        var impute = mean.arguments().get("data");
        Assert.assertEquals(ComponentKind.IMPUTE, impute.kind());
        var clamp = impute.arguments().get("data");
        Assert.assertEquals(ComponentKind.CLAMP, clamp.kind());
        Assert.assertSame(data, clamp.arguments().get("data"));
        Assert.assertEquals(Optional.of(0L), clamp.arguments().get("min").javaValue());
        Assert.assertEquals(Optional.of(100L), clamp.arguments().get("max").javaValue());

        // min constant, max constant, clamp, impute, mean
        Assert.assertEquals(1, clamp.arguments().get("min").id());
        Assert.assertEquals(2, clamp.arguments().get("max").id());
        Assert.assertEquals(3, clamp.id());
        Assert.assertEquals(4, impute.id());
        Assert.assertEquals(5, mean.id());
    }

    @Test
    public void maxOnlyBoundsRows() {
        var mean = new Component(ComponentKind.MEAN, Map.of("data", data), null, Map.of("data_max", 10));

        var rowMax = mean.arguments().get("data");
        Assert.assertEquals(ComponentKind.ROW_MAX, rowMax.kind());
        Assert.assertSame(data, rowMax.arguments().get("left"));
        Assert.assertEquals(Optional.of(10L), rowMax.arguments().get("right").javaValue());
        Assert.assertEquals(4, analysis.componentCount());
    }

    @Test
    public void minOnlyBoundsRows() {
        var mean = new Component(ComponentKind.MEAN, Map.of("data", data), null, Map.of("data_min", -1.5));

        var rowMin = mean.arguments().get("data");
        Assert.assertEquals(ComponentKind.ROW_MIN, rowMin.kind());
        Assert.assertSame(data, rowMin.arguments().get("left"));
        Assert.assertEquals(Optional.of(-1.5), rowMin.arguments().get("right").javaValue());
    }

    @Test
    public void sizeOnlyAddsResize() {
        var before = analysis.componentCount();

        var sum = new Component(ComponentKind.SUM, Map.of("data", data), null, Map.of("data_n", 5));

        var resize = sum.arguments().get("data");
        Assert.assertEquals(ComponentKind.RESIZE, resize.kind());
        Assert.assertSame(data, resize.arguments().get("data"));
        var n = resize.arguments().get("n");
        Assert.assertEquals(ComponentKind.CONSTANT, n.kind());
        Assert.assertEquals(Optional.of(5L), n.javaValue());
        Assert.assertEquals(2, resize.arguments().size());
        // constant, resize, sum
        Assert.assertEquals(before + 3, analysis.componentCount());
    }

    @Test
    public void wrappersApplyInOrder() {
        var count = new Component(ComponentKind.COUNT, Map.of("data", data), null, Map.of(
            "data_n", 1000,
            "data_categories", List.of("a", "b"),
            "data_max", 1,
            "data_min", 0));

        var kinds = new ArrayList<ComponentKind>();
        var current = count.arguments().get("data");
        while (current != data) {
            kinds.add(current.kind());
            current = current.arguments().get("data");
        }
        Assert.assertEquals(List.of(ComponentKind.RESIZE, ComponentKind.CLAMP, ComponentKind.IMPUTE,
            ComponentKind.CLAMP), kinds);

        var resize = count.arguments().get("data");
        Assert.assertEquals(Optional.of(1000L), resize.arguments().get("n").javaValue());
        var categories = resize.arguments().get("data");
        Assert.assertEquals(Optional.of(List.of("a", "b")), categories.arguments().get("categories").javaValue());
    }

    @Test
    public void componentConstraintIsNotWrapped() {
        var n = dataset.index("age").add(0);
        var before = analysis.componentCount();

        var sum = new Component(ComponentKind.SUM, Map.of("data", data), null, Map.of("data_n", n));

        var resize = sum.arguments().get("data");
        Assert.assertSame(n, resize.arguments().get("n"));
        Assert.assertEquals(before + 2, analysis.componentCount());
    }

    @Test
    public void unrelatedConstraintsAreIgnored() {
        var before = analysis.componentCount();

        var sum = new Component(ComponentKind.SUM, Map.of("data", data), null,
            Map.of("weights_n", 10, "data_median", 3));

        Assert.assertSame(data, sum.arguments().get("data"));
        Assert.assertEquals(before + 1, analysis.componentCount());
    }

    @Test
    public void encodingFailureLeavesAnalysisUnchanged() {
        var before = analysis.componentCount();

        Assert.assertThrows(UnsupportedDtypeException.class,
            () -> new Component(ComponentKind.MEAN, Map.of("data", data), null,
                Map.of("data_min", 0, "data_max", new Object())));
        Assert.assertEquals(before, analysis.componentCount());
    }

    @Test
    public void expandWithoutConstraints() {
        var arguments = Map.of("data", data);

        Assert.assertEquals(arguments, ConstraintExpander.expand(arguments, Map.of()));
    }
}
