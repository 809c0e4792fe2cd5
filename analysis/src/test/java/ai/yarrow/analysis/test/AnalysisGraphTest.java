package ai.yarrow.analysis.test;

import ai.yarrow.analysis.Analysis;
import ai.yarrow.analysis.Dataset;
import ai.yarrow.analysis.graph.DirectedGraph;
import org.junit.Assert;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasSize;

public class AnalysisGraphTest {

    @Test
    public void argumentEdges() {
        var analysis = new Analysis();
        try (var scope = analysis.enter()) {
            var data = Dataset.fromPath("data.csv");
            data.index("age").add(1);
        }

        var graph = analysis.graph();
        assertThat(graph.vertexes(), hasSize(5));
        assertThat(graph.edges(), hasSize(4));

        var materialize = new DirectedGraph.Vertex(0, "0 Materialize");
        var index = new DirectedGraph.Vertex(2, "2 Index");
        assertThat(graph.sources(), containsInAnyOrder(
            materialize, new DirectedGraph.Vertex(1, "1 Constant"), new DirectedGraph.Vertex(3, "3 Constant")));
        assertThat(graph.children(0), containsInAnyOrder(new DirectedGraph.Edge(materialize, index, "data")));
        assertThat(graph.parents(4), hasSize(2));
        Assert.assertTrue(graph.children(4).isEmpty());
    }
}
