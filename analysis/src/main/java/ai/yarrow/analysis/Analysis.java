package ai.yarrow.analysis;

import ai.yarrow.analysis.graph.DirectedGraph;
import ai.yarrow.analysis.grpc.ProtoConverter;
import ai.yarrow.analysis.runtime.RuntimeClient;
import ai.yarrow.model.exceptions.AlreadyOwnedException;
import ai.yarrow.model.exceptions.ConfigurationException;
import ai.yarrow.model.exceptions.RuntimeEngineException;
import ai.yarrow.model.privacy.PrivacyUsage;
import ai.yarrow.model.value.Value;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Graph of components together with the values released for them.
 *
 * <p>Components are created while the analysis is entered:
 * <pre>{@code
 * var analysis = new Analysis(client);
 * try (var scope = analysis.enter()) {
 *     var data = Dataset.fromPath("data.csv");
 *     var age = data.index("age");
 *     ...
 * }
 * analysis.release();
 * }</pre>
 * Ids are assigned in creation order starting at 0.
 */
public class Analysis {
    private static final Logger LOG = LogManager.getLogger(Analysis.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final PrivacyDefinition privacyDefinition;
    @Nullable
    private final RuntimeClient runtime;

    private final Map<Integer, Component> components = new TreeMap<>();
    private final List<Dataset> datasets = new ArrayList<>();
    private Map<Integer, ReleasedValue> releaseValues = new HashMap<>();
    private int componentCount = 0;

    private boolean entered = false;
    @Nullable
    private Analysis previous;

    public Analysis() {
        this(null, PrivacyDefinition.DEFAULT);
    }

    public Analysis(@Nullable RuntimeClient runtime) {
        this(runtime, PrivacyDefinition.DEFAULT);
    }

    public Analysis(@Nullable RuntimeClient runtime, PrivacyDefinition privacyDefinition) {
        this.runtime = runtime;
        this.privacyDefinition = privacyDefinition;
    }

    /**
     * Makes this analysis the active one on the current thread until the returned scope is closed.
     */
    public synchronized AnalysisScope enter() {
        if (entered) {
            throw new IllegalStateException("analysis is already entered");
        }
        previous = AnalysisContext.swap(this);
        entered = true;
        return new AnalysisScope(this);
    }

    /**
     * Scopes close innermost first; closing this one while a nested analysis is still active fails and
     * leaves the active analysis unchanged.
     */
    synchronized void exit() {
        var current = AnalysisContext.current().orElse(null);
        if (current != this) {
            throw new IllegalStateException("analysis is not active on this thread, close nested scopes first");
        }
        AnalysisContext.swap(previous);
        previous = null;
        entered = false;
    }

    public void addComponent(Component component) {
        register(component, null);
    }

    synchronized void register(Component component, @Nullable Value literal) {
        if (component.isOwned()) {
            throw new AlreadyOwnedException(component.id());
        }
        int id = componentCount;
        component.bind(this, id);
        if (literal != null) {
            releaseValues.put(id, ReleasedValue.literal(literal));
        }
        components.put(id, component);
        componentCount++;
        LOG.debug("Registered {}", component);
    }

    synchronized void addDataset(Dataset dataset) {
        datasets.add(dataset);
    }

    public PrivacyDefinition privacyDefinition() {
        return privacyDefinition;
    }

    public synchronized Map<Integer, Component> components() {
        return Collections.unmodifiableMap(new TreeMap<>(components));
    }

    public synchronized Optional<Component> component(int id) {
        return Optional.ofNullable(components.get(id));
    }

    public synchronized Map<Integer, ReleasedValue> releaseValues() {
        return Collections.unmodifiableMap(new TreeMap<>(releaseValues));
    }

    public synchronized Optional<ReleasedValue> releasedValue(int id) {
        return Optional.ofNullable(releaseValues.get(id));
    }

    public synchronized List<Dataset> datasets() {
        return List.copyOf(datasets);
    }

    public synchronized int componentCount() {
        return componentCount;
    }

    public boolean validate() {
        var response = runtime().validate(ProtoConverter.toProto(this), ProtoConverter.releaseToProto(this));
        if (!response.getValue()) {
            LOG.info("Analysis rejected by runtime: {}", response.getMessage());
        }
        return response.getValue();
    }

    /** Total privacy usage of the analysis as computed by the runtime, empty if the runtime reports none. */
    public Optional<PrivacyUsage> privacyUsage() {
        var usage = runtime().computePrivacyUsage(ProtoConverter.toProto(this), ProtoConverter.releaseToProto(this));
        return ai.yarrow.model.grpc.ProtoConverter.fromProto(usage);
    }

    /**
     * Asks the runtime to evaluate the graph. The returned release replaces all known values.
     */
    public void release() {
        var release = runtime().computeRelease(ProtoConverter.toProto(this), ProtoConverter.releaseToProto(this));
        var values = ProtoConverter.fromProto(release);
        synchronized (this) {
            releaseValues = new HashMap<>(values);
        }
        LOG.info("Released {} values", values.size());
    }

    public JsonNode report() {
        var report = runtime().generateReport(ProtoConverter.toProto(this), ProtoConverter.releaseToProto(this));
        try {
            return OBJECT_MAPPER.readTree(report);
        } catch (JsonProcessingException e) {
            throw new RuntimeEngineException("runtime report is not valid JSON", e);
        }
    }

    /**
     * Dependency graph of the components, labelled {@code "<id> <operation>"}.
     */
    public DirectedGraph graph() {
        var graph = new DirectedGraph();
        components().forEach((id, component) -> {
            var vertex = vertex(component);
            graph.addVertex(vertex);
            component.arguments().forEach((name, argument) ->
                graph.addEdge(new DirectedGraph.Edge(vertex(argument), vertex, name)));
        });
        return graph;
    }

    private static DirectedGraph.Vertex vertex(Component component) {
        return new DirectedGraph.Vertex(component.id(), component.id() + " " + component.kind().operationName());
    }

    private RuntimeClient runtime() {
        if (runtime == null) {
            throw new ConfigurationException("analysis has no runtime client");
        }
        return runtime;
    }
}
