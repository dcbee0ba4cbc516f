package com.e2eq.argumentation.reasoner;

import com.e2eq.argumentation.aba.AbaFramework;
import com.e2eq.argumentation.aba.AbaSolution;
import com.e2eq.argumentation.aba.DisputeResult;
import com.e2eq.argumentation.aba.DisputeTreeBuilder;
import com.e2eq.argumentation.config.ReasoningOptions;
import com.e2eq.argumentation.core.*;
import com.e2eq.argumentation.credibility.CredibilityPropagator;
import com.e2eq.argumentation.credibility.CredibilityResult;
import com.e2eq.argumentation.credibility.WarrantFragility;
import com.e2eq.argumentation.critique.PatternDetector;
import com.e2eq.argumentation.critique.PatternMatch;
import com.e2eq.argumentation.dung.*;
import com.e2eq.argumentation.exceptions.ConfigurationException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Entry point to the reasoning engines. Each task family has a typed method; {@link #run}
 * dispatches a list of {@link ReasoningTask}s to them and collects the results. Holds no state
 * beyond its collaborators and default options.
 */
@ApplicationScoped
public class Reasoner {
    private static final Logger LOG = Logger.getLogger(Reasoner.class);

    private final BundleProjector bundleProjector;
    private final CredibilityPropagator propagator;
    private final ReasoningOptions defaults;

    @Inject
    public Reasoner(BundleProjector bundleProjector, CredibilityPropagator propagator, ReasoningOptions defaults) {
        this.bundleProjector = bundleProjector;
        this.propagator = propagator;
        this.defaults = defaults.validate();
    }

    public Reasoner() {
        this(new BundleProjector(), new CredibilityPropagator(), ReasoningOptions.defaults());
    }

    public ReasoningOptions defaults() {
        return defaults;
    }

    // ---- Dung -------------------------------------------------------------------------------

    public DungOutcome dung(ArgumentGraph graph) {
        return dung(graph, defaults);
    }

    public DungOutcome dung(ArgumentGraph graph, ReasoningOptions options) {
        options.validate();
        return evaluate(new DungSemantics(ArgumentationFramework.fromGraph(graph), options.parallelism()),
                options.semantics());
    }

    public DungOutcome dung(ArgumentGraph graph, Semantics semantics) {
        return dung(graph, defaults.toBuilder().semantics(semantics).build());
    }

    public BundleOutcome bundles(ArgumentGraph graph) {
        return bundles(graph, defaults);
    }

    public BundleOutcome bundles(ArgumentGraph graph, ReasoningOptions options) {
        options.validate();
        BundleProjection projection = bundleProjector.project(graph, options.bundleAggregation());
        DungSemantics semantics = new DungSemantics(ArgumentationFramework.fromBundles(projection), options.parallelism());
        return new BundleOutcome(projection, evaluate(semantics, options.semantics()));
    }

    private static DungOutcome evaluate(DungSemantics semantics, Semantics which) {
        List<Extension> extensions = semantics.extensions(which);
        List<Labeling> labelings = extensions.stream().map(semantics::labelingFromExtension).toList();
        return new DungOutcome(which, extensions, labelings);
    }

    // ---- credibility --------------------------------------------------------------------------

    public CredibilityResult credibility(ArgumentGraph graph) {
        return propagator.propagate(graph, defaults);
    }

    public CredibilityResult credibility(ArgumentGraph graph, ReasoningOptions options) {
        return propagator.propagate(graph, options);
    }

    public List<WarrantFragility.RelationFragility> fragility(ArgumentGraph graph) {
        return fragility(graph, defaults);
    }

    public List<WarrantFragility.RelationFragility> fragility(ArgumentGraph graph, ReasoningOptions options) {
        return WarrantFragility.analyze(graph, propagator.propagate(graph, options), options.gateThreshold());
    }

    public GraphDiagnostics.Report diagnostics(ArgumentGraph graph) {
        GraphValidator.validate(graph);
        return GraphDiagnostics.analyze(graph);
    }

    public List<PatternMatch> patterns(ArgumentGraph graph) {
        return PatternDetector.detect(graph);
    }

    /**
     * Disables the relations named by the gate actions of {@code matches}; see
     * {@link PatternDetector#applyGateActions}.
     */
    public ArgumentGraph applyGateActions(ArgumentGraph graph, Collection<PatternMatch> matches) {
        return PatternDetector.applyGateActions(graph, matches);
    }

    // ---- ABA --------------------------------------------------------------------------------

    /**
     * An empty framework using the circular-rule and derivation depth settings of the defaults.
     */
    public AbaFramework newAbaFramework() {
        return new AbaFramework(defaults.allowCircularRules(), defaults.derivationMaxDepth());
    }

    public AbaSolution solveAba(AbaFramework framework) {
        return solveAba(framework, defaults);
    }

    public AbaSolution solveAba(AbaFramework framework, ReasoningOptions options) {
        options.validate();
        return framework.solve(options.semantics(), options.parallelism());
    }

    public DisputeResult disputeTrees(AbaFramework framework, String goal) {
        return disputeTrees(framework, goal, defaults);
    }

    public DisputeResult disputeTrees(AbaFramework framework, String goal, ReasoningOptions options) {
        options.validate();
        return new DisputeTreeBuilder(framework, options.disputeMaxDepth()).build(goal, options.semantics());
    }

    // ---- dispatcher -------------------------------------------------------------------------

    public ReasoningReport run(ArgumentGraph graph, Collection<ReasoningTask> tasks, boolean explain) {
        return run(graph, tasks, defaults, explain);
    }

    /**
     * Runs {@code tasks} in order over one graph. Options and graph are validated before any
     * task starts.
     */
    public ReasoningReport run(ArgumentGraph graph, Collection<ReasoningTask> tasks, ReasoningOptions options,
                               boolean explain) {
        options.validate();
        requireFamily(tasks, false);
        GraphValidator.validate(graph);

        DungSemantics semantics = new DungSemantics(ArgumentationFramework.fromGraph(graph), options.parallelism());
        Map<ReasoningTask, Object> results = new LinkedHashMap<>();
        CredibilityResult credibility = null;
        for (ReasoningTask task : new LinkedHashSet<>(tasks)) {
            long started = System.currentTimeMillis();
            Object result = switch (task) {
                case GROUNDED_EXTENSION -> semantics.groundedExtension();
                case COMPLETE_EXTENSIONS -> semantics.completeExtensions();
                case PREFERRED_EXTENSIONS -> semantics.preferredExtensions();
                case STABLE_EXTENSIONS -> semantics.stableExtensions();
                case GROUNDED_LABELING -> semantics.labelingFromExtension(semantics.groundedExtension());
                case BUNDLE_EXTENSIONS -> bundles(graph, options);
                case CREDIBILITY -> credibility = credibility(graph, options);
                case WARRANT_FRAGILITY -> fragility(graph, options);
                case DIAGNOSTICS -> GraphDiagnostics.analyze(graph);
                case PATTERNS -> PatternDetector.detect(graph);
                case ABA_EXTENSIONS, DISPUTE_TREES -> throw new IllegalStateException("ABA task " + task.key());
            };
            results.put(task, result);
            LOG.debugf("Task %s finished in %d ms", task.key(), System.currentTimeMillis() - started);
        }

        Optional<Explanations> explanations = Optional.empty();
        if (explain) {
            List<Labeling> labelings = semantics.labelings(options.semantics());
            SortedMap<String, LabelExplanation> labels = labelings.isEmpty()
                    ? new TreeMap<>()
                    : explainLabels(semantics.framework(), labelings.get(0));
            explanations = Optional.of(new Explanations(options.semantics(), labels,
                    credibility == null ? new TreeMap<>() : credibility.breakdowns()));
        }
        return new ReasoningReport(GraphFingerprint.compute(graph), results, explanations);
    }

    public ReasoningReport run(AbaFramework framework, List<String> goals, Collection<ReasoningTask> tasks) {
        return run(framework, goals, tasks, defaults);
    }

    /**
     * Runs ABA {@code tasks} in order over one framework. {@link ReasoningTask#DISPUTE_TREES}
     * yields one {@link DisputeResult} per goal, keyed by goal in the given order. Options,
     * framework and task selection are validated before any task starts.
     */
    public ReasoningReport run(AbaFramework framework, List<String> goals, Collection<ReasoningTask> tasks,
                               ReasoningOptions options) {
        options.validate();
        requireFamily(tasks, true);
        if (tasks.contains(ReasoningTask.DISPUTE_TREES) && options.semantics() == Semantics.STABLE) {
            throw new ConfigurationException("semantics", options.semantics().key(),
                    "dispute trees support grounded, complete and preferred semantics");
        }
        framework.validate();

        Map<ReasoningTask, Object> results = new LinkedHashMap<>();
        for (ReasoningTask task : new LinkedHashSet<>(tasks)) {
            long started = System.currentTimeMillis();
            if (task == ReasoningTask.ABA_EXTENSIONS) {
                results.put(task, solveAba(framework, options));
            } else {
                Map<String, DisputeResult> disputes = new LinkedHashMap<>();
                for (String goal : goals) {
                    disputes.put(goal, disputeTrees(framework, goal, options));
                }
                results.put(task, Collections.unmodifiableMap(disputes));
            }
            LOG.debugf("Task %s finished in %d ms", task.key(), System.currentTimeMillis() - started);
        }
        return new ReasoningReport(framework.fingerprint(), results, Optional.empty());
    }

    private static void requireFamily(Collection<ReasoningTask> tasks, boolean aba) {
        for (ReasoningTask task : tasks) {
            if (task.aba() != aba) {
                throw new IllegalArgumentException("Task " + task.key() + " runs against "
                        + (task.aba() ? "an ABA framework" : "an argument graph"));
            }
        }
    }

    /**
     * Runs tasks named by their keys, e.g. {@code grounded_extension}.
     */
    public ReasoningReport runKeys(ArgumentGraph graph, List<String> taskKeys, ReasoningOptions options, boolean explain) {
        List<ReasoningTask> tasks = taskKeys.stream().map(ReasoningTask::fromKey).toList();
        return run(graph, tasks, options, explain);
    }

    /**
     * Reasons for every label of {@code labeling}: an IN argument has only OUT attackers, an OUT
     * argument has an IN attacker, an UNDEC argument has neither.
     */
    public static SortedMap<String, LabelExplanation> explainLabels(ArgumentationFramework af, Labeling labeling) {
        SortedMap<String, LabelExplanation> out = new TreeMap<>();
        for (String argument : af.arguments()) {
            Label label = labeling.label(argument);
            SortedMap<String, Label> attackers = new TreeMap<>();
            for (String a : af.attackersOf(argument)) {
                attackers.put(a, labeling.label(a));
            }
            out.put(argument, new LabelExplanation(argument, label, attackers, reason(label, attackers)));
        }
        return out;
    }

    private static String reason(Label label, SortedMap<String, Label> attackers) {
        return switch (label) {
            case IN -> attackers.isEmpty()
                    ? "unattacked"
                    : "every attacker is out: " + String.join(", ", attackers.keySet());
            case OUT -> "attacked by in argument " + String.join(", ", withLabel(attackers, Label.IN));
            case UNDEC -> "no attacker is in; undecided attackers: " + String.join(", ", withLabel(attackers, Label.UNDEC));
        };
    }

    private static List<String> withLabel(SortedMap<String, Label> attackers, Label label) {
        List<String> ids = new ArrayList<>();
        attackers.forEach((id, l) -> {
            if (l == label) ids.add(id);
        });
        return ids;
    }
}
