package io.verbatim.analyze;

import io.verbatim.js.semantic.SemanticModel;
import io.verbatim.syntax.api.Diagnostic;
import io.verbatim.syntax.api.SyntaxContractException;
import io.verbatim.syntax.api.SyntaxNode;
import io.verbatim.syntax.api.SyntaxTree;
import io.verbatim.syntax.api.WalkEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the rules of a {@link RuleRegistry} over syntax trees.
 *
 * <p>One pass visits every node once, in preorder, and invokes the rules querying the node's
 * kind. The semantic model is built at most once per pass, on the first request of a semantic
 * rule. An analyzer holds no per-pass state and can analyze several trees concurrently.
 */
public final class Analyzer {
  private static final Logger log = LoggerFactory.getLogger(Analyzer.class);

  private final RuleRegistry registry;
  private final AnalyzerOptions options;
  private final RuleErrorHandler errorHandler;
  private final Function<SyntaxNode, SemanticModel> modelFactory;

  /** An analyzer configured from system properties, rethrowing rule failures. */
  public Analyzer(RuleRegistry registry) {
    this(registry, AnalyzerOptions.fromSystemProperties(), RuleErrorHandler.DEFAULT);
  }

  public Analyzer(RuleRegistry registry, AnalyzerOptions options, RuleErrorHandler errorHandler) {
    this(registry, options, errorHandler, SemanticModel::build);
  }

  Analyzer(
      RuleRegistry registry,
      AnalyzerOptions options,
      RuleErrorHandler errorHandler,
      Function<SyntaxNode, SemanticModel> modelFactory) {
    this.registry = registry.filter(options);
    this.options = options;
    this.errorHandler = errorHandler;
    this.modelFactory = modelFactory;
  }

  public RuleRegistry registry() {
    return registry;
  }

  /** Collects all signals for {@code tree}. */
  public AnalysisResult analyze(SyntaxTree tree) {
    List<AnalyzerSignal> signals = new ArrayList<>();
    boolean aborted = analyze(tree, (signal, control) -> signals.add(signal));
    return new AnalysisResult(tree, signals, aborted);
  }

  /**
   * Streams the signals for {@code tree} to {@code visitor}.
   *
   * @return whether the visitor aborted the pass
   */
  public boolean analyze(SyntaxTree tree, SignalVisitor visitor) {
    return new Pass(tree.root(), visitor).run();
  }

  /**
   * Analyzes independent trees on {@code executor}.
   *
   * @return one result per tree, in the order of {@code trees}
   * @throws InterruptedException if interrupted while waiting for the results; analyses that
   *     have not finished yet are cancelled
   */
  public List<AnalysisResult> analyzeAll(List<SyntaxTree> trees, ExecutorService executor)
      throws InterruptedException {
    List<Future<AnalysisResult>> futures = new ArrayList<>(trees.size());
    for (SyntaxTree tree : trees) {
      futures.add(executor.submit(() -> analyze(tree)));
    }
    List<AnalysisResult> results = new ArrayList<>(trees.size());
    try {
      for (Future<AnalysisResult> future : futures) {
        results.add(future.get());
      }
    } catch (InterruptedException e) {
      futures.forEach(f -> f.cancel(true));
      throw e;
    } catch (ExecutionException e) {
      futures.forEach(f -> f.cancel(true));
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Analysis failed", cause);
    }
    log.debug("Analyzed {} trees", trees.size());
    return results;
  }

  /** State of one pass over one tree. */
  private final class Pass implements AnalysisControl {
    private final SyntaxNode root;
    private final SignalVisitor visitor;
    private SemanticModel model;
    private boolean aborted;

    Pass(SyntaxNode root, SignalVisitor visitor) {
      this.root = root;
      this.visitor = visitor;
    }

    boolean run() {
      if (registry.rules().isEmpty()) {
        return false;
      }
      for (WalkEvent event : root.preorder()) {
        if (!(event instanceof WalkEvent.Enter)) {
          continue;
        }
        SyntaxNode node = event.node();
        for (Rule<?> rule : registry.rulesFor(node.kind())) {
          runRule(rule, node);
          if (aborted) {
            log.debug("Analysis aborted at {}", node.textTrimmedRange());
            return true;
          }
        }
      }
      return false;
    }

    private SemanticModel model() {
      if (model == null) {
        model = modelFactory.apply(root);
      }
      return model;
    }

    private <S> void runRule(Rule<S> rule, SyntaxNode node) {
      RuleMetadata metadata = rule.metadata();
      RuleContext ctx = new RuleContext(node, metadata, rule.query(), this::model);
      List<S> states;
      try {
        states = rule.run(ctx);
      } catch (SyntaxContractException e) {
        throw e;
      } catch (RuntimeException e) {
        errorHandler.handleRuleError(
            RuleExecutionException.of(metadata, "run at " + node.textTrimmedRange(), e));
        return;
      }
      if (states.isEmpty()) {
        return;
      }
      if (!options.ignoreSuppressions() && Suppressions.isSuppressed(node, metadata)) {
        log.debug("{} suppressed at {}", metadata.category(), node.textTrimmedRange());
        return;
      }
      for (S state : states) {
        Optional<Diagnostic> diagnostic;
        Optional<RuleAction> action;
        try {
          diagnostic = rule.diagnostic(ctx, state);
          action = diagnostic.isPresent() ? rule.action(ctx, state) : Optional.empty();
        } catch (SyntaxContractException e) {
          throw e;
        } catch (RuntimeException e) {
          errorHandler.handleRuleError(
              RuleExecutionException.of(metadata, "signal at " + node.textTrimmedRange(), e));
          continue;
        }
        if (diagnostic.isEmpty()) {
          continue;
        }
        visitor.visit(
            new AnalyzerSignal(
                metadata,
                node,
                diagnostic.get().withCategory(metadata.category()),
                action.orElse(null)),
            this);
        if (aborted) {
          return;
        }
      }
    }

    @Override
    public void abort() {
      aborted = true;
    }

    @Override
    public boolean isAborted() {
      return aborted;
    }
  }
}
