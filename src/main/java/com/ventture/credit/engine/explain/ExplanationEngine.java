package com.ventture.credit.engine.explain;

import com.ventture.credit.engine.NormalizedVector;
import com.ventture.credit.engine.error.CreditEngineException;
import com.ventture.credit.engine.error.DimensionMismatchException;
import com.ventture.credit.engine.error.ExplanationTimeoutException;
import com.ventture.credit.engine.error.ExplanationUnsupportedException;
import com.ventture.credit.engine.model.ScoringModel;
import com.ventture.credit.engine.model.WeightedModel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decomposes a model output into per-feature contributions measured against a baseline vector.
 *
 * <p>Linear models are explained analytically: {@code w_i * (x_i - base_i)}, which sums exactly to
 * {@code logit(x) - logit(base)}. Any other model is explained by perturbation: each feature is reset
 * to its baseline value and the model rescored, costing one extra inference per feature. Perturbation
 * is capped by feature count and by a wall-clock timeout. The timeout bounds how long the caller waits;
 * a model call already in progress is interrupted but cannot be forced to stop.
 */
public class ExplanationEngine {

    // daemon threads; timed-out tasks are cancelled, never awaited
    private static final ExecutorService PERTURBATION_POOL = newPerturbationPool();

    private final ExplanationMethod method;
    private final int maxPerturbationFeatures;
    private final Duration timeout;

    public ExplanationEngine(ExplanationMethod method, int maxPerturbationFeatures, Duration timeout) {
        if (maxPerturbationFeatures <= 0) {
            throw new IllegalArgumentException("maxPerturbationFeatures must be positive");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.method = method == null ? ExplanationMethod.AUTO : method;
        this.maxPerturbationFeatures = maxPerturbationFeatures;
        this.timeout = timeout;
    }

    public ExplanationEngine() {
        this(ExplanationMethod.AUTO, 64, Duration.ofSeconds(2));
    }

    public Explanation explain(ScoringModel model, NormalizedVector vector, List<String> featureNames,
                               NormalizedVector baseline) {
        int n = model.featureCount();
        if (vector.size() != n) throw new DimensionMismatchException(n, vector.size());
        if (baseline.size() != n) throw new DimensionMismatchException(n, baseline.size());
        if (featureNames.size() != n) throw new DimensionMismatchException(n, featureNames.size());

        return switch (resolve(model)) {
            case ANALYTIC -> analytic((WeightedModel) model, vector, featureNames, baseline);
            case PERTURBATION -> perturbation(model, vector, featureNames, baseline);
            case AUTO -> throw new IllegalStateException("unresolved explanation method");
        };
    }

    ExplanationMethod resolve(ScoringModel model) {
        boolean weighted = model instanceof WeightedModel;
        switch (method) {
            case ANALYTIC:
                if (!weighted) {
                    throw new ExplanationUnsupportedException("Analytic explanation requires a linear model, got "
                            + model.getClass().getSimpleName());
                }
                return ExplanationMethod.ANALYTIC;
            case PERTURBATION:
                return checkedPerturbation(model);
            default:
                return weighted ? ExplanationMethod.ANALYTIC : checkedPerturbation(model);
        }
    }

    private ExplanationMethod checkedPerturbation(ScoringModel model) {
        if (model.featureCount() > maxPerturbationFeatures) {
            throw new ExplanationUnsupportedException("Perturbation over " + model.featureCount()
                    + " features exceeds the limit of " + maxPerturbationFeatures);
        }
        return ExplanationMethod.PERTURBATION;
    }

    private Explanation analytic(WeightedModel model, NormalizedVector x, List<String> names, NormalizedVector base) {
        List<Contribution> out = new ArrayList<>(x.size());
        List<String> flagged = new ArrayList<>();
        for (int i = 0; i < x.size(); i++) {
            boolean degenerate = x.isDegenerate(i);
            double score = degenerate ? 0.0 : model.coefficient(i) * (x.get(i) - base.get(i));
            if (degenerate) flagged.add(names.get(i));
            out.add(new Contribution(names.get(i), i, x.get(i), score, degenerate));
        }
        out.sort(Contribution.RANKING);
        return new Explanation(ExplanationMethod.ANALYTIC, out, model.logit(x), model.logit(base), flagged);
    }

    private Explanation perturbation(ScoringModel model, NormalizedVector x, List<String> names, NormalizedVector base) {
        AtomicInteger explained = new AtomicInteger();
        Future<Explanation> task = PERTURBATION_POOL.submit(() -> perturb(model, x, names, base, explained));
        try {
            return task.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new ExplanationTimeoutException(timeout, explained.get(), x.size());
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new CreditEngineException("Interrupted while explaining", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new CreditEngineException("Perturbation failed", cause);
        }
    }

    private Explanation perturb(ScoringModel model, NormalizedVector x, List<String> names, NormalizedVector base,
                                AtomicInteger explained) {
        double original = model.score(x);
        List<Contribution> out = new ArrayList<>(x.size());
        List<String> flagged = new ArrayList<>();
        for (int i = 0; i < x.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                // the caller has already given up
                throw new CancellationException("perturbation cancelled after " + i + " features");
            }
            if (x.isDegenerate(i)) {
                flagged.add(names.get(i));
                out.add(new Contribution(names.get(i), i, x.get(i), 0.0, true));
            } else {
                double perturbed = model.score(x.with(i, base.get(i)));
                out.add(new Contribution(names.get(i), i, x.get(i), original - perturbed, false));
            }
            explained.incrementAndGet();
        }
        out.sort(Contribution.RANKING);
        return new Explanation(ExplanationMethod.PERTURBATION, out, original, model.score(base), flagged);
    }

    private static ExecutorService newPerturbationPool() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "perturbation-explainer-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
