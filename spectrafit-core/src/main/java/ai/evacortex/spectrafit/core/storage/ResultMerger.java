/*
 * SpectraFit — Masked Batch Spectrum Fitter
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.spectrafit.core.storage;

import ai.evacortex.spectrafit.core.FitResult;
import ai.evacortex.spectrafit.core.RunMetadata;
import ai.evacortex.spectrafit.core.exceptions.MergeSchemaException;
import ai.evacortex.spectrafit.core.orchestration.TaskOutcome;

import java.util.*;

/**
 * Folds task outcomes into a sealed {@link AggregatedStore}.
 *
 * <p>Outcomes are ordered by task id before anything is appended, so the resulting store depends
 * only on the outcome set. Every successful result must share the parameter vector length, the
 * uncertainty vector length and the spectrum shape of the others.</p>
 */
public class ResultMerger {

    public AggregatedStore merge(Collection<TaskOutcome> outcomes, RunMetadata runMetadata) {
        Objects.requireNonNull(outcomes, "outcomes must not be null");
        List<TaskOutcome> all = List.copyOf(outcomes);

        List<TaskOutcome> sorted = new ArrayList<>(all);
        sorted.sort(Comparator.comparingInt(TaskOutcome::taskId));

        Set<Integer> seen = new HashSet<>();
        FitResult reference = null;
        for (TaskOutcome outcome : sorted) {
            if (!seen.add(outcome.taskId())) {
                throw new MergeSchemaException("task " + outcome.taskId() + " reported more than once", all);
            }
            if (outcome instanceof TaskOutcome.Success success) {
                FitResult r = success.result();
                checkSelfConsistent(r, all);
                if (reference == null) {
                    reference = r;
                } else {
                    checkSameShape(reference, r, all);
                }
            }
        }

        AggregatedStore store = new AggregatedStore(runMetadata);
        for (TaskOutcome outcome : sorted) {
            if (outcome instanceof TaskOutcome.Success success) {
                store.append(success.result());
            } else if (outcome instanceof TaskOutcome.Failed failed) {
                store.recordFailure(failed);
            } else if (outcome instanceof TaskOutcome.Cancelled) {
                store.recordCancelled(outcome.taskId());
            }
        }
        store.seal();
        return store;
    }

    private static void checkSelfConsistent(FitResult r, List<TaskOutcome> all) {
        if (r.fittedParameters().length != r.parameterUncertainties().length) {
            throw new MergeSchemaException("task " + r.taskId() + " has " + r.fittedParameters().length
                    + " parameters but " + r.parameterUncertainties().length + " uncertainties", all);
        }
    }

    private static void checkSameShape(FitResult ref, FitResult r, List<TaskOutcome> all) {
        if (ref.fittedParameters().length != r.fittedParameters().length) {
            throw new MergeSchemaException("fitted parameter length " + r.fittedParameters().length
                    + " of task " + r.taskId() + " differs from " + ref.fittedParameters().length
                    + " of task " + ref.taskId(), all);
        }
        if (ref.fittedSpectrum().length != r.fittedSpectrum().length
                || ref.spectrumComponents() != r.spectrumComponents()) {
            throw new MergeSchemaException("fitted spectrum shape of task " + r.taskId()
                    + " differs from task " + ref.taskId(), all);
        }
    }
}
