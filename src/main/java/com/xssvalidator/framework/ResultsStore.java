package com.xssvalidator.framework;

import com.xssvalidator.model.Severity;
import com.xssvalidator.model.ValidatorConfig;
import com.xssvalidator.model.VerificationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Central storage for verification results. The correlator and the manual tester
 * report here; the issue reporter and the log listen.
 * Thread-safe via CopyOnWriteArrayList. Supports multiple listeners.
 */
public class ResultsStore {

    static final int MAX_RESULTS = 10000;

    private final CopyOnWriteArrayList<VerificationResult> results = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<ResultsListener> listeners = new CopyOnWriteArrayList<>();
    private volatile Consumer<String> errorLogger;

    public interface ResultsListener {
        void onResultAdded(VerificationResult result);
    }

    public void setErrorLogger(Consumer<String> logger) {
        this.errorLogger = logger;
    }

    public void addListener(ResultsListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(ResultsListener listener) {
        listeners.remove(listener);
    }

    /**
     * Appends a result and notifies listeners outside the critical section.
     * Returns false if the store is full.
     */
    public boolean addResult(VerificationResult result) {
        synchronized (this) {
            if (results.size() >= MAX_RESULTS) {
                Consumer<String> logger = errorLogger;
                if (logger != null) {
                    logger.accept("[ResultsStore] Store full (" + MAX_RESULTS + "), result not kept: " + result);
                }
                return false;
            }
            results.add(result);
        }

        for (ResultsListener l : listeners) {
            try {
                l.onResultAdded(result);
            } catch (Throwable t) {
                Consumer<String> logger = errorLogger;
                if (logger != null) {
                    logger.accept("[ResultsStore] Listener error: " + t.getClass().getName() + ": " + t.getMessage());
                }
            }
        }
        return true;
    }

    public List<VerificationResult> getAllResults() {
        return Collections.unmodifiableList(new ArrayList<>(results));
    }

    /** Results the results view shows under the current filter settings. */
    public List<VerificationResult> visibleResults(ValidatorConfig config) {
        boolean showAll = config.isShowAllResults();
        double threshold = config.getConfidenceThreshold();
        return results.stream()
                .filter(r -> showAll || isNoteworthy(r, threshold))
                .collect(Collectors.toList());
    }

    static boolean isNoteworthy(VerificationResult r, double confidenceThreshold) {
        return r.getValue() > 0
                || r.getSeverity() != Severity.NONE
                || r.getConfidence() >= confidenceThreshold;
    }

    public int processedCount() {
        return results.size();
    }

    public int vulnerableCount() {
        return (int) results.stream().filter(r -> r.getValue() > 0).count();
    }

    public int errorCount() {
        return (int) results.stream().filter(VerificationResult::isError).count();
    }

    public synchronized void clear() {
        results.clear();
    }
}
