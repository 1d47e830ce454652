package com.catalogimport.catalogimport.importer;

import com.catalogimport.catalogimport.store.StoreResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one import run, passed explicitly through every row step: counters, the error tally,
 * collected warnings and the run-owned store resolver.
 * <p>
 * All row output goes through this object. Verbose-only diagnostics are logged at DEBUG unless the run
 * is verbose; warnings and errors are always logged.
 */
public class ImportContext {

    private static final Logger log = LoggerFactory.getLogger(ImportContext.class);

    private final boolean verbose;
    private final StoreResolver storeResolver;
    private final List<String> warnings = new ArrayList<>();
    private int added;
    private int updated;
    private int deleted;
    private int errors;

    public ImportContext(boolean verbose, StoreResolver storeResolver) {
        this.verbose = verbose;
        this.storeResolver = storeResolver;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public StoreResolver storeResolver() {
        return storeResolver;
    }

    public void info(String message) {
        log.info(message);
    }

    /**
     * Diagnostic shown only in verbose runs (merges, fallbacks, store-mapping misses, de-dup notices).
     */
    public void notice(String message) {
        warnings.add(message);
        if (verbose) {
            log.info(message);
        } else {
            log.debug(message);
        }
    }

    public void warn(String message) {
        warnings.add(message);
        log.warn(message);
    }

    /**
     * Reports a row-level error and counts it towards the run's failure status.
     */
    public void error(String message, Throwable cause) {
        errors++;
        log.error(message);
        log.debug("Cause of: {}", message, cause);
    }

    public void recordAdded() {
        added++;
    }

    public void recordUpdated() {
        updated++;
    }

    public void recordDeleted() {
        deleted++;
    }

    public int added() {
        return added;
    }

    public int updated() {
        return updated;
    }

    public int deleted() {
        return deleted;
    }

    public int errorCount() {
        return errors;
    }

    public boolean hasErrors() {
        return errors > 0;
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public ImportSummary toSummary() {
        return new ImportSummary(added, updated, deleted, errors, warnings);
    }
}
