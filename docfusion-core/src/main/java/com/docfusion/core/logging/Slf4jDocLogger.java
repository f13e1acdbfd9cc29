package com.docfusion.core.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link DocLogger} backed by SLF4J.
 *
 * <p>Progress messages and the final report are logged at INFO level; debug, info, warn and
 * error map to the SLF4J level of the same name.
 */
public class Slf4jDocLogger implements DocLogger {

    private final Logger log;
    private final AtomicInteger warnings = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();

    public Slf4jDocLogger() {
        this(LoggerFactory.getLogger("com.docfusion"));
    }

    public Slf4jDocLogger(Logger log) {
        this.log = log;
    }

    @Override
    public void progress(String message) {
        log.info("{}", message);
    }

    @Override
    public void debug(String message) {
        log.debug("{}", message);
    }

    @Override
    public void info(String message) {
        log.info("{}", message);
    }

    @Override
    public void warn(String message) {
        warnings.incrementAndGet();
        log.warn("{}", message);
    }

    @Override
    public void error(String message) {
        errors.incrementAndGet();
        log.error("{}", message);
    }

    @Override
    public int warningsCount() {
        return warnings.get();
    }

    @Override
    public int errorsCount() {
        return errors.get();
    }

    @Override
    public void report() {
        log.info("Generation completed with {} warning(s) and {} error(s)", warnings.get(), errors.get());
    }
}
