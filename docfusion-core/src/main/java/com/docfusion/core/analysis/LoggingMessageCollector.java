package com.docfusion.core.analysis;

import com.docfusion.core.logging.DocLogger;
import com.docfusion.core.model.SourceLocation;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link MessageCollector} that forwards every diagnostic to a {@link DocLogger} at info
 * level and remembers whether an error was seen.
 */
public class LoggingMessageCollector implements MessageCollector {

    private final DocLogger logger;
    private final AtomicBoolean seenErrors = new AtomicBoolean();

    public LoggingMessageCollector(DocLogger logger) {
        this.logger = logger;
    }

    @Override
    public void report(Severity severity, String message, SourceLocation location) {
        if (severity == Severity.ERROR) {
            seenErrors.set(true);
        }
        logger.info(render(severity, message, location));
    }

    @Override
    public boolean hasErrors() {
        return seenErrors.get();
    }

    @Override
    public void clear() {
        seenErrors.set(false);
    }

    static String render(Severity severity, String message, SourceLocation location) {
        String prefix = severity.name().toLowerCase();
        return location == null
            ? prefix + ": " + message
            : prefix + ": " + location + ": " + message;
    }
}
