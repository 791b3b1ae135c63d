package com.hartwig.miniwt.diagnostics;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the diagnostics of one write. In strict mode the first construct that has to be dropped or degraded fails
 * the write instead.
 */
public class Diagnostics {
    private static final Logger LOGGER = LoggerFactory.getLogger(Diagnostics.class);

    private final boolean strict;
    private final List<Diagnostic> entries = new ArrayList<>();

    public Diagnostics(final boolean strict) {
        this.strict = strict;
    }

    /**
     * Records a construct the target cannot express.
     *
     * @throws UnsupportedConstructException in strict mode
     */
    public void unsupported(DiagnosticKind kind, String location, String message) throws UnsupportedConstructException {
        if (strict) {
            throw new UnsupportedConstructException(kind, location, message);
        }
        LOGGER.debug("Dropping construct at {}: {}", location, message);
        entries.add(Diagnostic.warning(kind, location, message));
    }

    public void info(DiagnosticKind kind, String location, String message) {
        entries.add(Diagnostic.info(kind, location, message));
    }

    public List<Diagnostic> entries() {
        return List.copyOf(entries);
    }

    public boolean isStrict() {
        return strict;
    }
}
