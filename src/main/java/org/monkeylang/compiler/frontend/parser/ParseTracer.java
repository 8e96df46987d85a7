package org.monkeylang.compiler.frontend.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs entry and exit of parse functions, indented by recursion depth.
 * Output goes to DEBUG and is produced only when tracing is enabled.
 */
public final class ParseTracer {

    private static final Logger LOG = LoggerFactory.getLogger(ParseTracer.class);
    private static final String INDENT = "\t";

    /** A tracer that never logs. */
    public static final ParseTracer DISABLED = new ParseTracer(false);

    private final boolean enabled;
    private int depth = 0;

    public ParseTracer(boolean enabled) {
        this.enabled = enabled;
    }

    public void begin(String function) {
        if (!enabled) return;
        depth++;
        LOG.debug("{}BEGIN {}", INDENT.repeat(depth - 1), function);
    }

    public void end(String function) {
        if (!enabled) return;
        LOG.debug("{}END {}", INDENT.repeat(depth - 1), function);
        depth--;
    }

    /**
     * @return The current nesting depth; 0 outside of any traced function.
     */
    public int depth() {
        return depth;
    }

    public boolean isEnabled() {
        return enabled;
    }
}
