package com.toonlens.core.diagnostic;

import com.toonlens.core.parser.LinePatterns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for validators providing a per-class logger and line helpers.
 *
 * @see DocumentValidator
 */
public abstract class AbstractDocumentValidator implements DocumentValidator {

    /**
     * Logger instance for this validator.
     * Automatically initialized with the concrete validator class name.
     */
    protected final Logger log;

    protected AbstractDocumentValidator() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    /**
     * Splits source text into lines the same way the parser does, so that line indexes
     * agree with node ranges.
     *
     * @param text source text
     * @return lines without terminators
     */
    protected String[] lines(String text) {
        return LinePatterns.splitLines(text);
    }

    @Override
    public String toString() {
        return getDisplayName() + " [" + getId() + "]";
    }
}
