package com.hartwig.miniwt.language;

import com.hartwig.miniwt.diagnostics.SemanticException;
import com.hartwig.miniwt.diagnostics.SyntaxException;
import com.hartwig.miniwt.ir.Document;

public interface WorkflowParser {
    /**
     * Parses a complete document. Either the whole document is lowered or an exception is thrown, never a partial
     * result.
     *
     * @param sourceName name used in messages and to resolve relative imports
     */
    Document parse(String text, String sourceName) throws SyntaxException, SemanticException;
}
