package com.hartwig.miniwt.language;

import com.hartwig.miniwt.diagnostics.UnsupportedConstructException;
import com.hartwig.miniwt.ir.Document;

public interface WorkflowWriter {
    /**
     * Renders a validated document.
     *
     * @throws UnsupportedConstructException in strict mode, for the first construct the target cannot express
     */
    WriteResult write(Document document) throws UnsupportedConstructException;
}
