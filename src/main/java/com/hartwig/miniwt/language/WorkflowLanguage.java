package com.hartwig.miniwt.language;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import com.hartwig.miniwt.cwl.CwlParser;
import com.hartwig.miniwt.cwl.CwlWriter;
import com.hartwig.miniwt.wdl.WdlParser;
import com.hartwig.miniwt.wdl.WdlWriter;

public enum WorkflowLanguage {
    WDL("wdl") {
        @Override
        public WorkflowParser parser(final TranslatorOptions options) {
            return new WdlParser(options.importResolver());
        }

        @Override
        public WorkflowWriter writer(final TranslatorOptions options) {
            return new WdlWriter(options);
        }
    },
    CWL("cwl") {
        @Override
        public WorkflowParser parser(final TranslatorOptions options) {
            return new CwlParser(options.importResolver());
        }

        @Override
        public WorkflowWriter writer(final TranslatorOptions options) {
            return new CwlWriter(options);
        }
    };

    private static final Pattern WDL_CONTENT = Pattern.compile("^\\s*(version\\s+[\\w.]+|task\\s+\\w+\\s*\\{|workflow\\s+\\w+\\s*\\{|import\\s+\")",
            Pattern.MULTILINE);
    private static final Pattern CWL_CONTENT = Pattern.compile("^\\s*(cwlVersion\\s*:|class\\s*:|\\$graph\\s*:)", Pattern.MULTILINE);

    private final String tag;

    WorkflowLanguage(final String tag) {
        this.tag = tag;
    }

    public abstract WorkflowParser parser(TranslatorOptions options);

    public abstract WorkflowWriter writer(TranslatorOptions options);

    public String tag() {
        return tag;
    }

    public String extension() {
        return "." + tag;
    }

    public static WorkflowLanguage fromTag(String tag) {
        return Arrays.stream(values())
                .filter(language -> language.tag.equals(tag.trim().toLowerCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(String.format("Unknown workflow language '%s', expected one of wdl, cwl",
                        tag)));
    }

    public static Optional<WorkflowLanguage> fromFileName(String fileName) {
        var lower = fileName.toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(language -> lower.endsWith(language.extension())).findFirst();
    }

    /**
     * Guesses the language from the document text.
     */
    public static Optional<WorkflowLanguage> detect(String text) {
        if (CWL_CONTENT.matcher(text).find()) {
            return Optional.of(CWL);
        }
        if (WDL_CONTENT.matcher(text).find()) {
            return Optional.of(WDL);
        }
        return Optional.empty();
    }
}
