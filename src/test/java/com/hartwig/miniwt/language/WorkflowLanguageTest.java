package com.hartwig.miniwt.language;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.hartwig.miniwt.Fixtures;

import org.junit.jupiter.api.Test;

class WorkflowLanguageTest {
    @Test
    void tagsAreCaseInsensitive() {
        assertThat(WorkflowLanguage.fromTag("WDL ")).isEqualTo(WorkflowLanguage.WDL);
        assertThat(WorkflowLanguage.fromTag("cwl")).isEqualTo(WorkflowLanguage.CWL);
    }

    @Test
    void unknownTagIsRejected() {
        var exception = assertThrows(IllegalArgumentException.class, () -> WorkflowLanguage.fromTag("nextflow"));
        assertThat(exception.getMessage()).isEqualTo("Unknown workflow language 'nextflow', expected one of wdl, cwl");
    }

    @Test
    void languageFromFileName() {
        assertThat(WorkflowLanguage.fromFileName("x.CWL")).contains(WorkflowLanguage.CWL);
        assertThat(WorkflowLanguage.fromFileName("pipelines/main.wdl")).contains(WorkflowLanguage.WDL);
        assertThat(WorkflowLanguage.fromFileName("x.txt")).isEmpty();
    }

    @Test
    void languageFromContent() {
        assertThat(WorkflowLanguage.detect(Fixtures.read("cwl/counting.cwl"))).contains(WorkflowLanguage.CWL);
        assertThat(WorkflowLanguage.detect(Fixtures.read("wdl/hello.wdl"))).contains(WorkflowLanguage.WDL);
        assertThat(WorkflowLanguage.detect("task t {\n}\n")).contains(WorkflowLanguage.WDL);
        assertThat(WorkflowLanguage.detect("just some notes")).isEmpty();
    }

    @Test
    void extensionFollowsTag() {
        assertThat(WorkflowLanguage.WDL.extension()).isEqualTo(".wdl");
        assertThat(WorkflowLanguage.CWL.tag()).isEqualTo("cwl");
    }
}
