package com.phillippitts.jobverdict.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void jobVerdictExceptionShouldIncludeMessageAndCause() {
        IOException cause = new IOException("IO failure");
        JobVerdictException ex = new JobVerdictException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void transportExceptionDefaultsClientName() {
        TransportException ex = new TransportException("connection refused");

        assertThat(ex.getMessage()).isEqualTo("connection refused");
        assertThat(ex.getClientName()).isEqualTo("unknown");
    }

    @Test
    void transportExceptionShouldIncludeClientAndCause() {
        RuntimeException cause = new RuntimeException("socket closed");
        TransportException ex = new TransportException("call failed", "adjudication", cause);

        assertThat(ex.getMessage()).isEqualTo("call failed (client: adjudication)");
        assertThat(ex.getClientName()).isEqualTo("adjudication");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void gazetteerLoadExceptionShouldIncludeResource() {
        GazetteerLoadException ex = new GazetteerLoadException("gazetteer.json", "resource not found on classpath");

        assertThat(ex.getMessage()).contains("gazetteer.json").contains("not found");
        assertThat(ex.getResource()).isEqualTo("gazetteer.json");
    }

    @Test
    void promptTemplateExceptionShouldIncludeTemplateName() {
        PromptTemplateException ex = new PromptTemplateException("prompts/cv-match.txt", "missing slot");

        assertThat(ex.getMessage()).isEqualTo("Prompt template 'prompts/cv-match.txt': missing slot");
    }

    @Test
    void invalidJobInputExceptionShouldNameField() {
        InvalidJobInputException ex = new InvalidJobInputException("jobDescription", "must not be blank");

        assertThat(ex.getMessage()).contains("jobDescription").contains("must not be blank");
    }

    @Test
    void allExceptionsShouldExtendBase() {
        assertThat(new TransportException("test")).isInstanceOf(JobVerdictException.class);
        assertThat(new GazetteerLoadException("g", "r")).isInstanceOf(JobVerdictException.class);
        assertThat(new PromptTemplateException("t", "m")).isInstanceOf(JobVerdictException.class);
        assertThat(new InvalidJobInputException("f", "r")).isInstanceOf(JobVerdictException.class);
        assertThat(new JobVerdictException("test")).isInstanceOf(RuntimeException.class);
    }
}
