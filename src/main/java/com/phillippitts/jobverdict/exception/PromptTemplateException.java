package com.phillippitts.jobverdict.exception;

/**
 * Thrown when a prompt template cannot be loaded, or is rendered without one of its required slots.
 */
public class PromptTemplateException extends JobVerdictException {

    private final String templateName;

    public PromptTemplateException(String templateName, String message) {
        super("Prompt template '" + templateName + "': " + message);
        this.templateName = templateName;
    }

    public PromptTemplateException(String templateName, String message, Throwable cause) {
        super("Prompt template '" + templateName + "': " + message, cause);
        this.templateName = templateName;
    }

    public String getTemplateName() {
        return templateName;
    }
}
