package com.jumbo.companion.service.template;

public class InvalidTemplateException extends RuntimeException {

    private final String templateId;

    public InvalidTemplateException(String templateId, String message) {
        super(message);
        this.templateId = templateId;
    }

    public String templateId() {
        return templateId;
    }
}
