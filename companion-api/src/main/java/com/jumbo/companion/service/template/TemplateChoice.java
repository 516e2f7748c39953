package com.jumbo.companion.service.template;

import com.jumbo.companion.model.ResponseTemplate;

/**
 * A ranked template with its chosen variation. {@code rotationReset} is set when every candidate sat
 * inside the rotation window and the exclusion was lifted.
 */
public record TemplateChoice(
        ResponseTemplate template,
        int variationIndex,
        double score,
        int satisfiedRequirements,
        boolean rotationReset
) {

    public String templateId() {
        return template.id();
    }

    public String text() {
        return template.variations().get(variationIndex);
    }
}
