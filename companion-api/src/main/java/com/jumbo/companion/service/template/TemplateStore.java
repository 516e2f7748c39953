package com.jumbo.companion.service.template;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jumbo.companion.model.ResponseTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the versioned template catalog and swaps in a new snapshot when the version changes.
 */
@Component
public class TemplateStore {

    private static final Logger log = LoggerFactory.getLogger(TemplateStore.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final TemplateValidator validator;
    private final String location;
    private final AtomicReference<TemplateCatalog> current = new AtomicReference<>();

    public TemplateStore(ResourceLoader resourceLoader,
                         ObjectMapper objectMapper,
                         @Value("${companion.templates.location:classpath:templates/response-templates.json}") String location) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.validator = new TemplateValidator();
        this.location = location;
        TemplateCatalog catalog = build(read());
        current.set(catalog);
        log.info("Loaded template catalog {} with {} templates from {}", catalog.version(), catalog.size(), location);
    }

    public TemplateCatalog catalog() {
        return current.get();
    }

    /**
     * Re-reads the catalog file and replaces the snapshot only when its version differs.
     * A broken file keeps the previous snapshot in service.
     */
    @Scheduled(fixedDelayString = "${companion.templates.reload-interval-ms:60000}",
            initialDelayString = "${companion.templates.reload-interval-ms:60000}")
    public boolean reloadIfChanged() {
        CatalogDocument document;
        try {
            document = read();
        } catch (CatalogLoadException ex) {
            log.warn("Template catalog reload failed, keeping version {}: {}", current.get().version(), ex.getMessage());
            return false;
        }
        if (Objects.equals(versionOf(document), current.get().version())) {
            return false;
        }
        try {
            TemplateCatalog next = build(document);
            TemplateCatalog previous = current.getAndSet(next);
            log.info("Template catalog updated from {} to {} ({} templates)", previous.version(), next.version(), next.size());
            return true;
        } catch (CatalogLoadException ex) {
            log.warn("Template catalog version {} rejected: {}", versionOf(document), ex.getMessage());
            return false;
        }
    }

    private CatalogDocument read() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CatalogLoadException("Template catalog not found at " + location);
        }
        try (InputStream input = resource.getInputStream()) {
            CatalogDocument document = objectMapper.readValue(input, CatalogDocument.class);
            if (document == null) {
                throw new CatalogLoadException("Template catalog at " + location + " is empty");
            }
            return document;
        } catch (IOException ex) {
            throw new CatalogLoadException("Template catalog at " + location + " could not be parsed", ex);
        }
    }

    private TemplateCatalog build(CatalogDocument document) {
        List<CatalogDocument.Entry> entries = document.templates() == null ? List.of() : document.templates();
        List<ResponseTemplate> valid = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        int rejected = 0;
        for (CatalogDocument.Entry entry : entries) {
            try {
                ResponseTemplate template = validator.validate(entry);
                if (!ids.add(template.id())) {
                    throw new InvalidTemplateException(template.id(), "Duplicate template id");
                }
                valid.add(template);
            } catch (InvalidTemplateException ex) {
                rejected++;
                log.error("Rejected template {}: {}", ex.templateId() == null ? "<unknown>" : ex.templateId(), ex.getMessage());
            }
        }
        if (valid.isEmpty()) {
            throw new CatalogLoadException("Template catalog " + versionOf(document) + " has no valid templates ("
                    + rejected + " rejected)");
        }
        if (rejected > 0) {
            log.warn("Template catalog {} loaded with {} rejected entries", versionOf(document), rejected);
        }
        return new TemplateCatalog(versionOf(document), valid);
    }

    private String versionOf(CatalogDocument document) {
        return document.version() == null || document.version().isBlank() ? "unversioned" : document.version().trim();
    }
}
