package com.phillippitts.bbdetector.service.detection;

import com.phillippitts.bbdetector.exception.TemplateLoadException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Reads reference template images. Locations may be {@code classpath:} resources,
 * {@code file:} URLs, or plain filesystem paths.
 */
@Component
public class TemplateLoader {

    private static final Logger LOG = LogManager.getLogger(TemplateLoader.class);

    private final ResourceLoader resourceLoader;

    public TemplateLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
    }

    // Package-private for tests
    TemplateLoader() {
        this(new DefaultResourceLoader());
    }

    /**
     * Loads and decodes the image at the given location.
     *
     * @throws TemplateLoadException if the resource is missing or not a decodable image
     */
    public ReferenceTemplate load(String location) {
        if (location == null || location.isBlank()) {
            throw new TemplateLoadException(String.valueOf(location), "no location given");
        }
        Resource resource = resourceLoader.getResource(normalize(location.trim()));
        if (!resource.exists()) {
            throw new TemplateLoadException(location, "resource does not exist");
        }
        try (InputStream in = resource.getInputStream()) {
            BufferedImage image = ImageIO.read(in);
            if (image == null) {
                throw new TemplateLoadException(location, "not a supported image format");
            }
            ReferenceTemplate template = ReferenceTemplate.of(resource.getFilename() == null
                    ? location : resource.getFilename(), image);
            LOG.info("Loaded template {} from {}", template, location);
            return template;
        } catch (IOException e) {
            throw new TemplateLoadException(location, e);
        }
    }

    /**
     * Like {@link #load} but degrades to {@link ReferenceTemplate#empty()} so detection stays
     * idle instead of failing startup.
     */
    public ReferenceTemplate loadOrEmpty(String location) {
        if (location == null || location.isBlank()) {
            LOG.warn("No detection template configured (detection.template-path); automatic detection is idle");
            return ReferenceTemplate.empty();
        }
        try {
            return load(location);
        } catch (TemplateLoadException e) {
            LOG.warn("{}; automatic detection is idle", e.getMessage());
            return ReferenceTemplate.empty();
        }
    }

    private static String normalize(String location) {
        if (location.startsWith(ResourceLoader.CLASSPATH_URL_PREFIX) || location.startsWith("file:")) {
            return location;
        }
        return "file:" + location;
    }
}
