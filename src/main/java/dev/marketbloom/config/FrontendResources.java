package dev.marketbloom.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Locates the bundled front-end: the admin page, static assets and the entry document
 * returned for every request no API route claims.
 */
@Component
@Slf4j
public class FrontendResources {

    private final Resource root;
    private final Resource adminPage;
    private final String indexDocument;

    public FrontendResources(LeadCaptureProperties properties, ResourceLoader resourceLoader) {
        LeadCaptureProperties.Frontend frontend = properties.frontend();
        String location = frontend.location().endsWith("/") ? frontend.location() : frontend.location() + "/";
        this.root = resourceLoader.getResource(location);
        this.adminPage = resourceLoader.getResource(frontend.adminPage());
        this.indexDocument = frontend.indexDocument();
        log.info("Serving front-end from {}, admin page at /admin from {}", location, frontend.adminPage());
    }

    public Resource adminPage() {
        return adminPage;
    }

    public Resource entryDocument() {
        return resolveAsset(root, "/", indexDocument);
    }

    /**
     * The asset for a request path, or the entry document when there is none.
     */
    public Resource resolve(String path) {
        return resolveAsset(root, path, indexDocument);
    }

    /**
     * The asset at {@code path} under {@code root} if it exists and is a readable file,
     * otherwise the entry document. Paths that try to leave the root never resolve.
     */
    static Resource resolveAsset(Resource root, String path, String indexDocument) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        if (!relative.isEmpty() && !relative.endsWith("/")
                && !relative.contains("..") && !relative.contains("\\") && !relative.contains(":")) {
            try {
                Resource asset = root.createRelative(relative);
                if (asset.exists() && asset.isReadable()) {
                    return asset;
                }
            } catch (IOException e) {
                log.debug("Could not resolve front-end asset {}: {}", relative, e.getMessage());
            }
        }
        try {
            return root.createRelative(indexDocument);
        } catch (IOException e) {
            throw new IllegalStateException("Front-end location cannot resolve " + indexDocument, e);
        }
    }

    public static MediaType mediaTypeOf(Resource resource) {
        return MediaTypeFactory.getMediaType(resource).orElse(MediaType.APPLICATION_OCTET_STREAM);
    }

    /**
     * HTML is revalidated on every load; other assets are publicly cacheable.
     */
    public static CacheControl cacheControlFor(MediaType mediaType) {
        return MediaType.TEXT_HTML.isCompatibleWith(mediaType)
                ? CacheControl.noCache()
                : CacheControl.empty().cachePublic();
    }
}
