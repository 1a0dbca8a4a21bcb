package com.starscape.mediavault.features.ingest.infra;

import com.github.sardine.DavResource;
import com.github.sardine.Sardine;
import com.github.sardine.SardineFactory;
import com.starscape.mediavault.common.config.ProcessingProperties;
import com.starscape.mediavault.common.config.StorageProperties;
import com.starscape.mediavault.common.config.WebDavProperties;
import com.starscape.mediavault.features.ingest.app.ImportCandidate;
import com.starscape.mediavault.features.ingest.app.ImportSource;
import com.starscape.mediavault.features.ingest.app.SourceUnavailableException;
import com.starscape.mediavault.features.ingest.domain.ImportSourceType;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Imports from a WebDAV share. The remote tree is listed one level at a time,
 * and each file is downloaded into the local scratch directory just before it
 * is processed. Remote files are never modified.
 */
@Component
@ConditionalOnProperty(prefix = "app.webdav", name = "enabled", havingValue = "true")
public class WebDavImportSource implements ImportSource {
    
    private static final Logger log = LoggerFactory.getLogger(WebDavImportSource.class);
    
    private final Sardine sardine;
    private final URI baseUri;
    private final String remotePath;
    private final Path scratchDir;
    private final ProcessingProperties processingProperties;
    
    @Autowired
    public WebDavImportSource(WebDavProperties webDavProperties, StorageProperties storageProperties,
                              ProcessingProperties processingProperties) {
        this(createClient(webDavProperties), webDavProperties, storageProperties.getWebDavStagingDir(),
            processingProperties);
    }
    
    WebDavImportSource(Sardine sardine, WebDavProperties webDavProperties, Path scratchDir,
                       ProcessingProperties processingProperties) {
        if (webDavProperties.getUrl() == null || webDavProperties.getUrl().isBlank()) {
            throw new IllegalStateException("app.webdav.url must be set when WebDAV import is enabled");
        }
        this.sardine = sardine;
        this.baseUri = URI.create(stripTrailingSlash(webDavProperties.getUrl().trim()));
        this.remotePath = webDavProperties.normalizedRemotePath();
        this.scratchDir = scratchDir;
        this.processingProperties = processingProperties;
    }
    
    private static Sardine createClient(WebDavProperties properties) {
        if (properties.getUsername() == null || properties.getUsername().isBlank()) {
            return SardineFactory.begin();
        }
        Sardine client = SardineFactory.begin(properties.getUsername(), properties.getPassword());
        client.enablePreemptiveAuthentication(URI.create(properties.getUrl().trim()).getHost());
        return client;
    }
    
    @Override
    public ImportSourceType type() {
        return ImportSourceType.WEBDAV;
    }
    
    @Override
    public void verify() {
        String rootUrl = directoryUrl(remotePath);
        try {
            if (!sardine.exists(rootUrl)) {
                throw new SourceUnavailableException("Remote path not found: " + remotePath);
            }
        } catch (IOException e) {
            throw new SourceUnavailableException("WebDAV server unreachable at " + baseUri + ": " + e.getMessage(), e);
        }
    }
    
    @Override
    public List<ImportCandidate> enumerate() {
        List<RemoteFile> files = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.add(directoryUrl(remotePath));
        
        while (!pending.isEmpty()) {
            String directory = pending.poll();
            if (!visited.add(normalizeDirectory(URI.create(directory).getPath()))) {
                continue;
            }
            List<DavResource> resources;
            try {
                resources = sardine.list(directory, 1);
            } catch (IOException e) {
                throw new SourceUnavailableException("Failed to list " + directory + ": " + e.getMessage(), e);
            }
            String directoryPath = normalizeDirectory(URI.create(directory).getPath());
            for (DavResource resource : resources) {
                URI resolved = baseUri.resolve(resource.getHref());
                if (normalizeDirectory(resolved.getPath()).equals(directoryPath)) {
                    continue;
                }
                if (resource.isDirectory()) {
                    pending.add(resolved.toString());
                } else if (processingProperties.isSupported(Paths.get(resource.getName()))) {
                    files.add(new RemoteFile(resource.getPath(), resource.getName(), resolved.toString()));
                }
            }
        }
        
        files.sort(Comparator.comparing(RemoteFile::path));
        log.info("WebDAV listing found {} supported files under {}", files.size(), remotePath);
        return files.stream()
                .map(file -> (ImportCandidate) new RemoteCandidate(file))
                .toList();
    }
    
    @PreDestroy
    public void close() {
        try {
            sardine.shutdown();
        } catch (IOException e) {
            log.warn("Failed to shut down WebDAV client: {}", e.getMessage());
        }
    }
    
    private String directoryUrl(String path) {
        String base = baseUri.toString();
        String suffix = path.endsWith("/") ? path : path + "/";
        return base + encodePath(suffix);
    }
    
    private static String encodePath(String path) {
        try {
            return new URI(null, null, path, null).getRawPath();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid remote path: " + path, e);
        }
    }
    
    private static String normalizeDirectory(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.endsWith("/") ? path : path + "/";
    }
    
    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
    
    private record RemoteFile(String path, String name, String url) {}
    
    private final class RemoteCandidate implements ImportCandidate {
        
        private final RemoteFile file;
        
        private RemoteCandidate(RemoteFile file) {
            this.file = file;
        }
        
        @Override
        public String displayName() {
            return file.path();
        }
        
        @Override
        public String originalName() {
            return file.name();
        }
        
        @Override
        public Path stage() throws IOException {
            Path target = scratchDir.resolve(UUID.randomUUID().toString().replace("-", "") + "_" + file.name());
            try {
                Files.createDirectories(scratchDir);
                try (InputStream in = sardine.get(file.url())) {
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                }
                return target;
            } catch (IOException e) {
                IOException failure = new IOException("Failed to download " + file.path() + ": " + e.getMessage(), e);
                try {
                    Files.deleteIfExists(target);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
                throw failure;
            }
        }
        
        @Override
        public void release(Path staged) {
            try {
                Files.deleteIfExists(staged);
            } catch (IOException e) {
                log.warn("Could not remove downloaded file {}: {}", staged, e.getMessage());
            }
        }
    }
}
