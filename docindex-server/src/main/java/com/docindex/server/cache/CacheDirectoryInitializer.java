/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * Legal Notice: This module and the associated software architecture are proprietary
 * and confidential. Unauthorized copying, distribution, modification, or use is
 * strictly prohibited without explicit written permission from the copyright holder.
 *
 * Patent Pending: Certain architectural patterns and implementations described in
 * this module may be subject to patent applications.
 */
package com.docindex.server.cache;

import com.docindex.core.constants.DocIndexConstants;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Prepares a private, writable cache directory.
 * 
 * <p>The directory is created if missing and restricted to its owner where the file
 * system supports POSIX permissions. When the requested directory cannot be used
 * (permissions, read-only file system) a process-temporary directory is substituted and
 * the result is marked degraded. Initialization never throws.</p>
 * 
 * @version 1.0.0
 */
@Slf4j
public class CacheDirectoryInitializer {
    
    private static final Set<PosixFilePermission> OWNER_ONLY = 
            PosixFilePermissions.fromString(DocIndexConstants.CACHE_DIR_PERMISSIONS);
    
    private final boolean posixSupported;
    
    public CacheDirectoryInitializer() {
        this.posixSupported = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }
    
    public CacheDirectory initialize(String requestedDirectory, long ttlSeconds) {
        String error = null;
        
        if (requestedDirectory != null && !requestedDirectory.isBlank()) {
            Path requested = Paths.get(requestedDirectory).toAbsolutePath();
            try {
                boolean created = prepare(requested);
                log.info("{} cache directory: {}", created ? "Created" : "Using existing", requested);
                return CacheDirectory.builder()
                        .path(requested)
                        .ttlSeconds(ttlSeconds)
                        .initialized(true)
                        .build();
            } catch (IOException | SecurityException e) {
                error = "Cache directory " + requested + " unusable: " + e.getMessage();
                log.warn("{}; falling back to a temporary directory", error);
            }
        } else {
            error = "No cache directory configured";
            log.warn("{}; using a temporary directory", error);
        }
        
        try {
            Path fallback = posixSupported
                    ? Files.createTempDirectory(DocIndexConstants.TEMP_DIR_PREFIX, ownerOnlyAttribute())
                    : Files.createTempDirectory(DocIndexConstants.TEMP_DIR_PREFIX);
            log.warn("Using fallback cache directory: {}", fallback);
            return CacheDirectory.builder()
                    .path(fallback)
                    .ttlSeconds(ttlSeconds)
                    .initialized(true)
                    .degraded(true)
                    .error(error)
                    .build();
        } catch (IOException | SecurityException e) {
            log.error("Failed to create fallback cache directory: {}", e.getMessage());
            return CacheDirectory.builder()
                    .path(Paths.get(System.getProperty("java.io.tmpdir")))
                    .ttlSeconds(ttlSeconds)
                    .initialized(false)
                    .degraded(true)
                    .error(error + "; fallback failed: " + e.getMessage())
                    .build();
        }
    }
    
    /**
     * @return true if the directory had to be created
     */
    private boolean prepare(Path dir) throws IOException {
        boolean created = false;
        if (!Files.isDirectory(dir)) {
            Files.createDirectories(dir);
            created = true;
        }
        if (posixSupported) {
            Files.setPosixFilePermissions(dir, OWNER_ONLY);
        }
        if (!Files.isWritable(dir)) {
            throw new IOException("directory is not writable");
        }
        return created;
    }
    
    private static FileAttribute<Set<PosixFilePermission>> ownerOnlyAttribute() {
        return PosixFilePermissions.asFileAttribute(OWNER_ONLY);
    }
}
