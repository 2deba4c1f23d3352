package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.exceptions.VideoStorageException;
import com.example.creatorclaims.service.VideoStorageService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

@Service
public class FilesystemVideoStorageServiceImpl implements VideoStorageService {
    private static final Logger log = LoggerFactory.getLogger(FilesystemVideoStorageServiceImpl.class);
    private final Path rootLocation;

    public FilesystemVideoStorageServiceImpl(@Value("${video.storage.path}") String path) {
        this.rootLocation = Paths.get(path).toAbsolutePath().normalize();
    }

    @PostConstruct
    void initialize() {
        try {
            Files.createDirectories(rootLocation);
            log.info("Raw video storage initialized at: {}", this.rootLocation);
        } catch (IOException e) {
            throw new VideoStorageException("Could not initialize storage directory: " + this.rootLocation, e);
        }
    }

    @Override
    public String store(MultipartFile file, String storagePath) throws VideoStorageException {
        if (file == null || file.isEmpty()) {
            throw new VideoStorageException("Failed to store empty file.");
        }
        Path destinationFile = resolveAndValidatePath(storagePath);

        if (Files.exists(destinationFile)) {
            log.warn("Refusing to overwrite existing object: {}", destinationFile);
            throw new VideoStorageException("Object already exists: " + storagePath);
        }

        try {
            Files.createDirectories(destinationFile.getParent());
            try (var inputStream = file.getInputStream()) {
                Files.copy(inputStream, destinationFile);
            }
            log.info("Stored raw video object {} ({} bytes)", storagePath, file.getSize());
            return storagePath;
        } catch (IOException e) {
            throw new VideoStorageException("Failed to store object " + storagePath, e);
        }
    }

    @Override
    public void delete(String storagePath) throws VideoStorageException {
        Path file = resolveAndValidatePath(storagePath);
        try {
            if (Files.deleteIfExists(file)) {
                log.info("Deleted raw video object: {}", storagePath);
            } else {
                log.warn("Attempted to delete non-existent object: {}", storagePath);
            }
        } catch (IOException e) {
            throw new VideoStorageException("Failed to delete object due to IO error: " + storagePath, e);
        }
    }

    @Override
    public boolean exists(String storagePath) {
        return Files.exists(resolveAndValidatePath(storagePath));
    }

    // Helper method
    private Path resolveAndValidatePath(String storagePath) throws VideoStorageException {
        if (storagePath == null || storagePath.isBlank()) {
            throw new VideoStorageException("Storage path cannot be null or blank.");
        }
        if (storagePath.contains("..") || storagePath.contains("\\") || storagePath.startsWith("/")) {
            throw new VideoStorageException("Invalid characters found in storage path: " + storagePath);
        }

        try {
            Path resolvedPath = this.rootLocation.resolve(storagePath).normalize().toAbsolutePath();
            // Subdirectories are allowed, escaping the root is not
            if (!resolvedPath.startsWith(this.rootLocation) || resolvedPath.equals(this.rootLocation)) {
                log.error("SECURITY ALERT: storage path '{}' resolves outside the storage root.", storagePath);
                throw new VideoStorageException("Security check failed: Cannot access file outside designated directory: " + storagePath);
            }
            return resolvedPath;
        } catch (InvalidPathException e) {
            throw new VideoStorageException("Invalid storage path provided: " + storagePath, e);
        }
    }
}
