package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.exceptions.VideoValidationException;
import com.example.creatorclaims.service.RawVideoUploadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Locale;

@Component
public class RawVideoUploadValidatorImpl implements RawVideoUploadValidator {

    private static final Logger log = LoggerFactory.getLogger(RawVideoUploadValidatorImpl.class);

    private static final String ALLOWED_EXTENSION = ".mp4";
    private static final String ALLOWED_CONTENT_TYPE = "video/mp4";
    // ISO base media files carry "ftyp" at offset 4
    private static final byte[] FTYP = new byte[]{0x66, 0x74, 0x79, 0x70};
    private static final int FTYP_OFFSET = 4;

    private final long maxSizeBytes;

    public RawVideoUploadValidatorImpl(@Value("${video.upload.max-size-mb:100}") long maxFileSizeMb) {
        this.maxSizeBytes = maxFileSizeMb * 1024 * 1024;
        log.info("RawVideoUploadValidator initialized with max file size: {} MB", maxFileSizeMb);
    }

    @Override
    public void validate(MultipartFile file) throws VideoValidationException {
        if (file == null || file.isEmpty()) {
            throw VideoValidationException.badRequest("A non-empty MP4 file is required");
        }
        if (file.getSize() > maxSizeBytes) {
            throw new VideoValidationException(HttpStatus.PAYLOAD_TOO_LARGE,
                    "File size (" + file.getSize() + " bytes) exceeds maximum limit of " + (maxSizeBytes / (1024 * 1024)) + "MB");
        }

        String filename = file.getOriginalFilename();
        if (filename == null || filename.isBlank()
                || filename.matches(".*\\p{Cntrl}.*") || filename.contains("..")
                || filename.contains("/") || filename.contains("\\")) {
            log.warn("Upload rejected: missing or unsafe original filename '{}'", filename);
            throw VideoValidationException.badRequest("Invalid or missing original filename.");
        }
        if (!filename.toLowerCase(Locale.ROOT).endsWith(ALLOWED_EXTENSION)) {
            throw VideoValidationException.badRequest("Invalid file type. Only " + ALLOWED_EXTENSION + " files are allowed.");
        }
        if (!ALLOWED_CONTENT_TYPE.equalsIgnoreCase(file.getContentType())) {
            log.warn("Upload rejected: content type '{}' for '{}'", file.getContentType(), filename);
            throw VideoValidationException.badRequest("Invalid content type detected. Expected " + ALLOWED_CONTENT_TYPE + ".");
        }

        try {
            if (!hasFtypBox(file)) {
                log.warn("Upload rejected: '{}' failed magic byte validation", filename);
                throw VideoValidationException.badRequest("File content does not appear to be a valid MP4 video.");
            }
        } catch (IOException e) {
            throw new VideoValidationException(HttpStatus.INTERNAL_SERVER_ERROR, "Error reading file for validation.", e);
        }
        log.debug("Raw video '{}' passed validation", filename);
    }

    private boolean hasFtypBox(MultipartFile file) throws IOException {
        try (InputStream inputStream = file.getInputStream()) {
            byte[] head = inputStream.readNBytes(FTYP_OFFSET + FTYP.length);
            if (head.length < FTYP_OFFSET + FTYP.length) {
                return false;
            }
            return Arrays.equals(FTYP, Arrays.copyOfRange(head, FTYP_OFFSET, FTYP_OFFSET + FTYP.length));
        }
    }
}
