package com.example.creatorclaims.web.controller;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.RawVideoAsset;
import com.example.creatorclaims.domain.RawVideoAsset.SubmissionType;
import com.example.creatorclaims.service.RawVideoUploadService;
import com.example.creatorclaims.service.RawVideoUploadService.UploadCommand;
import com.example.creatorclaims.web.dto.RawVideoAssetResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;

@RestController
@RequestMapping("/api/raw-videos")
public class RawVideoController {

    private static final Logger log = LoggerFactory.getLogger(RawVideoController.class);

    private final RawVideoUploadService uploadService;

    public RawVideoController(RawVideoUploadService uploadService) {
        this.uploadService = uploadService;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RawVideoAssetResponse> uploadRawVideo(
            @RequestParam("file") MultipartFile file,
            @RequestParam("videoUrl") String videoUrl,
            @RequestParam(value = "platform", required = false) String platform,
            @RequestParam(value = "submissionType", defaultValue = "general") String submissionType,
            @RequestParam(value = "contestSubmissionId", required = false) Long contestSubmissionId,
            @RequestParam(value = "ownershipRequired", defaultValue = "true") boolean ownershipRequired,
            Authentication authentication) {

        Long userId = AuthenticatedUser.id(authentication);
        log.info("Raw video upload from user {} for {}", userId, videoUrl);

        UploadCommand command = new UploadCommand(
                videoUrl, parsePlatform(platform), parseSubmissionType(submissionType),
                contestSubmissionId, ownershipRequired);
        RawVideoAsset asset = uploadService.upload(userId, file, command);

        log.info("Controller returning CREATED for raw video {} ({})", asset.getId(), asset.getOwnershipStatus());
        return ResponseEntity.status(HttpStatus.CREATED).body(RawVideoAssetResponse.fromEntity(asset));
    }

    private static Platform parsePlatform(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Platform.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported platform: " + value, e);
        }
    }

    private static SubmissionType parseSubmissionType(String value) {
        try {
            return SubmissionType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "submissionType must be contest or general", e);
        }
    }
}
