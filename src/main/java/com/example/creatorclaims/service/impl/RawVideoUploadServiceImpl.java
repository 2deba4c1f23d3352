package com.example.creatorclaims.service.impl;

import com.example.creatorclaims.domain.ContestSubmission;
import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.RawVideoAsset;
import com.example.creatorclaims.domain.RawVideoAsset.OwnershipStatus;
import com.example.creatorclaims.domain.RawVideoAsset.SubmissionType;
import com.example.creatorclaims.repository.ContestSubmissionRepository;
import com.example.creatorclaims.service.OwnershipPrecheck;
import com.example.creatorclaims.service.RawVideoAssetDraft;
import com.example.creatorclaims.service.RawVideoAssetStore;
import com.example.creatorclaims.service.RawVideoUploadService;
import com.example.creatorclaims.service.RawVideoUploadValidator;
import com.example.creatorclaims.service.VideoFingerprint;
import com.example.creatorclaims.service.VideoFingerprintService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

@Service
public class RawVideoUploadServiceImpl implements RawVideoUploadService {

    private static final Logger log = LoggerFactory.getLogger(RawVideoUploadServiceImpl.class);
    private static final String MP4_EXTENSION = ".mp4";
    private static final String GENERAL_FOLDER = "general";

    private final RawVideoUploadValidator uploadValidator;
    private final VideoFingerprintService fingerprintService;
    private final OwnershipPrecheck ownershipPrecheck;
    private final RawVideoAssetStore assetStore;
    private final ContestSubmissionRepository submissionRepository;

    public RawVideoUploadServiceImpl(RawVideoUploadValidator uploadValidator,
                                     VideoFingerprintService fingerprintService,
                                     OwnershipPrecheck ownershipPrecheck,
                                     RawVideoAssetStore assetStore,
                                     ContestSubmissionRepository submissionRepository) {
        this.uploadValidator = uploadValidator;
        this.fingerprintService = fingerprintService;
        this.ownershipPrecheck = ownershipPrecheck;
        this.assetStore = assetStore;
        this.submissionRepository = submissionRepository;
    }

    @Override
    public RawVideoAsset upload(Long userId, MultipartFile file, UploadCommand command) {
        log.info("Raw video upload started for user {} ({})", userId, command.videoUrl());
        uploadValidator.validate(file);

        Platform platform = command.platform() != null ? command.platform() : Platform.detect(command.videoUrl());
        if (platform == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Unsupported video URL. Only TikTok, Instagram and YouTube links are accepted.");
        }
        VideoFingerprint fingerprint;
        try {
            fingerprint = fingerprintService.fingerprint(platform, command.videoUrl());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
        if (fingerprint.lowConfidence()) {
            log.warn("No {} video id found in '{}', using URL hash {}", platform.value(), command.videoUrl(), fingerprint.key());
        }

        String folder = GENERAL_FOLDER;
        SubmissionType submissionType = command.submissionType() != null ? command.submissionType() : SubmissionType.GENERAL;
        if (submissionType == SubmissionType.CONTEST) {
            ContestSubmission submission = requireOwnSubmission(command.contestSubmissionId(), userId);
            folder = String.valueOf(submission.getContestId());
        } else if (command.contestSubmissionId() != null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "contestSubmissionId is only allowed for contest uploads");
        }

        OwnershipPrecheck.Decision decision = command.ownershipRequired()
                ? ownershipPrecheck.check(userId, fingerprint, command.videoUrl())
                : new OwnershipPrecheck.Decision(OwnershipStatus.NOT_REQUIRED, null, "Ownership not required");

        String storagePath = folder + "/" + userId + "/" + UUID.randomUUID() + MP4_EXTENSION;
        RawVideoAssetDraft draft = new RawVideoAssetDraft(userId, submissionType, command.contestSubmissionId(),
                fingerprint, command.videoUrl().trim(), storagePath,
                decision.status(), decision.ownerSocialAccountId(), decision.reason());

        RawVideoAsset saved = assetStore.store(file, draft);
        log.info("Raw video upload finished for user {}: asset {} ownership {}", userId, saved.getId(), saved.getOwnershipStatus());
        return saved;
    }

    private ContestSubmission requireOwnSubmission(Long contestSubmissionId, Long userId) {
        if (contestSubmissionId == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "contestSubmissionId is required for contest uploads");
        }
        ContestSubmission submission = submissionRepository.findByIdAndUserId(contestSubmissionId, userId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Contest submission not found"));
        if (submission.getRawVideoAssetId() != null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "A video has already been uploaded for this submission");
        }
        return submission;
    }
}
