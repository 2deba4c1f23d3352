package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.Platform;
import com.example.creatorclaims.domain.RawVideoAsset;
import com.example.creatorclaims.domain.RawVideoAsset.SubmissionType;
import org.springframework.web.multipart.MultipartFile;

public interface RawVideoUploadService {

    record UploadCommand(String videoUrl,
                         Platform platform,
                         SubmissionType submissionType,
                         Long contestSubmissionId,
                         boolean ownershipRequired) {
    }

    /**
     * Validates the MP4, fingerprints its source URL, decides the initial ownership status and
     * stores it.
     *
     * @param platform may be null in the command, in which case it is detected from the URL.
     * @throws com.example.creatorclaims.exceptions.VideoValidationException for a rejected file.
     * @throws org.springframework.web.server.ResponseStatusException         400 for a bad URL or submission,
     *                                                                        404 for someone else's submission,
     *                                                                        409 when the video is already claimed.
     */
    RawVideoAsset upload(Long userId, MultipartFile file, UploadCommand command);
}
