package com.example.creatorclaims.service;

import com.example.creatorclaims.exceptions.VideoValidationException;
import org.springframework.web.multipart.MultipartFile;

public interface RawVideoUploadValidator {

    /**
     * Rejects anything that is not a plausible MP4 within the configured size limit.
     *
     * @throws VideoValidationException with 400 or 413 describing the first rule violated.
     */
    void validate(MultipartFile file) throws VideoValidationException;
}
