package com.example.creatorclaims.repository;

import com.example.creatorclaims.domain.ContestSubmission;
import com.example.creatorclaims.domain.Platform;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface ContestSubmissionRepository extends CrudRepository<ContestSubmission, Long> {

    List<ContestSubmission> findByRawVideoAssetId(Long rawVideoAssetId);

    Optional<ContestSubmission> findByIdAndUserId(Long id, Long userId);

    List<ContestSubmission> findByUserIdAndPlatformAndSocialAccountIdIsNull(Long userId, Platform platform);
}
