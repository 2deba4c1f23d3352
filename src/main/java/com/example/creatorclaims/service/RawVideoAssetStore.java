package com.example.creatorclaims.service;

import com.example.creatorclaims.domain.RawVideoAsset;
import com.example.creatorclaims.exceptions.AssetPersistenceException;
import com.example.creatorclaims.exceptions.UploadException;
import org.springframework.web.multipart.MultipartFile;

/**
 * Persists uploaded raw videos: object first, metadata second, claim last.
 */
public interface RawVideoAssetStore {

    /**
     * Writes the object to storage, then inserts the asset row and registers the derived claim
     * in one transaction. If that transaction fails the object is deleted again.
     *
     * @param file  the validated upload.
     * @param draft the asset to create.
     * @return the saved asset.
     * @throws UploadException           if the object write fails; nothing was persisted.
     * @throws AssetPersistenceException if the metadata write fails after the object write.
     */
    RawVideoAsset store(MultipartFile file, RawVideoAssetDraft draft);
}
