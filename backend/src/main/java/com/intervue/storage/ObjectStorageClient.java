package com.intervue.storage;

/**
 * Object storage hosting submission attachments.
 */
public interface ObjectStorageClient {

    /**
     * Uploads bytes to {@code destinationPath} and returns the object's public URL.
     */
    String put(byte[] bytes, String destinationPath, String contentType);

    /**
     * Returns a temporary signed URL for an existing object.
     */
    String sign(String objectPath, long ttlSeconds);
}
