package com.scholary.bucket.encryptor.api;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns event notification records into per-bucket key lists.
 *
 * <p>Only "ObjectCreated*" records that name both a bucket and a key are kept. Anything else is
 * skipped without being counted as a failure. Keys arrive form-encoded (a space is "+") and are
 * decoded here.
 */
@Component
public class ObjectCreatedEventFilter {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectCreatedEventFilter.class);

  static final String OBJECT_CREATED_PREFIX = "ObjectCreated";

  /**
   * Group the accepted records' keys by bucket.
   *
   * @return bucket name to keys, both in first-seen order
   */
  public Map<String, List<String>> keysByBucket(S3EventNotification notification) {
    Map<String, List<String>> keysByBucket = new LinkedHashMap<>();

    for (S3EventNotification.EventRecord record : notification.records()) {
      String eventName = record.eventName();
      if (eventName == null || !eventName.startsWith(OBJECT_CREATED_PREFIX)) {
        LOGGER.debug("Skipping record: wrong event {}", eventName);
        continue;
      }

      String bucket = bucketName(record);
      if (bucket == null || bucket.isEmpty()) {
        LOGGER.debug("Skipping record: no bucket name");
        continue;
      }

      String key = objectKey(record);
      if (key == null || key.isEmpty()) {
        LOGGER.debug("Skipping record: no object key, bucket={}", bucket);
        continue;
      }

      keysByBucket.computeIfAbsent(bucket, b -> new ArrayList<>()).add(key);
    }

    return keysByBucket;
  }

  private static String bucketName(S3EventNotification.EventRecord record) {
    if (record.s3() == null || record.s3().bucket() == null) {
      return null;
    }
    return record.s3().bucket().name();
  }

  private static String objectKey(S3EventNotification.EventRecord record) {
    if (record.s3() == null || record.s3().object() == null || record.s3().object().key() == null) {
      return null;
    }
    String rawKey = record.s3().object().key();
    try {
      return URLDecoder.decode(rawKey, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      LOGGER.warn("Object key is not form-encoded, using it as is: key={}", rawKey);
      return rawKey;
    }
  }
}
