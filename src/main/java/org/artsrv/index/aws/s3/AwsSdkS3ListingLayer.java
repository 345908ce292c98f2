package org.artsrv.index.aws.s3;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CommonPrefix;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;

@Service
public class AwsSdkS3ListingLayer implements S3ListingLayer {
    private static final Logger logger = LoggerFactory.getLogger(AwsSdkS3ListingLayer.class);
    private final S3Client s3;

    public AwsSdkS3ListingLayer(S3Client s3) {
        this.s3 = s3;
    }

    @Override
    public S3Models.ListPage listPage(String bucket, String prefix, String delimiter, String continuationToken, int maxKeys) {
        try {
            ListObjectsV2Request.Builder req = ListObjectsV2Request.builder()
                    .bucket(bucket)
                    .prefix(prefix == null ? "" : prefix)
                    .maxKeys(Math.max(1, maxKeys));

            if (delimiter != null && !delimiter.isEmpty()) req = req.delimiter(delimiter);
            if (continuationToken != null && !continuationToken.isEmpty()) req = req.continuationToken(continuationToken);

            ListObjectsV2Response r = s3.listObjectsV2(req.build());

            List<String> prefixes = new ArrayList<>();
            if (r.commonPrefixes() != null) {
                for (CommonPrefix cp : r.commonPrefixes()) {
                    prefixes.add(cp.prefix());
                }
            }
            List<S3Models.ObjectSummary> contents = new ArrayList<>();
            if (r.contents() != null) {
                for (S3Object o : r.contents()) {
                    contents.add(new S3Models.ObjectSummary(o.key(), o.size(), o.lastModified()));
                }
            }
            return new S3Models.ListPage(prefixes, contents, Boolean.TRUE.equals(r.isTruncated()), r.nextContinuationToken());
        } catch (SdkException e) {
            logger.error("S3 list failed for bucket={} prefix={} continuation={}", bucket, prefix, continuationToken, e);
            throw new S3AccessException("S3 list failed: bucket=" + bucket + " prefix=" + prefix, e);
        }
    }
}
