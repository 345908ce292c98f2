package org.artsrv.index.aws.s3;

import java.time.Instant;
import java.util.List;

public final class S3Models {

    private S3Models() {}

    /** One object row of a delimited listing. */
    public record ObjectSummary(
            String key,
            Long size,
            Instant lastModified
    ) {}

    /**
     * One page of a delimited listing call. {@code commonPrefixes} are the virtual folders
     * directly under the queried prefix, {@code contents} the objects.
     */
    public record ListPage(
            List<String> commonPrefixes,
            List<ObjectSummary> contents,
            boolean truncated,
            String nextContinuationToken
    ) {
        public ListPage {
            commonPrefixes = commonPrefixes == null ? List.of() : List.copyOf(commonPrefixes);
            contents = contents == null ? List.of() : List.copyOf(contents);
        }
    }
}
