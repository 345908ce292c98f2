package org.artsrv.index.aws;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "art-srv.aws")
public record ArtSrvAwsProperties(
        String region,
        S3Properties s3
) {
    public record S3Properties(
            String endpoint,
            boolean pathStyleAccess
    ) {}
}
