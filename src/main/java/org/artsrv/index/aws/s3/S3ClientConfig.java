package org.artsrv.index.aws.s3;

import org.artsrv.index.aws.ArtSrvAwsProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * Builds the shared {@link S3Client}. Read credentials come from the default provider chain.
 */
@Configuration
public class S3ClientConfig {

    @Bean
    public S3Client s3Client(ArtSrvAwsProperties props) {
        ArtSrvAwsProperties.S3Properties s3Props = props.s3();
        boolean pathStyle = s3Props != null && s3Props.pathStyleAccess();

        S3ClientBuilder b = S3Client.builder()
                .credentialsProvider(DefaultCredentialsProvider.create())
                .region(Region.of(props.region() == null || props.region().isBlank() ? "us-east-1" : props.region()))
                .serviceConfiguration(
                        S3Configuration.builder()
                                .pathStyleAccessEnabled(pathStyle)
                                .build()
                );

        if (s3Props != null && s3Props.endpoint() != null && !s3Props.endpoint().isBlank()) {
            b = b.endpointOverride(URI.create(s3Props.endpoint()));
        }

        return b.build();
    }
}
