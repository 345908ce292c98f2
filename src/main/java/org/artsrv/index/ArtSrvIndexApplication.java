package org.artsrv.index;

import org.artsrv.index.aws.ArtSrvAwsProperties;
import org.artsrv.index.listing.ListingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ArtSrvAwsProperties.class, ListingProperties.class})
public class ArtSrvIndexApplication {

	public static void main(String[] args) {
		SpringApplication.run(ArtSrvIndexApplication.class, args);
	}
}
