package com.proposalagents;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ProposalAgentsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProposalAgentsApplication.class, args);
    }
}
