package com.phillippitts.jobverdict;

import com.phillippitts.jobverdict.config.properties.ConsensusProperties;
import com.phillippitts.jobverdict.config.properties.LlmClientProperties;
import com.phillippitts.jobverdict.config.properties.LocationValidationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        ConsensusProperties.class,
        LocationValidationProperties.class,
        LlmClientProperties.class
})
@EnableScheduling
public class JobVerdictApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobVerdictApplication.class, args);
    }

}
