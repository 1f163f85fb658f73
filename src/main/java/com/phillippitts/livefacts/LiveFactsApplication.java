package com.phillippitts.livefacts;

import com.phillippitts.livefacts.config.properties.ThreadPoolProperties;
import com.phillippitts.livefacts.config.properties.TrackingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        TrackingProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class LiveFactsApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiveFactsApplication.class, args);
    }

}
