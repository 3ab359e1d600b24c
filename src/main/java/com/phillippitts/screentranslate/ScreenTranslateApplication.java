package com.phillippitts.screentranslate;

import com.phillippitts.screentranslate.config.properties.VisionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(VisionProperties.class)
@EnableScheduling
public class ScreenTranslateApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScreenTranslateApplication.class, args);
    }

}
