package com.williamcallahan.gemtext;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class GemtextApplication {

    public static void main(String[] args) {
        SpringApplication.run(GemtextApplication.class, args);
    }

}
