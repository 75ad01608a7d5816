package ru.javaboys.cvchecker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CvCheckerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CvCheckerApplication.class, args);
    }
}
