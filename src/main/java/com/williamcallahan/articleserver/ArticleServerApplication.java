package com.williamcallahan.articleserver;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ArticleServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArticleServerApplication.class, args);
    }

}
