package com.example.docx2md;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Docx2mdApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(Docx2mdApplication.class);
        // A document argument means a one-shot command line conversion, no server
        if (args.length > 0) {
            application.setWebApplicationType(WebApplicationType.NONE);
        }
        application.run(args);
    }
}
