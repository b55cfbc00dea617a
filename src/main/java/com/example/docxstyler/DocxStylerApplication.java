package com.example.docxstyler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DocxStylerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocxStylerApplication.class, args);
    }

}
