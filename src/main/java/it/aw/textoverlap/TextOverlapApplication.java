package it.aw.textoverlap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TextOverlapApplication {

    public static void main(String[] args) {
        SpringApplication.run(TextOverlapApplication.class, args);
    }
}
