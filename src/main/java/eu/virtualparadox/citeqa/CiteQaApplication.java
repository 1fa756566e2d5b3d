package eu.virtualparadox.citeqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CiteQaApplication {

    public static void main(String[] args) {
        SpringApplication.run(CiteQaApplication.class, args);
    }
}
