package dev.pekelund.docflow.processor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application entry point for the document processing service.
 */
@SpringBootApplication(scanBasePackages = "dev.pekelund.docflow")
public class DocumentProcessorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocumentProcessorApplication.class, args);
    }
}
