package org.example.pdfchat;

import org.example.pdfchat.config.AppProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class PdfChatApplication {
    public static void main(String[] args) {
        SpringApplication.run(PdfChatApplication.class, args);
    }
}
