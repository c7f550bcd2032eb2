package com.kbsearch.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.kbsearch")
@EntityScan("com.kbsearch.data.entity")
@EnableJpaRepositories("com.kbsearch.data.repository")
public class KnowledgeSearchApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(KnowledgeSearchApplication.class, args);
    }
}
