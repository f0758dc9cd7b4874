package com.flamingo.ai.knowledge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the knowledge base ingestion and retrieval service. */
@SpringBootApplication
public class KnowledgeApplication {

  public static void main(String[] args) {
    SpringApplication.run(KnowledgeApplication.class, args);
  }
}
