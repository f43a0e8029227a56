package com.flamingo.inboundmail;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Inbound mail ingestion and PDF text extraction service. */
@SpringBootApplication
public class InboundMailApplication {

  public static void main(String[] args) {
    SpringApplication.run(InboundMailApplication.class, args);
  }
}
