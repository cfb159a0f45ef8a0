package com.scholary.songgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Song generation service.
 *
 * <p>Accepts generation requests, runs them one at a time through lyrics generation, audio
 * inference and artifact upload, and exposes job status and downloads over HTTP.
 */
@SpringBootApplication
public class SongGeneratorApplication {

  public static void main(String[] args) {
    SpringApplication.run(SongGeneratorApplication.class, args);
  }
}
