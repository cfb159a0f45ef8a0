package com.scholary.songgen.config;

import com.scholary.songgen.inference.InferenceProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables "inference.*" properties for the subprocess runner. */
@Configuration
@EnableConfigurationProperties(InferenceProperties.class)
public class InferenceConfig {}
