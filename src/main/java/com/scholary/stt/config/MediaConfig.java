package com.scholary.stt.config;

import com.scholary.stt.media.MediaProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables {@link MediaProperties} binding from application.yml. */
@Configuration
@EnableConfigurationProperties(MediaProperties.class)
public class MediaConfig {}
