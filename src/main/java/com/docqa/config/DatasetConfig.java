package com.docqa.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import lombok.Data;

/**
 * Location of the chunk store written by the ingestion side.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "doc-qa.dataset")
public class DatasetConfig {

    /**
     * JSON file holding documents, their status and their embedded chunks
     */
    private String chunks = "data/chunks.json";
}
