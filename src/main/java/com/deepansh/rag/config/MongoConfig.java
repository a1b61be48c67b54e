package com.deepansh.rag.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;

/**
 * Enable MongoDB auditing so @CreatedDate and @LastModifiedDate
 * are automatically populated on chat history documents.
 */
@Configuration
@EnableMongoAuditing
public class MongoConfig {
}
