package com.scholary.bucket.encryptor.config;

import com.scholary.bucket.encryptor.objectstore.ObjectStoreClient;
import com.scholary.bucket.encryptor.objectstore.ObjectStoreProperties;
import com.scholary.bucket.encryptor.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>This wires up the ObjectStoreClient bean using properties from application.yml. Spring will
 * inject the properties and create the client at startup, and close it on shutdown.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
