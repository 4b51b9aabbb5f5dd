package com.scholary.bucket.encryptor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BucketEncryptorApplication {

  public static void main(String[] args) {
    SpringApplication.run(BucketEncryptorApplication.class, args);
  }
}
